package com.hidego.support;

import com.hidego.i18n.ResponseTexts;
import org.springframework.context.support.ResourceBundleMessageSource;

/**
 * {@link ResponseTexts} over the real message bundles, configured as the application does.
 */
public final class TestTexts {

    private TestTexts() {}

    public static ResponseTexts create() {
        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBasename("messages");
        source.setDefaultEncoding("UTF-8");
        source.setFallbackToSystemLocale(false);
        source.setAlwaysUseMessageFormat(true);
        return new ResponseTexts(source);
    }
}
