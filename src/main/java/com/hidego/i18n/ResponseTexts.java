package com.hidego.i18n;

import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

/**
 * Localized user-facing texts. Arguments follow {@link java.text.MessageFormat} rules.
 */
@Component
public class ResponseTexts {

    private final MessageSource messageSource;

    public ResponseTexts(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public String get(ResponseKey key, String languageCode, Object... args) {
        return get(key, SupportedLanguage.resolve(languageCode), args);
    }

    public String get(ResponseKey key, SupportedLanguage language, Object... args) {
        return messageSource.getMessage(key.code(), args, language.locale());
    }
}
