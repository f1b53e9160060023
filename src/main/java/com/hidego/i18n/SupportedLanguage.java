package com.hidego.i18n;

import java.util.Locale;

public enum SupportedLanguage {

    EN("en", Locale.ENGLISH),
    FA("fa", Locale.forLanguageTag("fa"));

    private final String code;
    private final Locale locale;

    SupportedLanguage(String code, Locale locale) {
        this.code = code;
        this.locale = locale;
    }

    public String code() { return code; }
    public Locale locale() { return locale; }

    /** Persian for {@code fa*} language codes, English for everything else. */
    public static SupportedLanguage resolve(String languageCode) {
        if (languageCode != null && languageCode.toLowerCase(Locale.ROOT).startsWith(FA.code)) {
            return FA;
        }
        return EN;
    }
}
