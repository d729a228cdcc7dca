package com.aiprofessor.security;

import java.util.Locale;

/**
 * Languages the platform answers in. French is the fallback for anything unrecognised.
 */
public enum Language {

    EN("en", Locale.ENGLISH),
    FR("fr", Locale.FRENCH);

    public static final Language DEFAULT = FR;

    private final String code;
    private final Locale locale;

    Language(String code, Locale locale) {
        this.code = code;
        this.locale = locale;
    }

    public String code() {
        return code;
    }

    public Locale locale() {
        return locale;
    }

    /**
     * Resolves an ISO code ({@code en}, {@code fr-CA}, ...) to a language, falling back to {@link #DEFAULT}.
     */
    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        String normalized = code.strip().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (normalized.equals(language.code) || normalized.startsWith(language.code + "-")) {
                return language;
            }
        }
        return DEFAULT;
    }
}
