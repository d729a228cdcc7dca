package com.aiprofessor.simulation.infrastructure.web;

import com.aiprofessor.security.Language;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

/** Resolves message keys in the caller's language. */
@Component
public class LocalizedMessages {

    private final MessageSource messageSource;

    public LocalizedMessages(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    public String get(Language language, String key, Object... arguments) {
        return messageSource.getMessage(key, arguments, key, language.locale());
    }

    /**
     * Language of the authenticated caller, else the first {@code Accept-Language} entry, else
     * {@link Language#DEFAULT}.
     */
    public static Language languageOf(HttpServletRequest request) {
        return RequestSecurityContext.find(request)
                .map(context -> context.language())
                .orElseGet(() -> fromAcceptLanguage(request.getHeader("Accept-Language")));
    }

    private static Language fromAcceptLanguage(String header) {
        if (header == null || header.isBlank()) {
            return Language.DEFAULT;
        }
        String first = header.split(",", 2)[0];
        return Language.fromCode(first.split(";", 2)[0].strip());
    }
}
