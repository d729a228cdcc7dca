package com.aiprofessor.security;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the raw token out of an {@code Authorization} header value.
 */
public final class BearerTokenExtractor {

    private static final Pattern BEARER = Pattern.compile("^\\s*bearer\\s+(\\S+)\\s*$", Pattern.CASE_INSENSITIVE);

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Returns the token of a {@code Bearer <token>} header; the scheme is matched case-insensitively.
     * Any other shape, including a missing token or extra words, yields empty.
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = BEARER.matcher(authorizationHeader);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }
}
