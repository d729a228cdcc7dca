package com.aiprofessor.security;

/**
 * Access and refresh credentials issued together.
 *
 * @param accessToken           signed access token
 * @param refreshToken          signed refresh token
 * @param accessTokenExpiresIn  access token lifetime in seconds
 * @param refreshTokenExpiresIn refresh token lifetime in seconds
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        long accessTokenExpiresIn,
        long refreshTokenExpiresIn
) {

    private static final TokenPair EMPTY = new TokenPair("", "", 0, 0);

    /**
     * Pair returned when nothing was issued, e.g. ending a simulation that no longer exists.
     */
    public static TokenPair empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return accessToken.isEmpty() && refreshToken.isEmpty();
    }
}
