package com.aiprofessor.security;

import java.time.Duration;

/**
 * Signing configuration for {@link JwtTokenService}.
 *
 * @param secret     HMAC-SHA256 secret
 * @param issuer     value of the {@code iss} claim, checked on verification
 * @param accessTtl  lifetime of access tokens
 * @param refreshTtl lifetime of refresh tokens
 */
public record TokenSettings(String secret, String issuer, Duration accessTtl, Duration refreshTtl) {

    public static final Duration DEFAULT_ACCESS_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(30);

    public TokenSettings {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        if (accessTtl == null) {
            accessTtl = DEFAULT_ACCESS_TTL;
        }
        if (refreshTtl == null) {
            refreshTtl = DEFAULT_REFRESH_TTL;
        }
        if (accessTtl.isNegative() || accessTtl.isZero() || refreshTtl.isNegative() || refreshTtl.isZero()) {
            throw new IllegalArgumentException("token lifetimes must be positive");
        }
    }
}
