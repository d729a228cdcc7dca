package com.aiprofessor.simulation.config;

import com.aiprofessor.security.TokenSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credential signing settings, bound from {@code aiprofessor.jwt.*}.
 *
 * @param secret HMAC-SHA256 secret, at least 32 characters
 * @param issuer {@code iss} claim
 * @param accessTtl access token lifetime, default 15 minutes
 * @param refreshTtl refresh token lifetime, default 30 days
 */
@ConfigurationProperties(prefix = "aiprofessor.jwt")
@Validated
public record JwtProperties(
        @NotBlank @Size(min = 32) String secret,
        String issuer,
        Duration accessTtl,
        Duration refreshTtl) {

    public JwtProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = "aiprofessor";
        }
    }

    public TokenSettings toTokenSettings() {
        return new TokenSettings(secret, issuer, accessTtl, refreshTtl);
    }
}
