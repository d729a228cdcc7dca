package com.aiprofessor.security;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.JWTVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies the platform's HMAC-SHA256 signed credentials.
 * <p>
 * Ordinary credentials carry the user's identity. Simulation credentials are issued to the
 * simulated student and additionally carry {@code is_simulation}, {@code simulation_session_id},
 * {@code original_user_id} and {@code original_user_role}.
 */
public class JwtTokenService {

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_TENANT_ID = "tenant_id";
    public static final String CLAIM_LANGUAGE = "preferred_language";
    public static final String CLAIM_TOKEN_TYPE = "token_type";
    public static final String CLAIM_IS_SIMULATION = "is_simulation";
    public static final String CLAIM_SIMULATION_SESSION_ID = "simulation_session_id";
    public static final String CLAIM_ORIGINAL_USER_ID = "original_user_id";
    public static final String CLAIM_ORIGINAL_USER_ROLE = "original_user_role";

    private final TokenSettings settings;
    private final Algorithm algorithm;
    private final Clock clock;

    public JwtTokenService(TokenSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public JwtTokenService(TokenSettings settings, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.settings = settings;
        this.algorithm = Algorithm.HMAC256(settings.secret());
        this.clock = clock;
    }

    /**
     * Issues an ordinary access/refresh pair for {@code user}.
     */
    public TokenPair issue(AuthenticatedUser user) {
        return issuePair(user, null);
    }

    /**
     * Issues a simulation pair: {@code student} is the subject, {@code simulation} names the staff
     * member and the session the pair is bound to.
     */
    public TokenPair issueSimulation(AuthenticatedUser student, SimulationClaims simulation) {
        if (simulation == null) {
            throw new IllegalArgumentException("simulation must not be null");
        }
        return issuePair(student, simulation);
    }

    /**
     * Verifies signature, issuer, expiry and token type, and rebuilds the principal.
     *
     * @throws InvalidTokenException when any check fails or a required claim is missing
     */
    public PlatformSecurityContext verify(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("token must not be blank");
        }
        DecodedJWT jwt;
        try {
            com.auth0.jwt.JWTVerifier.BaseVerification verification =
                    (com.auth0.jwt.JWTVerifier.BaseVerification) JWT.require(algorithm)
                    .withIssuer(settings.issuer())
                    .withClaim(CLAIM_TOKEN_TYPE, expectedType.claimValue());
            JWTVerifier verifier = verification.build(clock);
            jwt = verifier.verify(token);
        } catch (JWTVerificationException e) {
            throw new InvalidTokenException("Invalid " + expectedType.claimValue() + " token: " + e.getMessage(), e);
        }

        Role role = Role.fromString(jwt.getClaim(CLAIM_ROLE).asString())
                .orElseThrow(() -> new InvalidTokenException("Token carries an unknown role"));
        AuthenticatedUser user;
        try {
            user = new AuthenticatedUser(
                    jwt.getSubject(),
                    jwt.getClaim(CLAIM_EMAIL).asString(),
                    role,
                    jwt.getClaim(CLAIM_TENANT_ID).asString(),
                    Language.fromCode(jwt.getClaim(CLAIM_LANGUAGE).asString()));
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Token is missing identity claims", e);
        }
        return new PlatformSecurityContext(user, simulationClaims(jwt));
    }

    public TokenSettings settings() {
        return settings;
    }

    private TokenPair issuePair(AuthenticatedUser user, SimulationClaims simulation) {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
        Instant now = clock.instant();
        String access = sign(user, simulation, TokenType.ACCESS, now, settings.accessTtl());
        String refresh = sign(user, simulation, TokenType.REFRESH, now, settings.refreshTtl());
        return new TokenPair(access, refresh, settings.accessTtl().toSeconds(), settings.refreshTtl().toSeconds());
    }

    private String sign(AuthenticatedUser user, SimulationClaims simulation, TokenType type,
                        Instant now, Duration ttl) {
        JWTCreator.Builder builder = JWT.create()
                .withIssuer(settings.issuer())
                .withSubject(user.userId())
                .withIssuedAt(Date.from(now))
                .withExpiresAt(Date.from(now.plus(ttl)))
                .withClaim(CLAIM_ROLE, user.role().value())
                .withClaim(CLAIM_LANGUAGE, user.preferredLanguage().code())
                .withClaim(CLAIM_TOKEN_TYPE, type.claimValue());
        if (user.email() != null) {
            builder.withClaim(CLAIM_EMAIL, user.email());
        }
        if (user.hasTenant()) {
            builder.withClaim(CLAIM_TENANT_ID, user.tenantId());
        }
        if (simulation != null) {
            builder.withClaim(CLAIM_IS_SIMULATION, Boolean.TRUE)
                    .withClaim(CLAIM_SIMULATION_SESSION_ID, simulation.sessionId())
                    .withClaim(CLAIM_ORIGINAL_USER_ID, simulation.originalUserId())
                    .withClaim(CLAIM_ORIGINAL_USER_ROLE, simulation.originalUserRole().value());
        }
        return builder.sign(algorithm);
    }

    private static SimulationClaims simulationClaims(DecodedJWT jwt) {
        Claim flag = jwt.getClaim(CLAIM_IS_SIMULATION);
        if (flag.isMissing() || flag.isNull() || !Boolean.TRUE.equals(flag.asBoolean())) {
            return null;
        }
        Role originalRole = Role.fromString(jwt.getClaim(CLAIM_ORIGINAL_USER_ROLE).asString())
                .orElseThrow(() -> new InvalidTokenException("Simulation token carries an unknown original role"));
        try {
            return new SimulationClaims(
                    jwt.getClaim(CLAIM_SIMULATION_SESSION_ID).asString(),
                    jwt.getClaim(CLAIM_ORIGINAL_USER_ID).asString(),
                    originalRole);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Simulation token is missing simulation claims", e);
        }
    }
}
