package com.aiprofessor.simulation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Staff credentials after leaving simulation. Tokens are empty and {@code session} is null when
 * there was nothing to end.
 */
public record EndSimulationResponse(
        @JsonProperty("message") String message,
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("session") SessionSummary session) {}
