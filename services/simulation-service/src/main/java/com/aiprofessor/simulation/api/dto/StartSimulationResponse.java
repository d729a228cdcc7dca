package com.aiprofessor.simulation.api.dto;

import com.aiprofessor.simulation.domain.SimulationMode;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Scoped credentials for the simulated student plus what the UI shows about the session. */
public record StartSimulationResponse(
        @JsonProperty("message") String message,
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("simulation_session_id") String simulationSessionId,
        @JsonProperty("simulation_mode") SimulationMode simulationMode,
        @JsonProperty("student") StudentSummary student,
        @JsonProperty("tenant") TenantSummary tenant) {}
