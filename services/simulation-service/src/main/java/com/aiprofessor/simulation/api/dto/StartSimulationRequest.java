package com.aiprofessor.simulation.api.dto;

import com.aiprofessor.simulation.domain.SimulationMode;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/simulation/start}.
 *
 * @param tenantId required for super admins, ignored for school staff
 */
public record StartSimulationRequest(
        @JsonProperty("student_id") @NotBlank String studentId,
        @JsonProperty("simulation_mode") @NotNull SimulationMode simulationMode,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("purpose") @Size(max = 500) String purpose) {}
