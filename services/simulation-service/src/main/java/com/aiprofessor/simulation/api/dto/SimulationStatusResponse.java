package com.aiprofessor.simulation.api.dto;

import com.aiprofessor.simulation.domain.SimulationMode;
import com.aiprofessor.simulation.domain.SimulationStatusView;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record SimulationStatusResponse(
        @JsonProperty("is_simulation") boolean simulation,
        @JsonProperty("simulation_session_id") String simulationSessionId,
        @JsonProperty("simulation_mode") SimulationMode simulationMode,
        @JsonProperty("student_id") String studentId,
        @JsonProperty("student_name") String studentName,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("original_user_role") String originalUserRole) {

    public static SimulationStatusResponse of(SimulationStatusView view) {
        return new SimulationStatusResponse(
                view.inSimulation(),
                view.sessionId(),
                view.mode(),
                view.studentId(),
                view.studentName(),
                view.startedAt(),
                view.originalUserRole() == null ? null : view.originalUserRole().value());
    }
}
