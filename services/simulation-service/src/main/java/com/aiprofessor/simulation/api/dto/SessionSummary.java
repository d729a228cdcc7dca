package com.aiprofessor.simulation.api.dto;

import com.aiprofessor.simulation.domain.SimulationMode;
import com.aiprofessor.simulation.domain.SimulationSession;
import com.aiprofessor.simulation.domain.SimulationStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record SessionSummary(
        @JsonProperty("id") String id,
        @JsonProperty("original_user_id") String originalUserId,
        @JsonProperty("original_user_role") String originalUserRole,
        @JsonProperty("simulated_student_id") String simulatedStudentId,
        @JsonProperty("simulated_student_name") String simulatedStudentName,
        @JsonProperty("simulated_student_email") String simulatedStudentEmail,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("tenant_name") String tenantName,
        @JsonProperty("simulation_mode") SimulationMode simulationMode,
        @JsonProperty("status") SimulationStatus status,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("ended_at") Instant endedAt,
        @JsonProperty("duration_seconds") Long durationSeconds,
        @JsonProperty("pages_visited") List<String> pagesVisited,
        @JsonProperty("modules_viewed") int modulesViewed,
        @JsonProperty("quizzes_viewed") int quizzesViewed,
        @JsonProperty("ai_chats_opened") int aiChatsOpened,
        @JsonProperty("purpose") String purpose) {

    public static SessionSummary of(SimulationSession session) {
        return new SessionSummary(
                session.id(),
                session.originalUserId(),
                session.originalUserRole().value(),
                session.simulatedStudentId(),
                session.simulatedStudentName(),
                session.simulatedStudentEmail(),
                session.tenantId(),
                session.tenantName(),
                session.mode(),
                session.status(),
                session.startedAt(),
                session.endedAt(),
                session.durationSeconds(),
                List.copyOf(session.pagesVisited()),
                session.modulesViewed(),
                session.quizzesViewed(),
                session.aiChatsOpened(),
                session.purpose());
    }
}
