package com.aiprofessor.simulation.domain;

import com.aiprofessor.security.Role;
import java.time.Instant;

/** What the caller's credential says about simulation mode. */
public record SimulationStatusView(
        boolean inSimulation,
        String sessionId,
        SimulationMode mode,
        String studentId,
        String studentName,
        Instant startedAt,
        Role originalUserRole) {

    public static SimulationStatusView notInSimulation() {
        return new SimulationStatusView(false, null, null, null, null, null, null);
    }

    public static SimulationStatusView of(SimulationSession session) {
        return new SimulationStatusView(
                true,
                session.id(),
                session.mode(),
                session.simulatedStudentId(),
                session.simulatedStudentName(),
                session.startedAt(),
                session.originalUserRole());
    }
}
