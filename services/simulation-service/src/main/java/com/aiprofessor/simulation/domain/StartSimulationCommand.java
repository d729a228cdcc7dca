package com.aiprofessor.simulation.domain;

/**
 * Request to start a simulation.
 *
 * @param studentId student to impersonate
 * @param mode simulation mode, defaults to {@link SimulationMode#DEFAULT}
 * @param tenantId explicit tenant, required for super admins and ignored otherwise
 * @param purpose free text kept for audit
 * @param origin client address and user agent
 */
public record StartSimulationCommand(
        String studentId, SimulationMode mode, String tenantId, String purpose, RequestOrigin origin) {

    public StartSimulationCommand {
        if (studentId == null || studentId.isBlank()) {
            throw new IllegalArgumentException("studentId must not be null or blank");
        }
        if (mode == null) {
            mode = SimulationMode.DEFAULT;
        }
        if (origin == null) {
            origin = RequestOrigin.unknown();
        }
    }
}
