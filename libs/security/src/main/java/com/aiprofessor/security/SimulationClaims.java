package com.aiprofessor.security;

/**
 * Marks a credential as a simulation credential: a staff member viewing the platform as a student.
 *
 * @param sessionId        simulation session the credential is bound to
 * @param originalUserId   staff member who started the simulation
 * @param originalUserRole role of that staff member
 */
public record SimulationClaims(String sessionId, String originalUserId, Role originalUserRole) {

    public SimulationClaims {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be null or blank");
        }
        if (originalUserId == null || originalUserId.isBlank()) {
            throw new IllegalArgumentException("originalUserId must not be null or blank");
        }
        if (originalUserRole == null) {
            throw new IllegalArgumentException("originalUserRole must not be null");
        }
    }
}
