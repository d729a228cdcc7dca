package com.aiprofessor.simulation.domain;

import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.Role;
import com.aiprofessor.simulation.domain.error.SimulationBadRequestException;
import com.aiprofessor.simulation.domain.error.SimulationForbiddenException;

/**
 * Which sessions a staff member may list in the history.
 *
 * @param tenantId restrict to sessions in this tenant, null for no restriction
 * @param originalUserId restrict to sessions started by this user, null for no restriction
 */
public record HistoryScope(String tenantId, String originalUserId) {

    public static HistoryScope everything() {
        return new HistoryScope(null, null);
    }

    public static HistoryScope tenant(String tenantId) {
        return new HistoryScope(tenantId, null);
    }

    public static HistoryScope user(String userId) {
        return new HistoryScope(null, userId);
    }

    /**
     * Super admins see every session, school admins the sessions of their school, professors
     * their own. A school admin without a tenant is rejected rather than widened to every tenant.
     */
    public static HistoryScope forCaller(PlatformSecurityContext caller) {
        if (caller.isSimulation()) {
            throw new SimulationForbiddenException("simulation.role-not-allowed");
        }
        Role role = caller.role();
        switch (role) {
            case SUPER_ADMIN:
                return everything();
            case SCHOOL_ADMIN:
                if (!caller.user().hasTenant()) {
                    throw new SimulationBadRequestException("simulation.caller-tenant-missing");
                }
                return tenant(caller.tenantId());
            case PROFESSOR:
                return user(caller.userId());
            default:
                throw new SimulationForbiddenException("simulation.role-not-allowed");
        }
    }
}
