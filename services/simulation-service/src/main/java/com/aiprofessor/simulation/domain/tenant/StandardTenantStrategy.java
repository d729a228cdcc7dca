package com.aiprofessor.simulation.domain.tenant;

import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.simulation.domain.error.SimulationBadRequestException;

/** The two ways a tenant is chosen on this platform. */
public enum StandardTenantStrategy implements TenantResolutionStrategy {

    /** Platform-wide staff must name the tenant in the request. */
    EXPLICIT_REQUEST {
        @Override
        public String resolve(PlatformSecurityContext caller, String requestedTenantId) {
            if (isBlank(requestedTenantId)) {
                throw new SimulationBadRequestException("simulation.tenant-required");
            }
            return requestedTenantId.strip();
        }
    },

    /** School staff always act in their own school; a requested tenant is ignored. */
    CALLER_TENANT {
        @Override
        public String resolve(PlatformSecurityContext caller, String requestedTenantId) {
            if (isBlank(caller.tenantId())) {
                throw new SimulationBadRequestException("simulation.caller-tenant-missing");
            }
            return caller.tenantId();
        }
    };

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
