package com.aiprofessor.simulation.domain.tenant;

import com.aiprofessor.security.PlatformSecurityContext;

/** Decides which tenant a staff member acts in. */
@FunctionalInterface
public interface TenantResolutionStrategy {

    /**
     * @param caller authenticated staff member
     * @param requestedTenantId tenant named in the request, nullable
     * @return the tenant id, never blank
     * @throws com.aiprofessor.simulation.domain.error.SimulationBadRequestException if no tenant
     *     can be determined
     */
    String resolve(PlatformSecurityContext caller, String requestedTenantId);
}
