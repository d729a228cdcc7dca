package com.aiprofessor.simulation.domain.tenant;

import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.Role;
import com.aiprofessor.simulation.domain.error.SimulationForbiddenException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Role-keyed tenant resolution. A role without a strategy may not act on tenant data here.
 */
public class TenantResolver {

    private final Map<Role, TenantResolutionStrategy> strategies;

    public TenantResolver(Map<Role, TenantResolutionStrategy> strategies) {
        this.strategies = strategies.isEmpty() ? new EnumMap<>(Role.class) : new EnumMap<>(strategies);
    }

    /** Super admins name the tenant, school admins and professors use their own. */
    public static TenantResolver standard() {
        Map<Role, TenantResolutionStrategy> strategies = new EnumMap<>(Role.class);
        strategies.put(Role.SUPER_ADMIN, StandardTenantStrategy.EXPLICIT_REQUEST);
        strategies.put(Role.SCHOOL_ADMIN, StandardTenantStrategy.CALLER_TENANT);
        strategies.put(Role.PROFESSOR, StandardTenantStrategy.CALLER_TENANT);
        return new TenantResolver(strategies);
    }

    public boolean supports(Role role) {
        return strategies.containsKey(role);
    }

    public String resolve(PlatformSecurityContext caller, String requestedTenantId) {
        TenantResolutionStrategy strategy = strategies.get(caller.role());
        if (strategy == null) {
            throw new SimulationForbiddenException("simulation.role-not-allowed");
        }
        return strategy.resolve(caller, requestedTenantId);
    }
}
