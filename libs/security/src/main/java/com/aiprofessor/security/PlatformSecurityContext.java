package com.aiprofessor.security;

import java.util.Optional;

/**
 * Verified principal of the current request.
 * <p>
 * Under simulation, {@link #user()} is the simulated student and {@link #simulation()} names the
 * staff member behind it.
 *
 * @param user       identity the credential was issued to
 * @param simulation simulation claims, null for an ordinary credential
 */
public record PlatformSecurityContext(AuthenticatedUser user, SimulationClaims simulation) {

    public PlatformSecurityContext {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
    }

    public static PlatformSecurityContext of(AuthenticatedUser user) {
        return new PlatformSecurityContext(user, null);
    }

    public boolean isSimulation() {
        return simulation != null;
    }

    public Optional<SimulationClaims> simulationClaims() {
        return Optional.ofNullable(simulation);
    }

    public String userId() {
        return user.userId();
    }

    public Role role() {
        return user.role();
    }

    public String tenantId() {
        return user.tenantId();
    }

    public Language language() {
        return user.preferredLanguage();
    }
}
