package com.aiprofessor.security;

/**
 * Stateless role checks against a {@link PlatformSecurityContext}.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * True for a staff member acting under their own credential; false for students and for
     * any simulation credential.
     */
    public static boolean isActingStaff(PlatformSecurityContext context) {
        return !context.isSimulation() && context.role().isStaff();
    }
}
