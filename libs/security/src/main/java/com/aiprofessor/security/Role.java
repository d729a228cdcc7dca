package com.aiprofessor.security;

import java.util.Optional;

/**
 * Platform roles as carried in the {@code role} claim of an access token.
 */
public enum Role {

    /** Platform operator; not bound to a single school. */
    SUPER_ADMIN("SUPER_ADMIN"),

    /** Administrator of one school. */
    SCHOOL_ADMIN("SCHOOL_ADMIN"),

    /** Teaching staff of one school. */
    PROFESSOR("PROFESSOR"),

    /** Learner enrolled in one school. */
    STUDENT("STUDENT");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /**
     * Returns the claim value for this role.
     */
    public String value() {
        return value;
    }

    /**
     * Staff roles are the ones allowed to act on behalf of students.
     */
    public boolean isStaff() {
        return this != STUDENT;
    }

    /**
     * Resolves a claim value to a role. Unknown values resolve to empty rather than throwing,
     * so callers decide whether an unknown role is an authentication failure.
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
