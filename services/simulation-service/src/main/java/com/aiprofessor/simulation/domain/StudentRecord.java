package com.aiprofessor.simulation.domain;

import java.time.Instant;

/**
 * A student as stored in a tenant database. The e-mail is the decrypted value.
 */
public record StudentRecord(
        String id,
        String email,
        String firstName,
        String lastName,
        String studentCode,
        Integer year,
        String status,
        Instant deletedAt) {

    public static final String STATUS_ACTIVE = "ACTIVE";
    public static final String STATUS_INACTIVE = "INACTIVE";

    /** Students created before statuses existed count as active. */
    public boolean isActive() {
        return status == null || STATUS_ACTIVE.equals(status);
    }

    public String fullName() {
        String first = firstName == null ? "" : firstName.strip();
        String last = lastName == null ? "" : lastName.strip();
        return (first + " " + last).strip();
    }
}
