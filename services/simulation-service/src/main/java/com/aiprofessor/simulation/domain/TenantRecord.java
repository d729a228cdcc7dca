package com.aiprofessor.simulation.domain;

import java.time.Instant;

/**
 * A school as registered in the central database.
 *
 * @param id tenant ID
 * @param name display name
 * @param databaseName name of the school's own database
 * @param status ACTIVE or INACTIVE
 * @param deletedAt soft-delete marker
 */
public record TenantRecord(
        String id, String name, String databaseName, String status, Instant deletedAt) {

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
