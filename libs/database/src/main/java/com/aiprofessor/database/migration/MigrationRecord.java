package com.aiprofessor.database.migration;

import java.time.Instant;

/**
 * One attempt to apply a migration, as stored in {@code migration_tracker}.
 *
 * @param migrationName name of the migration
 * @param type central or tenant
 * @param tenantDbName tenant database name, null for central migrations
 * @param executedAt when the attempt finished
 * @param executionTimeMs wall-clock duration of {@code up}
 * @param success whether {@code up} completed
 * @param errorMessage failure message, null on success
 */
public record MigrationRecord(
        String migrationName,
        MigrationType type,
        String tenantDbName,
        Instant executedAt,
        long executionTimeMs,
        boolean success,
        String errorMessage) {

    public MigrationRecord {
        if (migrationName == null || migrationName.isBlank()) {
            throw new IllegalArgumentException("migrationName must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }
}
