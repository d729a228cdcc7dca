package com.aiprofessor.database.migration;

/**
 * Outcome of one executed migration.
 *
 * @param migrationName name of the migration
 * @param type central or tenant
 * @param tenantDbName tenant database, null for central
 * @param success whether it completed
 * @param executionTimeMs duration of {@code up}
 * @param error failure message, null on success
 */
public record MigrationResult(
        String migrationName,
        MigrationType type,
        String tenantDbName,
        boolean success,
        long executionTimeMs,
        String error) {

    static MigrationResult of(MigrationRecord record) {
        return new MigrationResult(
                record.migrationName(),
                record.type(),
                record.tenantDbName(),
                record.success(),
                record.executionTimeMs(),
                record.errorMessage());
    }
}
