package com.aiprofessor.database.migration;

import java.util.List;

/** Bookkeeping of migration attempts on one database. */
public interface MigrationRecordStore {

    /**
     * Whether a successful attempt of {@code migrationName} has been recorded for this type and,
     * for tenant migrations, this tenant database.
     */
    boolean hasSucceeded(String migrationName, MigrationType type, String tenantDbName);

    void record(MigrationRecord record);

    /** All recorded attempts, oldest first. */
    List<MigrationRecord> findAll();
}
