package com.aiprofessor.database.migration;

/** Opens the databases a {@link MigrationRunner} works on. */
public interface MigrationTargetProvider {

    MigrationTarget central();

    MigrationTarget tenant(String tenantDbName);
}
