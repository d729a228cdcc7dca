package com.aiprofessor.database.migration.cli;

/** What {@code migrate run --type} selects. */
public enum MigrationScope {
    CENTRAL,
    TENANT,
    ALL
}
