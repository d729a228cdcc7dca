package com.aiprofessor.database.migration.cli;

import com.aiprofessor.database.migration.MigrationRunner;

/** Builds the runner a command works with. */
@FunctionalInterface
public interface MigrationRunnerFactory {

    MigrationRunner create(MigrationEnvironment environment);
}
