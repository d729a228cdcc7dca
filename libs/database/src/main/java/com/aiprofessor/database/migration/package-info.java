/**
 * Ordered, tracked migrations for the central database and for tenant databases.
 *
 * <p>Migrations are Java classes registered in {@link
 * com.aiprofessor.database.migration.MigrationRegistry}; nothing is discovered from the file
 * system. {@link com.aiprofessor.database.migration.MigrationRunner} applies the pending ones in
 * order, writes one {@link com.aiprofessor.database.migration.MigrationRecord} per attempt to the
 * {@code migration_tracker} collection of the database being migrated, and stops at the first
 * failure. The {@code cli} sub-package exposes the runner on the command line.
 */
package com.aiprofessor.database.migration;
