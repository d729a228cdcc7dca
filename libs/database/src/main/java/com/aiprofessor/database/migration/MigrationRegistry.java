package com.aiprofessor.database.migration;

import com.aiprofessor.database.migration.scripts.AddCsvUploadFieldMigration;
import com.aiprofessor.database.migration.scripts.AddStudentYearMigration;
import com.aiprofessor.database.migration.scripts.UpdateStudentStatusMigration;
import com.aiprofessor.database.migration.scripts.UpdateUserSchoolStatusMigration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explicit, ordered list of the platform's migrations.
 *
 * <p>New migrations are added to {@link #standard()}. Names are validated when the registry is
 * built, so a malformed or duplicated name fails the process before any database is touched.
 */
public final class MigrationRegistry {

    private static final Comparator<Migration> ORDER =
            Comparator.comparingLong(Migration::sequence).thenComparing(Migration::name);

    private final List<Migration> migrations;

    public MigrationRegistry(List<Migration> migrations) {
        if (migrations == null) {
            throw new IllegalArgumentException("migrations must not be null");
        }
        Set<String> seen = new HashSet<>();
        for (Migration migration : migrations) {
            if (migration.name() == null || !Migration.NAME_PATTERN.matcher(migration.name()).matches()) {
                throw new IllegalArgumentException(
                        "Migration name must look like YYYYMMDDHHMMSS-description: " + migration.name());
            }
            if (migration.type() == null) {
                throw new IllegalArgumentException("Migration " + migration.name() + " has no type");
            }
            if (!seen.add(migration.type().value() + ":" + migration.name())) {
                throw new IllegalArgumentException(
                        "Duplicate " + migration.type().value() + " migration: " + migration.name());
            }
        }
        List<Migration> sorted = new ArrayList<>(migrations);
        sorted.sort(ORDER);
        this.migrations = List.copyOf(sorted);
    }

    /** The migrations shipped with the platform. */
    public static MigrationRegistry standard() {
        return new MigrationRegistry(
                List.of(
                        new UpdateUserSchoolStatusMigration(),
                        new UpdateStudentStatusMigration(),
                        new AddCsvUploadFieldMigration(),
                        new AddStudentYearMigration()));
    }

    /** Migrations of {@code type}, ascending by timestamp, ties broken by name. */
    public List<Migration> migrations(MigrationType type) {
        return migrations.stream().filter(m -> m.type() == type).collect(Collectors.toList());
    }

    public List<Migration> all() {
        return migrations;
    }
}
