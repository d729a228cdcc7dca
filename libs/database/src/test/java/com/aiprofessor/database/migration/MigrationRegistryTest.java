package com.aiprofessor.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MigrationRegistry")
class MigrationRegistryTest {

    private final List<String> log = new ArrayList<>();

    @Test
    @DisplayName("should order by timestamp prefix, then by name")
    void shouldOrder() {
        MigrationRegistry registry =
                new MigrationRegistry(
                        List.of(
                                new RecordingMigration("20250120000000-b", MigrationType.TENANT, log),
                                new RecordingMigration("20250109120000-z", MigrationType.TENANT, log),
                                new RecordingMigration("20250120000000-a", MigrationType.TENANT, log),
                                new RecordingMigration("20250101000000-c", MigrationType.CENTRAL, log)));

        assertThat(registry.migrations(MigrationType.TENANT))
                .extracting(Migration::name)
                .containsExactly("20250109120000-z", "20250120000000-a", "20250120000000-b");
        assertThat(registry.migrations(MigrationType.CENTRAL))
                .extracting(Migration::name)
                .containsExactly("20250101000000-c");
    }

    @Test
    @DisplayName("should reject names that do not start with a 14-digit timestamp")
    void shouldRejectMalformedNames() {
        assertThatThrownBy(
                        () ->
                                new MigrationRegistry(
                                        List.of(new RecordingMigration("2025-01-09-x", MigrationType.CENTRAL, log))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("YYYYMMDDHHMMSS");
    }

    @Test
    @DisplayName("should reject duplicate names of the same type but allow them across types")
    void shouldRejectDuplicates() {
        assertThatThrownBy(
                        () ->
                                new MigrationRegistry(
                                        List.of(
                                                new RecordingMigration("20250101000000-x", MigrationType.TENANT, log),
                                                new RecordingMigration("20250101000000-x", MigrationType.TENANT, log))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");

        MigrationRegistry mixed =
                new MigrationRegistry(
                        List.of(
                                new RecordingMigration("20250101000000-x", MigrationType.TENANT, log),
                                new RecordingMigration("20250101000000-x", MigrationType.CENTRAL, log)));
        assertThat(mixed.all()).hasSize(2);
    }

    @Test
    @DisplayName("standard registry should hold the shipped migrations in order")
    void standardRegistry() {
        MigrationRegistry registry = MigrationRegistry.standard();

        assertThat(registry.migrations(MigrationType.CENTRAL))
                .extracting(Migration::name)
                .containsExactly("20250109120000-update-user-school-status");
        assertThat(registry.migrations(MigrationType.TENANT))
                .extracting(Migration::name)
                .containsExactly(
                        "20250109120000-update-student-status",
                        "20250109120001-add-csv-upload-field",
                        "20250120000001-add-student-year");
    }
}
