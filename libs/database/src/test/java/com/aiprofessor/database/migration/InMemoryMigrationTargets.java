package com.aiprofessor.database.migration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Target provider whose bookkeeping lives in memory; the database template is null. */
final class InMemoryMigrationTargets implements MigrationTargetProvider {

    final InMemoryRecordStore central = new InMemoryRecordStore();
    final Map<String, InMemoryRecordStore> tenants = new HashMap<>();
    final List<String> opened = new ArrayList<>();
    final List<String> closed = new ArrayList<>();

    @Override
    public MigrationTarget central() {
        opened.add("central");
        return new MigrationTarget(MigrationType.CENTRAL, null, null, central, () -> closed.add("central"));
    }

    @Override
    public MigrationTarget tenant(String tenantDbName) {
        opened.add(tenantDbName);
        return new MigrationTarget(
                MigrationType.TENANT,
                tenantDbName,
                null,
                tenantStore(tenantDbName),
                () -> closed.add(tenantDbName));
    }

    InMemoryRecordStore tenantStore(String tenantDbName) {
        return tenants.computeIfAbsent(tenantDbName, k -> new InMemoryRecordStore());
    }

    static final class InMemoryRecordStore implements MigrationRecordStore {

        final List<MigrationRecord> records = new ArrayList<>();

        @Override
        public boolean hasSucceeded(String migrationName, MigrationType type, String tenantDbName) {
            return records.stream()
                    .anyMatch(
                            r -> r.success()
                                    && r.migrationName().equals(migrationName)
                                    && r.type() == type
                                    && (type == MigrationType.CENTRAL
                                            || tenantDbName.equals(r.tenantDbName())));
        }

        @Override
        public void record(MigrationRecord record) {
            records.add(record);
        }

        @Override
        public List<MigrationRecord> findAll() {
            return List.copyOf(records);
        }
    }
}
