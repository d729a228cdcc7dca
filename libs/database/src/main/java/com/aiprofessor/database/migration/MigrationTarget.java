package com.aiprofessor.database.migration;

import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * An opened database to migrate, together with its bookkeeping. Closing the target releases the
 * underlying connection.
 */
public final class MigrationTarget implements AutoCloseable {

    private final MigrationType type;
    private final String tenantDbName;
    private final MongoTemplate database;
    private final MigrationRecordStore records;
    private final Runnable onClose;

    public MigrationTarget(
            MigrationType type,
            String tenantDbName,
            MongoTemplate database,
            MigrationRecordStore records,
            Runnable onClose) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (type == MigrationType.TENANT && (tenantDbName == null || tenantDbName.isBlank())) {
            throw new IllegalArgumentException("tenantDbName is required for tenant targets");
        }
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        this.type = type;
        this.tenantDbName = tenantDbName;
        this.database = database;
        this.records = records;
        this.onClose = onClose;
    }

    public MigrationType type() {
        return type;
    }

    public String tenantDbName() {
        return tenantDbName;
    }

    public MongoTemplate database() {
        return database;
    }

    public MigrationRecordStore records() {
        return records;
    }

    /** Label used in logs: {@code central} or {@code tenant:<db>}. */
    public String label() {
        return type == MigrationType.CENTRAL ? "central" : "tenant:" + tenantDbName;
    }

    @Override
    public void close() {
        if (onClose != null) {
            onClose.run();
        }
    }
}
