package com.aiprofessor.database.migration;

import java.util.List;

/** Migration that appends its name to a shared log, optionally failing a given number of times. */
final class RecordingMigration implements Migration {

    private final String name;
    private final MigrationType type;
    private final List<String> log;
    private int failuresLeft;

    RecordingMigration(String name, MigrationType type, List<String> log) {
        this(name, type, log, 0);
    }

    RecordingMigration(String name, MigrationType type, List<String> log, int failures) {
        this.name = name;
        this.type = type;
        this.log = log;
        this.failuresLeft = failures;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public MigrationType type() {
        return type;
    }

    @Override
    public void up(MigrationContext context) {
        log.add(context.tenantDbName() == null ? name : context.tenantDbName() + "/" + name);
        if (failuresLeft > 0) {
            failuresLeft--;
            throw new IllegalStateException("boom in " + name);
        }
    }

    @Override
    public void down(MigrationContext context) {
        log.add("down " + name);
    }
}
