package com.aiprofessor.database.migration;

import java.util.regex.Pattern;

/**
 * A single schema or data change.
 *
 * <p>The name is {@code YYYYMMDDHHMMSS-description}; the timestamp prefix orders migrations of the
 * same type. Names must stay stable once a migration has shipped, since the tracker identifies
 * applied migrations by name.
 */
public interface Migration {

    /** Accepted shape of {@link #name()}. */
    Pattern NAME_PATTERN = Pattern.compile("^(\\d{14})-[a-z0-9]+(-[a-z0-9]+)*$");

    String name();

    MigrationType type();

    /** Applies the change. Any exception marks the attempt as failed. */
    void up(MigrationContext context);

    /** Reverts {@link #up(MigrationContext)}. */
    void down(MigrationContext context);

    /** Numeric timestamp prefix of the name. */
    default long sequence() {
        return Long.parseLong(name().substring(0, 14));
    }
}
