package com.aiprofessor.database.migration;

import java.util.Locale;

/** Which database a migration targets. */
public enum MigrationType {
    CENTRAL("central"),
    TENANT("tenant");

    private final String value;

    MigrationType(String value) {
        this.value = value;
    }

    /** Value stored in {@code migration_tracker.migration_type}. */
    public String value() {
        return value;
    }

    public static MigrationType fromValue(String value) {
        for (MigrationType type : values()) {
            if (type.value.equals(value == null ? null : value.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown migration type: " + value);
    }
}
