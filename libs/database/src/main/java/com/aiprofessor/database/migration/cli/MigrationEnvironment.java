package com.aiprofessor.database.migration.cli;

import com.aiprofessor.database.tenant.DatabaseConfigurationException;
import java.util.Map;

/**
 * Connection settings read from the environment.
 *
 * @param centralUri {@code MONGODB_URI}, or {@code CENTRAL_DB_URI} when the former is unset
 * @param tenantBaseUri {@code MONGODB_BASE_URI}
 */
public record MigrationEnvironment(String centralUri, String tenantBaseUri) {

    public static MigrationEnvironment from(Map<String, String> env) {
        String central = env.get("MONGODB_URI");
        if (central == null || central.isBlank()) {
            central = env.get("CENTRAL_DB_URI");
        }
        return new MigrationEnvironment(central, env.get("MONGODB_BASE_URI"));
    }

    /**
     * Checks that every database the run will touch can be reached.
     *
     * @throws DatabaseConfigurationException naming the missing variable
     */
    public void requireFor(MigrationScope scope, String tenantDbName) {
        boolean needsCentral = scope != MigrationScope.TENANT;
        boolean needsTenant = scope == MigrationScope.TENANT || tenantDbName != null;
        if (needsCentral && isBlank(centralUri)) {
            throw new DatabaseConfigurationException(
                    "MONGODB_URI or CENTRAL_DB_URI environment variable is required");
        }
        if (needsTenant && isBlank(tenantBaseUri)) {
            throw new DatabaseConfigurationException(
                    "MONGODB_BASE_URI environment variable is required for tenant migrations");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
