package com.aiprofessor.database.tenant;

/**
 * Opens a new, uncached connection to a tenant database.
 */
@FunctionalInterface
public interface TenantConnectionFactory {

    /**
     * Opens and verifies a connection.
     *
     * @param databaseName tenant database name, e.g. {@code school_alpha}
     * @return a connection the caller owns
     * @throws DatabaseConfigurationException if the tenant base URI is not configured
     * @throws RuntimeException whatever the driver raises when the database cannot be reached
     */
    TenantConnection open(String databaseName);
}
