package com.aiprofessor.database.tenant;

/**
 * Process-wide source of tenant database handles.
 *
 * <p>Implementations hold at most one live handle per database name. Handles are shared by all
 * callers and stay open until evicted or until the cache is closed.
 */
public interface TenantConnectionCache extends AutoCloseable {

    /**
     * Returns the handle for {@code databaseName}, opening it on first use.
     *
     * <p>A failed open leaves nothing cached, so the next call tries again.
     *
     * @throws IllegalArgumentException if the name is null or blank
     * @throws DatabaseConfigurationException if tenant connections are not configured
     */
    TenantConnection getConnection(String databaseName);

    /**
     * Closes and forgets the handle for {@code databaseName}, if any.
     *
     * @return true if a handle was evicted
     */
    boolean evict(String databaseName);

    /** Number of live handles. */
    int size();

    /** Closes every handle. */
    @Override
    void close();
}
