package com.aiprofessor.database.tenant;

import com.aiprofessor.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TenantConnectionCache} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Opening goes through {@link ConcurrentHashMap#computeIfAbsent}, so concurrent first lookups
 * of the same name open exactly one connection while lookups of other names proceed. An exception
 * thrown by the factory propagates to the caller and nothing is stored.
 */
public class CachingTenantConnectionCache implements TenantConnectionCache {

    private static final Logger log = LoggerFactory.getLogger(CachingTenantConnectionCache.class);

    private final ConcurrentMap<String, TenantConnection> connections = new ConcurrentHashMap<>();
    private final TenantConnectionFactory factory;
    private final Counter opened;
    private final AtomicLong open;

    public CachingTenantConnectionCache(TenantConnectionFactory factory, MetricFactory metrics) {
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.factory = factory;
        this.opened = metrics.counter("tenant.connections.opened", "Tenant database connections opened");
        this.open = metrics.gauge("tenant.connections.open", "Tenant database connections currently cached");
    }

    @Override
    public TenantConnection getConnection(String databaseName) {
        requireName(databaseName);
        TenantConnection existing = connections.get(databaseName);
        if (existing != null) {
            return existing;
        }
        TenantConnection connection = connections.computeIfAbsent(databaseName, this::openConnection);
        open.set(connections.size());
        return connection;
    }

    @Override
    public boolean evict(String databaseName) {
        requireName(databaseName);
        TenantConnection removed = connections.remove(databaseName);
        open.set(connections.size());
        if (removed == null) {
            return false;
        }
        removed.close();
        log.info("[Tenant DB: {}] Evicted", databaseName);
        return true;
    }

    @Override
    public int size() {
        return connections.size();
    }

    @Override
    public void close() {
        List<String> names = new ArrayList<>(connections.keySet());
        for (String name : names) {
            TenantConnection connection = connections.remove(name);
            if (connection == null) {
                continue;
            }
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("[Tenant DB: {}] Failed to close: {}", name, e.getMessage());
            }
        }
        open.set(0);
        log.info("Closed {} tenant database connection(s)", names.size());
    }

    private TenantConnection openConnection(String databaseName) {
        TenantConnection connection = factory.open(databaseName);
        opened.increment();
        return connection;
    }

    private static void requireName(String databaseName) {
        if (databaseName == null || databaseName.isBlank()) {
            throw new IllegalArgumentException("databaseName must not be null or blank");
        }
    }
}
