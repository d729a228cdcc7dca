package com.aiprofessor.database.tenant;

import com.mongodb.client.MongoClient;
import java.time.Instant;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * A live handle on one tenant database.
 *
 * <p>The handle owns its {@link MongoClient}; {@link #close()} releases the client and with it
 * every pooled socket. Handles handed out by a {@link TenantConnectionCache} are shared and must
 * not be closed by callers.
 */
public final class TenantConnection implements AutoCloseable {

    private final String databaseName;
    private final MongoTemplate template;
    private final MongoClient client;
    private final Instant openedAt;

    public TenantConnection(
            String databaseName, MongoTemplate template, MongoClient client, Instant openedAt) {
        if (databaseName == null || databaseName.isBlank()) {
            throw new IllegalArgumentException("databaseName must not be null or blank");
        }
        if (template == null) {
            throw new IllegalArgumentException("template must not be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        this.databaseName = databaseName;
        this.template = template;
        this.client = client;
        this.openedAt = openedAt;
    }

    public String databaseName() {
        return databaseName;
    }

    /** Template bound to this tenant's database. */
    public MongoTemplate template() {
        return template;
    }

    public Instant openedAt() {
        return openedAt;
    }

    @Override
    public void close() {
        client.close();
    }

    @Override
    public String toString() {
        return "TenantConnection[" + databaseName + ", openedAt=" + openedAt + "]";
    }
}
