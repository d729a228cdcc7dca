package com.aiprofessor.database.tenant;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.time.Clock;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Opens tenant connections at {@code <baseUri>/<databaseName>} and pings them before handing them
 * out. Connection options in the base URI ({@code ?authSource=admin}) are kept after the database
 * name.
 */
public class MongoTenantConnectionFactory implements TenantConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(MongoTenantConnectionFactory.class);

    private final String baseUri;
    private final Clock clock;

    public MongoTenantConnectionFactory(String baseUri) {
        this(baseUri, Clock.systemUTC());
    }

    public MongoTenantConnectionFactory(String baseUri, Clock clock) {
        this.baseUri = baseUri;
        this.clock = clock;
    }

    @Override
    public TenantConnection open(String databaseName) {
        String uri = connectionUri(databaseName);
        MongoClient client = MongoClients.create(uri);
        try {
            MongoTemplate template = new MongoTemplate(client, databaseName);
            template.executeCommand(new Document("ping", 1));
            log.info("[Tenant DB: {}] Connected", databaseName);
            return new TenantConnection(databaseName, template, client, clock.instant());
        } catch (RuntimeException e) {
            log.error("[Tenant DB: {}] Connection error: {}", databaseName, e.getMessage());
            client.close();
            throw e;
        }
    }

    /**
     * Builds the connection string for {@code databaseName}.
     *
     * @throws DatabaseConfigurationException if the base URI is blank
     */
    String connectionUri(String databaseName) {
        if (baseUri == null || baseUri.isBlank()) {
            throw new DatabaseConfigurationException(
                    "MONGODB_BASE_URI is not configured; cannot open tenant database '"
                            + databaseName
                            + "'");
        }
        String base = baseUri.strip();
        String options = "";
        int query = base.indexOf('?');
        if (query >= 0) {
            options = base.substring(query);
            base = base.substring(0, query);
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + databaseName + options;
    }
}
