package com.aiprofessor.database.migration;

import com.aiprofessor.database.tenant.DatabaseConfigurationException;
import com.aiprofessor.database.tenant.TenantConnection;
import com.aiprofessor.database.tenant.TenantConnectionFactory;
import com.mongodb.ConnectionString;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Opens a fresh connection per target; the central database name is taken from the central URI,
 * tenant connections come from a {@link TenantConnectionFactory}. Nothing is cached: a migration
 * run is short-lived and closes what it opens.
 */
public class MongoMigrationTargetProvider implements MigrationTargetProvider {

    private final String centralUri;
    private final TenantConnectionFactory tenantConnections;

    public MongoMigrationTargetProvider(String centralUri, TenantConnectionFactory tenantConnections) {
        this.centralUri = centralUri;
        this.tenantConnections = tenantConnections;
    }

    @Override
    public MigrationTarget central() {
        if (centralUri == null || centralUri.isBlank()) {
            throw new DatabaseConfigurationException("MONGODB_URI or CENTRAL_DB_URI is not configured");
        }
        ConnectionString connectionString = new ConnectionString(centralUri);
        String databaseName = connectionString.getDatabase();
        if (databaseName == null || databaseName.isBlank()) {
            throw new DatabaseConfigurationException("The central database URI must name a database");
        }
        MongoClient client = MongoClients.create(connectionString);
        MongoTemplate template = new MongoTemplate(client, databaseName);
        return new MigrationTarget(
                MigrationType.CENTRAL, null, template, new MongoMigrationRecordStore(template), client::close);
    }

    @Override
    public MigrationTarget tenant(String tenantDbName) {
        TenantConnection connection = tenantConnections.open(tenantDbName);
        return new MigrationTarget(
                MigrationType.TENANT,
                tenantDbName,
                connection.template(),
                new MongoMigrationRecordStore(connection.template()),
                connection::close);
    }
}
