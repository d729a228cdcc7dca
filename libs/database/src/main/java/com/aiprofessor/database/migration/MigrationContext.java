package com.aiprofessor.database.migration;

import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * What a migration runs against.
 *
 * @param database template bound to the target database
 * @param tenantDbName tenant database name, null for central migrations
 */
public record MigrationContext(MongoTemplate database, String tenantDbName) {}
