package com.aiprofessor.database.tenant;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tenant database settings.
 *
 * <pre>{@code
 * aiprofessor:
 *   tenant-db:
 *     base-uri: ${MONGODB_BASE_URI:}
 * }</pre>
 *
 * @param baseUri MongoDB URI without a database name; the tenant database name is appended to it.
 *     Left blank, the service starts but every tenant lookup fails with {@link
 *     DatabaseConfigurationException}.
 */
@ConfigurationProperties(prefix = "aiprofessor.tenant-db")
public record TenantDatabaseProperties(String baseUri) {

    public boolean isConfigured() {
        return baseUri != null && !baseUri.isBlank();
    }
}
