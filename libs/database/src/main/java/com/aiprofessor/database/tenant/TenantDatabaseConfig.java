package com.aiprofessor.database.tenant;

import com.aiprofessor.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the tenant connection cache. Services import this configuration and provide a
 * {@link MetricFactory} bean.
 *
 * <p>The cache bean is closed with the application context, which closes every tenant connection.
 */
@Configuration
@EnableConfigurationProperties(TenantDatabaseProperties.class)
public class TenantDatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(TenantDatabaseConfig.class);

    @Bean
    public TenantConnectionFactory tenantConnectionFactory(TenantDatabaseProperties properties) {
        if (!properties.isConfigured()) {
            log.warn("aiprofessor.tenant-db.base-uri is not set; tenant database access will fail");
        }
        return new MongoTenantConnectionFactory(properties.baseUri());
    }

    @Bean(destroyMethod = "close")
    public TenantConnectionCache tenantConnectionCache(
            TenantConnectionFactory factory, MetricFactory metricFactory) {
        return new CachingTenantConnectionCache(factory, metricFactory);
    }
}
