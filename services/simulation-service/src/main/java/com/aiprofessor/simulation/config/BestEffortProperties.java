package com.aiprofessor.simulation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pool for audit writes and activity tracking, bound from {@code aiprofessor.best-effort.*}.
 *
 * @param poolSize worker threads, default 2
 * @param queueCapacity pending tasks before new ones are rejected, default 1000
 */
@ConfigurationProperties(prefix = "aiprofessor.best-effort")
public record BestEffortProperties(int poolSize, int queueCapacity) {

    public BestEffortProperties {
        if (poolSize <= 0) {
            poolSize = 2;
        }
        if (queueCapacity <= 0) {
            queueCapacity = 1000;
        }
    }
}
