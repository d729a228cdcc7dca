package com.aiprofessor.simulation.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this service, bound from {@code aiprofessor.service.*}.
 *
 * <pre>
 * aiprofessor:
 *   service:
 *     name: simulation-service
 *     environment: production
 * </pre>
 *
 * @param name service name, used as the {@code service} tag of every meter. Required.
 * @param environment deployment environment, defaults to {@code development}
 */
@ConfigurationProperties(prefix = "aiprofessor.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
