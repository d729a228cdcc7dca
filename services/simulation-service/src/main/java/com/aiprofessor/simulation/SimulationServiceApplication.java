package com.aiprofessor.simulation;

import com.aiprofessor.database.tenant.TenantDatabaseConfig;
import com.aiprofessor.simulation.config.BestEffortProperties;
import com.aiprofessor.simulation.config.JwtProperties;
import com.aiprofessor.simulation.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Simulation service: lets staff view the platform as one of their students.
 *
 * <ul>
 *   <li>Central database through Spring Data MongoDB ({@code spring.data.mongodb.uri})
 *   <li>Tenant databases through the shared tenant connection cache
 *   <li>Bearer authentication on {@code /api/**}
 *   <li>Simulation credentials kept read-only by the write guard
 *   <li>RFC 7807 errors, localized in English and French
 * </ul>
 */
@SpringBootApplication
@Import(TenantDatabaseConfig.class)
@EnableConfigurationProperties({
    ServiceProperties.class,
    JwtProperties.class,
    BestEffortProperties.class
})
public class SimulationServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(SimulationServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SimulationServiceApplication.class, args);
        log.info("Simulation service started");
    }
}
