package com.aiprofessor.simulation.config;

import com.aiprofessor.database.tenant.TenantConnectionCache;
import com.aiprofessor.observability.BestEffortExecutor;
import com.aiprofessor.observability.MetricFactory;
import com.aiprofessor.security.JwtTokenService;
import com.aiprofessor.simulation.domain.SimulationService;
import com.aiprofessor.simulation.domain.audit.SimulationAuditTrail;
import com.aiprofessor.simulation.domain.port.ActivityLogSink;
import com.aiprofessor.simulation.domain.port.SimulationSessionRepository;
import com.aiprofessor.simulation.domain.port.StudentDirectory;
import com.aiprofessor.simulation.domain.port.TenantRegistry;
import com.aiprofessor.simulation.domain.tenant.TenantResolver;
import com.aiprofessor.simulation.infrastructure.persistence.MongoActivityLogSink;
import com.aiprofessor.simulation.infrastructure.persistence.MongoSimulationSessionRepository;
import com.aiprofessor.simulation.infrastructure.persistence.MongoStudentDirectory;
import com.aiprofessor.simulation.infrastructure.persistence.MongoTenantRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Wires the simulation domain to its Mongo adapters and the shared platform libraries. */
@Configuration
public class SimulationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public JwtTokenService jwtTokenService(JwtProperties jwt, Clock clock) {
        return new JwtTokenService(jwt.toTokenSettings(), clock);
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor bestEffortTaskExecutor(BestEffortProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.poolSize());
        executor.setMaxPoolSize(properties.poolSize());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("best-effort-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean
    public BestEffortExecutor bestEffortExecutor(
            ThreadPoolTaskExecutor bestEffortTaskExecutor, MetricFactory metricFactory) {
        return new BestEffortExecutor(bestEffortTaskExecutor, metricFactory);
    }

    @Bean
    public TenantResolver tenantResolver() {
        return TenantResolver.standard();
    }

    @Bean
    public SimulationSessionRepository simulationSessionRepository(MongoTemplate mongoTemplate) {
        return new MongoSimulationSessionRepository(mongoTemplate);
    }

    @Bean
    public TenantRegistry tenantRegistry(MongoTemplate mongoTemplate) {
        return new MongoTenantRegistry(mongoTemplate);
    }

    @Bean
    public StudentDirectory studentDirectory() {
        return new MongoStudentDirectory();
    }

    @Bean
    public ActivityLogSink activityLogSink(MongoTemplate mongoTemplate) {
        return new MongoActivityLogSink(mongoTemplate);
    }

    @Bean
    public SimulationAuditTrail simulationAuditTrail(
            ActivityLogSink sink, BestEffortExecutor bestEffortExecutor, Clock clock) {
        return new SimulationAuditTrail(sink, bestEffortExecutor, clock);
    }

    @Bean
    public SimulationService simulationService(
            SimulationSessionRepository sessions,
            TenantRegistry tenants,
            StudentDirectory students,
            TenantConnectionCache connections,
            JwtTokenService tokens,
            TenantResolver tenantResolver,
            SimulationAuditTrail audit,
            BestEffortExecutor bestEffortExecutor,
            MetricFactory metricFactory,
            Clock clock) {
        return new SimulationService(
                sessions,
                tenants,
                students,
                connections,
                tokens,
                tenantResolver,
                audit,
                bestEffortExecutor,
                metricFactory,
                clock);
    }
}
