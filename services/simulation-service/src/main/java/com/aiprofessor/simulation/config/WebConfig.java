package com.aiprofessor.simulation.config;

import com.aiprofessor.observability.MetricFactory;
import com.aiprofessor.simulation.domain.SimulationService;
import com.aiprofessor.simulation.domain.audit.SimulationAuditTrail;
import com.aiprofessor.simulation.infrastructure.web.SecurityContextArgumentResolver;
import com.aiprofessor.simulation.infrastructure.web.SimulationActivityInterceptor;
import com.aiprofessor.simulation.infrastructure.web.SimulationWriteGuard;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS, the simulation interceptors and the caller argument resolver.
 *
 * <p>The write guard is registered before the activity interceptor so blocked requests are not
 * tracked.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SimulationAuditTrail audit;
    private final MetricFactory metrics;
    private final SimulationService simulations;

    public WebConfig(
            SimulationAuditTrail audit, MetricFactory metrics, SimulationService simulations) {
        this.audit = audit;
        this.metrics = metrics;
        this.simulations = simulations;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // local frontends; production origins come from the gateway
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new SimulationWriteGuard(audit, metrics)).addPathPatterns("/api/**");
        registry.addInterceptor(new SimulationActivityInterceptor(simulations))
                .addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new SecurityContextArgumentResolver());
    }
}
