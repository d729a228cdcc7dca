package com.aiprofessor.simulation.infrastructure.web;

import com.aiprofessor.observability.MetricFactory;
import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.simulation.domain.RequestOrigin;
import com.aiprofessor.simulation.domain.audit.SimulationAuditTrail;
import com.aiprofessor.simulation.domain.error.SimulationWriteBlockedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Keeps simulation credentials read-only.
 *
 * <p>A request made with a simulation credential passes when its method is a read method, its
 * path is on the allow-list, or its handler carries {@link AllowSimulationWrite}. Anything else is
 * rejected with {@link SimulationWriteBlockedException} and audited. Handlers do not check the
 * simulation flag themselves, so this interceptor must run for every API route.
 */
public class SimulationWriteGuard implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(SimulationWriteGuard.class);

    static final String METRIC_BLOCKED = "simulation.writes.blocked";

    static final Set<String> READ_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    static final List<String> ALLOWED_PATHS =
            List.of(
                    "/api/simulation/end",
                    "/api/simulation/status",
                    "/api/auth/me",
                    "/api/auth/refresh");

    private final SimulationAuditTrail audit;
    private final MetricFactory metrics;

    public SimulationWriteGuard(SimulationAuditTrail audit, MetricFactory metrics) {
        this.audit = audit;
        this.metrics = metrics;
    }

    @Override
    public boolean preHandle(
            HttpServletRequest request, HttpServletResponse response, Object handler) {
        Optional<PlatformSecurityContext> caller = RequestSecurityContext.find(request);
        if (caller.isEmpty() || !caller.get().isSimulation()) {
            return true;
        }
        String method = request.getMethod().toUpperCase(Locale.ROOT);
        if (READ_METHODS.contains(method)) {
            return true;
        }
        String path = JwtAuthenticationFilter.pathOf(request);
        if (isAllowListed(path) || allowsSimulationWrite(handler)) {
            return true;
        }

        log.warn(
                "Blocked {} {} for simulation session {}",
                method,
                path,
                caller.get().simulation().sessionId());
        metrics.counter(METRIC_BLOCKED, "Writes blocked under simulation credentials", "method", method)
                .increment();
        audit.writeBlocked(
                caller.get(),
                method,
                path,
                new RequestOrigin(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT)));
        throw new SimulationWriteBlockedException(method, path);
    }

    static boolean isAllowListed(String path) {
        for (String allowed : ALLOWED_PATHS) {
            if (path.equals(allowed) || path.startsWith(allowed + "/")) {
                return true;
            }
        }
        return false;
    }

    private static boolean allowsSimulationWrite(Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return false;
        }
        HandlerMethod method = (HandlerMethod) handler;
        return method.hasMethodAnnotation(AllowSimulationWrite.class)
                || AnnotatedElementUtils.hasAnnotation(method.getBeanType(), AllowSimulationWrite.class);
    }
}
