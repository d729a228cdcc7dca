package com.aiprofessor.simulation.infrastructure.web;

import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.simulation.domain.ActivityCounter;
import com.aiprofessor.simulation.domain.SimulationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Records what a simulated student looks at: every GET path as a visited page, and module, quiz
 * and AI chat views as counters. Tracking is best effort and never blocks the request.
 */
public class SimulationActivityInterceptor implements HandlerInterceptor {

    private static final Map<String, ActivityCounter> COUNTED_PREFIXES = new LinkedHashMap<>();

    static {
        COUNTED_PREFIXES.put("/api/modules", ActivityCounter.MODULES_VIEWED);
        COUNTED_PREFIXES.put("/api/quiz", ActivityCounter.QUIZZES_VIEWED);
        COUNTED_PREFIXES.put("/api/ai-chat", ActivityCounter.AI_CHATS_OPENED);
    }

    private final SimulationService simulations;

    public SimulationActivityInterceptor(SimulationService simulations) {
        this.simulations = simulations;
    }

    @Override
    public boolean preHandle(
            HttpServletRequest request, HttpServletResponse response, Object handler) {
        Optional<PlatformSecurityContext> caller = RequestSecurityContext.find(request);
        if (caller.isEmpty() || !caller.get().isSimulation() || !"GET".equals(request.getMethod())) {
            return true;
        }
        String sessionId = caller.get().simulation().sessionId();
        String path = JwtAuthenticationFilter.pathOf(request);
        simulations.trackPageVisit(sessionId, path);
        counterFor(path).ifPresent(counter -> simulations.incrementActivityCounter(sessionId, counter));
        return true;
    }

    static Optional<ActivityCounter> counterFor(String path) {
        for (Map.Entry<String, ActivityCounter> entry : COUNTED_PREFIXES.entrySet()) {
            String prefix = entry.getKey();
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
