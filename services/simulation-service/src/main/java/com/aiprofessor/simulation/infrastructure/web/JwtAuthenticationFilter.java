package com.aiprofessor.simulation.infrastructure.web;

import com.aiprofessor.observability.CorrelationContextHolder;
import com.aiprofessor.security.BearerTokenExtractor;
import com.aiprofessor.security.InvalidTokenException;
import com.aiprofessor.security.JwtTokenService;
import com.aiprofessor.security.PlatformSecurityContext;
import com.aiprofessor.security.TokenType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the bearer access token of every {@code /api/**} request and attaches the caller to the
 * request. Requests without a valid token are answered with 401 before reaching any handler.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    static final String API_PREFIX = "/api/";

    private final JwtTokenService tokens;
    private final LocalizedMessages messages;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(
            JwtTokenService tokens, LocalizedMessages messages, ObjectMapper objectMapper) {
        this.tokens = tokens;
        this.messages = messages;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !pathOf(request).startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token =
                BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            reject(request, response, "auth.missing-token");
            return;
        }
        PlatformSecurityContext context;
        try {
            context = tokens.verify(token.get(), TokenType.ACCESS);
        } catch (InvalidTokenException e) {
            log.warn("Rejected token on {} {}: {}", request.getMethod(), pathOf(request), e.getMessage());
            reject(request, response, "auth.invalid-token");
            return;
        }

        RequestSecurityContext.attach(request, context);
        String sessionId = context.isSimulation() ? context.simulation().sessionId() : null;
        CorrelationContextHolder.get()
                .map(ctx -> ctx.withIdentity(context.tenantId(), context.userId(), sessionId))
                .ifPresent(CorrelationContextHolder::set);
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String key)
            throws IOException {
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.UNAUTHORIZED,
                        messages.get(LocalizedMessages.languageOf(request), key));
        problem.setTitle("Unauthorized");
        problem.setType(URI.create(GlobalExceptionHandler.ERROR_TYPE_BASE + "unauthorized"));
        problem.setInstance(URI.create(pathOf(request)));
        problem.setProperty("code", key);
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(), problem);
    }

    static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
