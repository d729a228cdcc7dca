package com.aiprofessor.observability;

/**
 * Immutable set of identifiers attached to the work done for one request.
 * <p>
 * The values are copied into SLF4J MDC by {@link CorrelationContextHolder} so every log line
 * written while handling the request carries them, and {@link SpanHelper} copies them onto spans.
 *
 * @param correlationId       ID of the business flow, propagated via {@code X-Correlation-ID}
 * @param tenantId            tenant (school) the caller acts in, nullable for platform-wide callers
 * @param userId              authenticated user, nullable before authentication
 * @param requestId           ID of this particular request
 * @param simulationSessionId active simulation session, nullable outside simulation
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId,
        String simulationSessionId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the simulation session ID. */
    public static final String MDC_SIMULATION_SESSION_ID = "simulationSessionId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context that only carries correlation and request IDs, as established
     * before the caller has been authenticated.
     */
    public static CorrelationContext anonymous(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId, null);
    }

    /**
     * Returns a copy enriched with the identity of the authenticated caller.
     */
    public CorrelationContext withIdentity(String tenantId, String userId, String simulationSessionId) {
        return new CorrelationContext(correlationId, tenantId, userId, requestId, simulationSessionId);
    }
}
