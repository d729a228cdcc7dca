package com.aiprofessor.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that copies the current
 * {@link CorrelationContext} onto every span it starts.
 * <p>
 * This class does not configure the SDK. Services configure the exporter and sampler
 * themselves, or run with the no-op tracer from {@code GlobalOpenTelemetry}.
 */
public final class SpanHelper {

    static final String ATTR_CORRELATION_ID = "correlation.id";
    static final String ATTR_TENANT_ID = "tenant.id";
    static final String ATTR_USER_ID = "user.id";
    static final String ATTR_SIMULATION_SESSION_ID = "simulation.session.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Executes a {@link Callable} within a new internal span.
     *
     * @throws Exception whatever the callable throws, after it has been recorded on the span
     */
    public <T> T withSpan(String spanName, Callable<T> callable) throws Exception {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), callable);
    }

    /**
     * Executes a {@link Callable} within a new span with explicit kind and attributes.
     * The span status is {@code OK} when the callable returns and {@code ERROR} when it throws.
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Callable<T> callable) throws Exception {
        SpanBuilder spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
            if (ctx.userId() != null) {
                span.setAttribute(ATTR_USER_ID, ctx.userId());
            }
            if (ctx.simulationSessionId() != null) {
                span.setAttribute(ATTR_SIMULATION_SESSION_ID, ctx.simulationSessionId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant of {@link #withSpan(String, Callable)} for work that only throws
     * unchecked exceptions.
     */
    public void withSpan(String spanName, Runnable runnable) {
        try {
            withSpan(spanName, () -> {
                runnable.run();
                return null;
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception in span " + spanName, e);
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
