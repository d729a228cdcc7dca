package com.aiprofessor.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Uses {@link InMemorySpanExporter} directly so spans are collected reliably from nested classes.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otel = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otel.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Nested
    @DisplayName("withSpan (Callable)")
    class WithSpanCallable {

        @Test
        @DisplayName("should end an OK span and return the result")
        void shouldReturnResult() throws Exception {
            String result = spanHelper.withSpan("migration 20250109120000-x", () -> "done");

            assertThat(result).isEqualTo("done");
            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).getName()).isEqualTo("migration 20250109120000-x");
            assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        }

        @Test
        @DisplayName("should record the exception and rethrow it")
        void shouldRecordError() {
            assertThatThrownBy(() -> spanHelper.withSpan("failing", () -> {
                throw new IllegalStateException("collection missing");
            })).isInstanceOf(IllegalStateException.class).hasMessage("collection missing");

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(span.getStatus().getDescription()).contains("collection missing");
            assertThat(span.getEvents()).isNotEmpty();
        }

        @Test
        @DisplayName("should copy the correlation context onto the span")
        void shouldAttachCorrelationContext() throws Exception {
            CorrelationContextHolder.set(new CorrelationContext("corr-abc", "school-1", "prof-7", null, "sess-3"));

            spanHelper.withSpan("correlated", () -> "ok");

            var attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
            assertThat(attributes.get(AttributeKey.stringKey("correlation.id"))).isEqualTo("corr-abc");
            assertThat(attributes.get(AttributeKey.stringKey("tenant.id"))).isEqualTo("school-1");
            assertThat(attributes.get(AttributeKey.stringKey("user.id"))).isEqualTo("prof-7");
            assertThat(attributes.get(AttributeKey.stringKey("simulation.session.id"))).isEqualTo("sess-3");
        }

        @Test
        @DisplayName("should apply kind and custom attributes")
        void shouldApplyKindAndAttributes() throws Exception {
            spanHelper.withSpan("tenant-op", SpanKind.CLIENT, Map.of("db.name", "school_alpha"), () -> "ok");

            SpanData span = spanExporter.getFinishedSpanItems().get(0);
            assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("db.name"))).isEqualTo("school_alpha");
        }
    }

    @Nested
    @DisplayName("withSpan (Runnable)")
    class WithSpanRunnable {

        @Test
        @DisplayName("should create a span for void work")
        void shouldCreateSpan() {
            spanHelper.withSpan("void-op", () -> {
            });

            assertThat(spanExporter.getFinishedSpanItems()).extracting(SpanData::getName).containsExactly("void-op");
        }

        @Test
        @DisplayName("should propagate runtime exceptions unchanged")
        void shouldPropagate() {
            assertThatThrownBy(() -> spanHelper.withSpan("failing-void", (Runnable) () -> {
                throw new IllegalArgumentException("bad input");
            })).isInstanceOf(IllegalArgumentException.class).hasMessage("bad input");
        }
    }
}
