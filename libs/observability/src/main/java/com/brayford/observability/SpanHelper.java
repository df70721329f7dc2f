package com.brayford.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * {@link CorrelationContext}.
 * <p>
 * SDK setup (exporter, sampler) belongs to the service; with no SDK installed the global tracer
 * is a no-op and spans cost nothing.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_ORGANIZATION_ID = "organization.id";
    public static final String ATTR_USER_ID = "user.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new internal span. A runtime exception marks the span as failed,
     * is recorded on it and is rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param attributes extra span attributes
     * @param work       the work to run
     * @return whatever {@code work} returns
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.organizationId() != null) {
                span.setAttribute(ATTR_ORGANIZATION_ID, ctx.organizationId());
            }
            if (ctx.userId() != null) {
                span.setAttribute(ATTR_USER_ID, ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #inSpan(String, Map, Supplier)}. */
    public void runInSpan(String spanName, Map<String, String> attributes, Runnable work) {
        inSpan(spanName, attributes, () -> {
            work.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }
}
