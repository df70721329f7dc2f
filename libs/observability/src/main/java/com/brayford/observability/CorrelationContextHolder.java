package com.brayford.observability;

import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Per-thread home of the current {@link CorrelationContext}, kept in step with the SLF4J MDC so
 * log lines carry the same ids.
 * <p>
 * Null fields of the context are absent from the MDC rather than logged as "null". Work moved to
 * another thread, such as a scheduled sweep, must set its own context with
 * {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private static final Map<String, Function<CorrelationContext, String>> MDC_FIELDS = Map.of(
            CorrelationContext.MDC_CORRELATION_ID, CorrelationContext::correlationId,
            CorrelationContext.MDC_ORGANIZATION_ID, CorrelationContext::organizationId,
            CorrelationContext.MDC_USER_ID, CorrelationContext::userId,
            CorrelationContext.MDC_REQUEST_ID, CorrelationContext::requestId);

    private CorrelationContextHolder() {
    }

    /**
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        MDC_FIELDS.forEach((key, field) -> {
            String value = field.apply(context);
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Swaps in an enriched copy of the current context, typically once the organization or caller
     * of a request is known. A thread without a context is left without one.
     */
    public static void update(UnaryOperator<CorrelationContext> enrich) {
        get().map(enrich).ifPresent(CorrelationContextHolder::set);
    }

    public static void clear() {
        CURRENT.remove();
        MDC_FIELDS.keySet().forEach(MDC::remove);
    }

    /**
     * Runs {@code work} under {@code context}; whatever context the thread had before is put back
     * afterwards.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        Optional<CorrelationContext> outer = get();
        set(context);
        try {
            work.run();
        } finally {
            outer.ifPresentOrElse(CorrelationContextHolder::set, CorrelationContextHolder::clear);
        }
    }
}
