package com.brayford.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Registers Micrometer meters stamped with the owning service's name.
 * <p>
 * Micrometer returns the already-registered meter for a repeated name and tag set, so callers may
 * look meters up on every use instead of holding them.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * @param tags alternating tag keys and values, e.g. {@code "transition", "confirmed"}
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }

    /** Same tagging as {@link #counter}. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }
}
