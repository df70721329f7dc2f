package com.brayford.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "organization-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry and blank service name")
        void shouldRejectInvalidArguments() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Nested
    @DisplayName("Meters")
    class Meters {

        @Test
        @DisplayName("counter carries the service tag and extra tags")
        void counterTags() {
            var counter = factory.counter("brayford.deletion.transitions", "Deletion transitions",
                    "transition", "confirm", "outcome", "applied");
            counter.increment();

            var found = registry.get("brayford.deletion.transitions")
                    .tag("service", "organization-service")
                    .tag("transition", "confirm")
                    .tag("outcome", "applied")
                    .counter();
            assertThat(found.count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("registering the same counter twice returns the same meter")
        void counterIsShared() {
            factory.counter("c", "d", "k", "v").increment();
            factory.counter("c", "d", "k", "v").increment();
            assertThat(registry.get("c").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("timer records durations")
        void timerRecords() {
            var timer = factory.timer("brayford.deletion.sweep", "Completion sweep duration");
            timer.record(Duration.ofMillis(40));
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.getId().getTag("service")).isEqualTo("organization-service");
        }
    }
}
