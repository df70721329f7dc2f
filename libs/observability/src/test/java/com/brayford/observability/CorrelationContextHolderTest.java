package com.brayford.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, the MDC bridge, enrichment
 * and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store, retrieve and clear context")
        void shouldStoreAndClear() {
            var ctx = new CorrelationContext("corr-1", "org-1", "user-1", "req-1");
            CorrelationContextHolder.set(ctx);
            assertThat(CorrelationContextHolder.get()).contains(ctx);

            CorrelationContextHolder.clear();
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject null context and blank correlation ids")
        void shouldRejectInvalid() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
            assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate and clear MDC keys")
        void shouldPopulateAndClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "org-1", "user-1", "req-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("organizationId")).isEqualTo("org-1");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");

            CorrelationContextHolder.clear();
            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("organizationId")).isNull();
        }

        @Test
        @DisplayName("update() enriches the current context and the MDC")
        void updateEnriches() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, null, null));
            CorrelationContextHolder.update(ctx -> ctx.withOrganization("org-9").withUser("user-9"));

            assertThat(CorrelationContextHolder.get()).hasValueSatisfying(ctx -> {
                assertThat(ctx.correlationId()).isEqualTo("corr-1");
                assertThat(ctx.organizationId()).isEqualTo("org-9");
            });
            assertThat(MDC.get("userId")).isEqualTo("user-9");
        }

        @Test
        @DisplayName("update() is a no-op without a context")
        void updateWithoutContext() {
            CorrelationContextHolder.update(ctx -> ctx.withUser("user-9"));
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should restore the outer context even if the runnable throws")
        void shouldRestoreOnException() {
            var outer = new CorrelationContext("outer-corr", "org-1", null, null);
            var inner = CorrelationContext.system("inner-corr", "org-2");
            CorrelationContextHolder.set(outer);

            AtomicReference<String> seen = new AtomicReference<>();
            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(inner, () -> {
                seen.set(MDC.get("organizationId"));
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(seen.get()).isEqualTo("org-2");
            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should clear afterwards when no previous context existed")
        void shouldClearWhenNoPreviousContext() {
            CorrelationContextHolder.runWithContext(
                    CorrelationContext.system("sweep-1", null),
                    () -> assertThat(CorrelationContextHolder.get()).isPresent());

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(new CorrelationContext("main-corr", "org-1", null, null));

            AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
            Thread other = new Thread(() -> otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherThreadHasContext.get()).isFalse();
        }
    }
}
