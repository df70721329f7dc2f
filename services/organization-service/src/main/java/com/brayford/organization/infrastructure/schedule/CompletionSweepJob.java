package com.brayford.organization.infrastructure.schedule;

import com.brayford.lifecycle.OrganizationDeletionService;
import com.brayford.observability.CorrelationContext;
import com.brayford.observability.CorrelationContextHolder;
import com.brayford.observability.MetricFactory;
import com.brayford.observability.SpanHelper;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically fires completion for every due request in the {@link InMemoryCompletionQueue}.
 *
 * <p>A trigger is dropped once completion has run or reported nothing to do. A trigger whose
 * completion throws stays queued and is retried on the next sweep.
 */
@Component
public class CompletionSweepJob {

    private static final Logger log = LoggerFactory.getLogger(CompletionSweepJob.class);

    static final String METRIC_SWEEP = "organization.deletion.sweep";
    static final String SPAN_COMPLETE = "organization.deletion.complete";
    static final String ATTR_REQUEST_ID = "deletion.request.id";

    private final InMemoryCompletionQueue queue;
    private final OrganizationDeletionService deletionService;
    private final SpanHelper spans;
    private final Timer sweepTimer;
    private final Clock clock;

    public CompletionSweepJob(
            InMemoryCompletionQueue queue,
            OrganizationDeletionService deletionService,
            SpanHelper spans,
            MetricFactory metrics,
            Clock clock) {
        this.queue = queue;
        this.deletionService = deletionService;
        this.spans = spans;
        this.sweepTimer = metrics.timer(METRIC_SWEEP, "Duration of one completion sweep");
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${brayford.deletion.completion-sweep-interval:PT1M}")
    public void sweep() {
        sweepTimer.record(() -> {
            for (String requestId : queue.dueAt(clock.instant())) {
                var context = CorrelationContext.system(UUID.randomUUID().toString(), null);
                CorrelationContextHolder.runWithContext(context, () -> completeOne(requestId));
            }
        });
    }

    private void completeOne(String requestId) {
        try {
            spans.runInSpan(SPAN_COMPLETE, Map.of(ATTR_REQUEST_ID, requestId),
                    () -> deletionService.complete(requestId));
            queue.remove(requestId);
        } catch (RuntimeException e) {
            log.error("Completion of deletion request {} failed; will retry on next sweep", requestId, e);
        }
    }
}
