package com.brayford.organization.infrastructure.schedule;

import com.brayford.lifecycle.port.CompletionScheduler;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Pending completion triggers, keyed by request id. {@link CompletionSweepJob} drains the due ones.
 */
@Component
public class InMemoryCompletionQueue implements CompletionScheduler {

    private final Map<String, Instant> dueAtByRequest = new ConcurrentHashMap<>();

    @Override
    public void scheduleCompletion(String requestId, Instant dueAt) {
        dueAtByRequest.put(requestId, dueAt);
    }

    @Override
    public void cancelCompletion(String requestId) {
        dueAtByRequest.remove(requestId);
    }

    /** Request ids whose trigger time is at or before {@code now}. */
    public List<String> dueAt(Instant now) {
        return dueAtByRequest.entrySet().stream()
                .filter(e -> !e.getValue().isAfter(now))
                .map(Map.Entry::getKey)
                .toList();
    }

    public void remove(String requestId) {
        dueAtByRequest.remove(requestId);
    }

    public int size() {
        return dueAtByRequest.size();
    }
}
