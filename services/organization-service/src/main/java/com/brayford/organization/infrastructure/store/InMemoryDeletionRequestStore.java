package com.brayford.organization.infrastructure.store;

import com.brayford.lifecycle.DeletionRequest;
import com.brayford.lifecycle.DeletionStatus;
import com.brayford.lifecycle.port.DeletionRequestStore;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory {@link DeletionRequestStore}.
 *
 * <p>Both compare-and-swap writes run inside {@link ConcurrentHashMap#compute}, which is atomic
 * per key: {@code create} is keyed on the organization, {@code replaceIfStatus} on the request.
 */
@Component
public class InMemoryDeletionRequestStore implements DeletionRequestStore {

    private final Map<String, DeletionRequest> byId = new ConcurrentHashMap<>();
    private final Map<String, String> currentByOrganization = new ConcurrentHashMap<>();

    @Override
    public Optional<DeletionRequest> findById(String requestId) {
        return Optional.ofNullable(byId.get(requestId));
    }

    @Override
    public Optional<DeletionRequest> findCurrentForOrganization(String organizationId) {
        String requestId = currentByOrganization.get(organizationId);
        return requestId == null ? Optional.empty() : findById(requestId);
    }

    @Override
    public boolean create(DeletionRequest request, String expectedCurrentRequestId) {
        boolean[] created = {false};
        currentByOrganization.compute(request.organizationId(), (orgId, currentId) -> {
            if (!Objects.equals(currentId, expectedCurrentRequestId)) {
                return currentId;
            }
            if (byId.putIfAbsent(request.id(), request) != null) {
                return currentId;
            }
            created[0] = true;
            return request.id();
        });
        return created[0];
    }

    @Override
    public boolean replaceIfStatus(DeletionStatus expectedStatus, DeletionRequest updated) {
        boolean[] replaced = {false};
        byId.computeIfPresent(updated.id(), (id, stored) -> {
            if (stored.status() != expectedStatus || stored.version() != updated.version() - 1) {
                return stored;
            }
            replaced[0] = true;
            return updated;
        });
        return replaced[0];
    }
}
