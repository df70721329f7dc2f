package com.brayford.organization.infrastructure.store;

import com.brayford.lifecycle.port.OrganizationSummary;
import com.brayford.lifecycle.port.TenantDirectory;
import com.brayford.lifecycle.port.UserProfile;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * In-memory {@link TenantDirectory}, populated through {@link #registerOrganization} and
 * {@link #registerUser}.
 */
@Component
public class InMemoryTenantDirectory implements TenantDirectory {

    private final Map<String, OrganizationSummary> organizations = new ConcurrentHashMap<>();
    private final Map<String, UserProfile> users = new ConcurrentHashMap<>();

    public void registerOrganization(String organizationId, String name) {
        organizations.put(organizationId, new OrganizationSummary(organizationId, name));
    }

    public void registerUser(UserProfile profile) {
        users.put(profile.userId(), profile);
    }

    @Override
    public Optional<OrganizationSummary> findOrganization(String organizationId) {
        return Optional.ofNullable(organizations.get(organizationId));
    }

    @Override
    public Optional<UserProfile> findUser(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public boolean removeOrganization(String organizationId) {
        return organizations.remove(organizationId) != null;
    }
}
