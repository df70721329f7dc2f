package com.brayford.organization.infrastructure.store;

import com.brayford.lifecycle.port.MemberStore;
import com.brayford.security.OrganizationMember;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * In-memory {@link MemberStore}. Every operation holds the store's monitor, so the owner count
 * checked before a write is the count the write sees.
 */
@Component
public class InMemoryMemberStore implements MemberStore {

    private final Map<String, OrganizationMember> byId = new LinkedHashMap<>();

    @Override
    public synchronized Optional<OrganizationMember> findById(String memberId) {
        return Optional.ofNullable(byId.get(memberId));
    }

    @Override
    public synchronized Optional<OrganizationMember> findByOrganizationAndUser(String organizationId, String userId) {
        return byId.values().stream()
                .filter(m -> m.organizationId().equals(organizationId) && m.userId().equals(userId))
                .findFirst();
    }

    @Override
    public synchronized List<OrganizationMember> listByOrganization(String organizationId) {
        return byId.values().stream()
                .filter(m -> m.organizationId().equals(organizationId))
                .toList();
    }

    @Override
    public synchronized void create(OrganizationMember member) {
        if (byId.containsKey(member.memberId())) {
            throw new IllegalStateException("member id already exists: " + member.memberId());
        }
        if (findByOrganizationAndUser(member.organizationId(), member.userId()).isPresent()) {
            throw new IllegalStateException(
                    "user " + member.userId() + " is already a member of " + member.organizationId());
        }
        byId.put(member.memberId(), member);
    }

    @Override
    public synchronized boolean replace(OrganizationMember expected, OrganizationMember updated) {
        if (!expected.equals(byId.get(expected.memberId()))) {
            return false;
        }
        if (expected.isOwner() && !updated.isOwner() && countOwners(expected.organizationId()) <= 1) {
            return false;
        }
        byId.put(updated.memberId(), updated);
        return true;
    }

    @Override
    public synchronized boolean delete(OrganizationMember expected) {
        if (!expected.equals(byId.get(expected.memberId()))) {
            return false;
        }
        if (expected.isOwner() && countOwners(expected.organizationId()) <= 1) {
            return false;
        }
        byId.remove(expected.memberId());
        return true;
    }

    @Override
    public synchronized int deleteByOrganization(String organizationId) {
        List<String> doomed = new ArrayList<>();
        byId.values().stream()
                .filter(m -> m.organizationId().equals(organizationId))
                .forEach(m -> doomed.add(m.memberId()));
        doomed.forEach(byId::remove);
        return doomed.size();
    }
}
