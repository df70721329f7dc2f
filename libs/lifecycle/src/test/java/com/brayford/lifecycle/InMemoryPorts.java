package com.brayford.lifecycle;

import com.brayford.lifecycle.port.DeletionRequestStore;
import com.brayford.lifecycle.port.MemberStore;
import com.brayford.lifecycle.port.OrganizationSummary;
import com.brayford.lifecycle.port.TenantDirectory;
import com.brayford.lifecycle.port.UserProfile;
import com.brayford.security.OrganizationMember;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-threaded fakes for the storage ports, with hooks for simulating a concurrent writer.
 */
final class InMemoryPorts {

    private InMemoryPorts() {
    }

    static final class RequestStore implements DeletionRequestStore {

        final Map<String, DeletionRequest> byId = new HashMap<>();
        final Map<String, String> currentByOrganization = new HashMap<>();
        /** Runs once, just before the next replace is evaluated. */
        Runnable beforeNextReplace;
        boolean alwaysConflict;
        int replaceCalls;

        @Override
        public Optional<DeletionRequest> findById(String requestId) {
            return Optional.ofNullable(byId.get(requestId));
        }

        @Override
        public Optional<DeletionRequest> findCurrentForOrganization(String organizationId) {
            return Optional.ofNullable(currentByOrganization.get(organizationId)).map(byId::get);
        }

        @Override
        public boolean create(DeletionRequest request, String expectedCurrentRequestId) {
            if (!Objects.equals(currentByOrganization.get(request.organizationId()), expectedCurrentRequestId)) {
                return false;
            }
            byId.put(request.id(), request);
            currentByOrganization.put(request.organizationId(), request.id());
            return true;
        }

        @Override
        public boolean replaceIfStatus(DeletionStatus expectedStatus, DeletionRequest updated) {
            replaceCalls++;
            if (beforeNextReplace != null) {
                Runnable hook = beforeNextReplace;
                beforeNextReplace = null;
                hook.run();
            }
            if (alwaysConflict) {
                return false;
            }
            DeletionRequest stored = byId.get(updated.id());
            if (stored == null || stored.status() != expectedStatus || stored.version() != updated.version() - 1) {
                return false;
            }
            byId.put(updated.id(), updated);
            return true;
        }

        /** Overwrites without any check, standing in for another process's write. */
        void forcePut(DeletionRequest request) {
            byId.put(request.id(), request);
        }
    }

    static final class Members implements MemberStore {

        final Map<String, OrganizationMember> byId = new LinkedHashMap<>();

        Members add(OrganizationMember... members) {
            for (OrganizationMember member : members) {
                create(member);
            }
            return this;
        }

        @Override
        public Optional<OrganizationMember> findById(String memberId) {
            return Optional.ofNullable(byId.get(memberId));
        }

        @Override
        public Optional<OrganizationMember> findByOrganizationAndUser(String organizationId, String userId) {
            return byId.values().stream()
                    .filter(m -> m.organizationId().equals(organizationId) && m.userId().equals(userId))
                    .findFirst();
        }

        @Override
        public List<OrganizationMember> listByOrganization(String organizationId) {
            return byId.values().stream().filter(m -> m.organizationId().equals(organizationId)).toList();
        }

        @Override
        public void create(OrganizationMember member) {
            if (byId.putIfAbsent(member.memberId(), member) != null) {
                throw new IllegalStateException("duplicate member " + member.memberId());
            }
        }

        @Override
        public boolean replace(OrganizationMember expected, OrganizationMember updated) {
            if (!expected.equals(byId.get(expected.memberId()))) {
                return false;
            }
            byId.put(updated.memberId(), updated);
            return true;
        }

        @Override
        public boolean delete(OrganizationMember expected) {
            return byId.remove(expected.memberId(), expected);
        }

        @Override
        public int deleteByOrganization(String organizationId) {
            var doomed = new ArrayList<>(listByOrganization(organizationId));
            doomed.forEach(m -> byId.remove(m.memberId()));
            return doomed.size();
        }
    }

    static final class Directory implements TenantDirectory {

        final Map<String, OrganizationSummary> organizations = new HashMap<>();
        final Map<String, UserProfile> users = new HashMap<>();

        Directory organization(String id, String name) {
            organizations.put(id, new OrganizationSummary(id, name));
            return this;
        }

        Directory user(String id, String email, String displayName) {
            users.put(id, new UserProfile(id, email, displayName));
            return this;
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

    /** A clock the test moves by hand. */
    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void set(Instant instant) {
            now = instant;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
