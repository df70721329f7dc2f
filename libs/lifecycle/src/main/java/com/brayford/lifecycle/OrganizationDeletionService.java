package com.brayford.lifecycle;

import com.brayford.lifecycle.notification.DeletionNotification;
import com.brayford.lifecycle.notification.NotificationFormatter;
import com.brayford.lifecycle.port.CompletionScheduler;
import com.brayford.lifecycle.port.DeletionNotifier;
import com.brayford.lifecycle.port.DeletionRequestStore;
import com.brayford.lifecycle.port.MemberStore;
import com.brayford.lifecycle.port.OrganizationPurger;
import com.brayford.lifecycle.port.OrganizationSummary;
import com.brayford.lifecycle.port.TenantDirectory;
import com.brayford.lifecycle.port.UserProfile;
import com.brayford.observability.CorrelationContextHolder;
import com.brayford.observability.MetricFactory;
import com.brayford.security.AuthenticatedUser;
import com.brayford.security.BrayfordException;
import com.brayford.security.OrganizationMember;
import com.brayford.security.PermissionChecker;
import com.brayford.security.PermissionDeniedException;
import com.brayford.security.Permissions;
import com.brayford.security.TenantIsolationEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the organization deletion flow against storage and the outside world.
 *
 * <p>Each operation reads the clock once, checks the caller through the authorization guard,
 * applies a {@link DeletionLifecycle} transition and writes it with compare-and-swap. When a
 * concurrent writer wins, the request is re-read and the transition re-evaluated against the
 * fresh state, up to {@code maxWriteAttempts} times. Email is sent only after a write succeeds
 * and a failed send is logged, never propagated.
 */
public class OrganizationDeletionService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationDeletionService.class);

    static final String METRIC_TRANSITIONS = "organization.deletion.transitions";
    static final String METRIC_REJECTIONS = "organization.deletion.rejections";
    static final String METRIC_WRITE_CONFLICTS = "organization.deletion.write.conflicts";
    static final String METRIC_NOTIFICATION_FAILURES = "organization.deletion.notification.failures";

    private final DeletionLifecycle lifecycle;
    private final DeletionRequestStore requests;
    private final MemberStore members;
    private final TenantDirectory directory;
    private final DeletionNotifier notifier;
    private final CompletionScheduler scheduler;
    private final OrganizationPurger purger;
    private final NotificationFormatter formatter;
    private final MetricFactory metrics;
    private final Clock clock;
    private final int maxWriteAttempts;
    private final Supplier<String> requestIds;

    public OrganizationDeletionService(
            DeletionLifecycle lifecycle,
            DeletionRequestStore requests,
            MemberStore members,
            TenantDirectory directory,
            DeletionNotifier notifier,
            CompletionScheduler scheduler,
            OrganizationPurger purger,
            NotificationFormatter formatter,
            MetricFactory metrics,
            Clock clock,
            int maxWriteAttempts) {
        this(lifecycle, requests, members, directory, notifier, scheduler, purger, formatter,
                metrics, clock, maxWriteAttempts, () -> UUID.randomUUID().toString());
    }

    public OrganizationDeletionService(
            DeletionLifecycle lifecycle,
            DeletionRequestStore requests,
            MemberStore members,
            TenantDirectory directory,
            DeletionNotifier notifier,
            CompletionScheduler scheduler,
            OrganizationPurger purger,
            NotificationFormatter formatter,
            MetricFactory metrics,
            Clock clock,
            int maxWriteAttempts,
            Supplier<String> requestIds) {
        if (maxWriteAttempts < 1) {
            throw new IllegalArgumentException("maxWriteAttempts must be at least 1");
        }
        this.lifecycle = lifecycle;
        this.requests = requests;
        this.members = members;
        this.directory = directory;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.purger = purger;
        this.formatter = formatter;
        this.metrics = metrics;
        this.clock = clock;
        this.maxWriteAttempts = maxWriteAttempts;
        this.requestIds = requestIds;
    }

    /**
     * Opens a deletion request and emails the confirmation link to the requester.
     *
     * @param typedName the organization name as typed by the user; compared ignoring case and
     *                  surrounding whitespace
     * @throws ResourceNotFoundException        if the organization does not exist
     * @throws PermissionDeniedException        if the caller may not delete the organization
     * @throws IllegalArgumentException         if the typed name does not match or the caller has
     *                                          no email address to send the link to
     * @throws DeletionAlreadyPendingException  if an active request already exists
     */
    public DeletionRequest initiate(String organizationId, String typedName, AuthenticatedUser caller) {
        Instant now = clock.instant();
        CorrelationContextHolder.update(ctx -> ctx.withOrganization(organizationId).withUser(caller.userId()));

        OrganizationSummary organization = directory.findOrganization(organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("organization", organizationId));
        OrganizationMember actor = requireMember(organizationId, caller.userId());
        guard(() -> PermissionChecker.requireCapability(actor, Permissions.ORG_DELETE));
        if (typedName == null || !organization.name().strip().equalsIgnoreCase(typedName.strip())) {
            throw new IllegalArgumentException("Organization name does not match");
        }
        if (caller.email() == null || caller.email().isBlank()) {
            throw new IllegalArgumentException("User account has no email address");
        }

        DeletionRequest created = null;
        for (int attempt = 1; attempt <= maxWriteAttempts && created == null; attempt++) {
            Optional<DeletionRequest> current = requests.findCurrentForOrganization(organizationId);
            if (current.isPresent() && current.get().blocksNewRequest(now)) {
                DeletionRequest existing = current.get();
                rejected(DeletionAlreadyPendingException.CODE);
                throw new DeletionAlreadyPendingException(organizationId, existing.id(), existing.status());
            }
            DeletionRequest candidate = lifecycle.request(
                    requestIds.get(), organizationId, organization.name(), caller.userId(),
                    Map.of("requesterEmail", caller.email()), now);
            String expectedCurrent = current.map(DeletionRequest::id).orElse(null);
            if (requests.create(candidate, expectedCurrent)) {
                created = candidate;
                current.ifPresent(superseded -> log.info(
                        "Deletion request {} supersedes {} ({}) for organization {}",
                        candidate.id(), superseded.id(), superseded.status().value(), organizationId));
            } else {
                conflict(organizationId, "request", attempt);
            }
        }
        if (created == null) {
            throw new WriteConflictException(organizationId, maxWriteAttempts);
        }

        transitioned("requested");
        log.info("Deletion requested for organization {} by user {}; request {} awaiting confirmation until {}",
                organizationId, caller.userId(), created.id(), created.tokenExpiresAt());

        notifySafely(new DeletionNotification.Confirm(
                caller.email(),
                organizationId,
                organization.name(),
                caller.bestName(),
                formatter.confirmationLink(created.id(), created.confirmationToken()),
                formatter.formatInstant(created.tokenExpiresAt())));
        return created;
    }

    /**
     * Confirms a pending request with the emailed token. The link is the credential; no caller
     * identity is needed. Alerts every other member allowed to delete the organization and
     * schedules completion.
     */
    public DeletionRequest confirm(String requestId, String token) {
        Instant now = clock.instant();

        DeletionRequest confirmed = writeWithRetry(requestId, "confirm",
                current -> Optional.of(lifecycle.confirm(current, token, now)))
                .orElseThrow(() -> new IllegalStateException("confirm produced no transition"));

        CorrelationContextHolder.update(ctx -> ctx.withOrganization(confirmed.organizationId()));
        transitioned("confirmed");
        log.info("Deletion of organization {} confirmed via request {}; scheduled for {}",
                confirmed.organizationId(), requestId, confirmed.scheduledDeletionAt());

        scheduler.scheduleCompletion(requestId, confirmed.scheduledDeletionAt());
        alertDeleters(confirmed);
        return confirmed;
    }

    /**
     * Cancels a confirmed request inside the undo window.
     *
     * @throws PermissionDeniedException if the caller may not delete the organization
     */
    public DeletionRequest undo(String requestId, String token, AuthenticatedUser caller) {
        Instant now = clock.instant();

        DeletionRequest existing = requests.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("deletion request", requestId));
        CorrelationContextHolder.update(ctx -> ctx.withOrganization(existing.organizationId()).withUser(caller.userId()));
        OrganizationMember actor = requireMember(existing.organizationId(), caller.userId());
        guard(() -> PermissionChecker.requireCapability(actor, Permissions.ORG_DELETE));

        DeletionRequest cancelled = writeWithRetry(requestId, "undo",
                current -> Optional.of(lifecycle.undo(current, token, caller.userId(), now)))
                .orElseThrow(() -> new IllegalStateException("undo produced no transition"));

        scheduler.cancelCompletion(requestId);
        transitioned("undone");
        log.info("Deletion of organization {} undone by user {} (request {})",
                cancelled.organizationId(), caller.userId(), requestId);
        return cancelled;
    }

    /**
     * Completes a request whose grace period is over: archives it, purges the organization and
     * tells every former member. Safe to call at any time and any number of times; returns empty
     * when there is nothing to do.
     *
     * <p>The purge runs before the request is marked completed, so a purge that throws leaves the
     * request confirmed and the next trigger purges again. The purger must therefore tolerate
     * being called more than once for the same organization.
     */
    public Optional<DeletionRequest> complete(String requestId) {
        Instant now = clock.instant();

        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            Optional<DeletionRequest> found = requests.findById(requestId);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            DeletionRequest current = found.get();
            Optional<DeletionRequest> next = lifecycle.complete(current, now);
            if (next.isEmpty()) {
                log.debug("Completion of deletion request {} skipped: not due", requestId);
                return next;
            }

            DeletionRequest request = next.get();
            CorrelationContextHolder.update(ctx -> ctx.withOrganization(request.organizationId()));
            List<OrganizationMember> formerMembers = members.listByOrganization(request.organizationId());
            purger.purge(DeletedOrganizationAudit.of(request, formerMembers.size()));

            if (requests.replaceIfStatus(current.status(), request)) {
                transitioned("completed");
                log.info("Organization {} permanently deleted (request {}, {} members removed)",
                        request.organizationId(), requestId, formerMembers.size());
                notifyFormerMembers(request, formerMembers);
                return next;
            }
            conflict(requestId, "complete", attempt);
        }
        throw new WriteConflictException(requestId, maxWriteAttempts);
    }

    /**
     * The organization's latest deletion request, visible to any member of the organization.
     */
    public Optional<DeletionRequest> currentRequest(String organizationId, AuthenticatedUser caller) {
        requireMember(organizationId, caller.userId());
        return requests.findCurrentForOrganization(organizationId);
    }

    private Optional<DeletionRequest> writeWithRetry(
            String requestId,
            String transition,
            Function<DeletionRequest, Optional<DeletionRequest>> step) {
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            DeletionRequest current = requests.findById(requestId)
                    .orElseThrow(() -> new ResourceNotFoundException("deletion request", requestId));

            Optional<DeletionRequest> next;
            try {
                next = step.apply(current);
            } catch (BrayfordException e) {
                rejected(e.errorCode());
                log.info("Rejected {} of deletion request {}: {}", transition, requestId, e.getMessage());
                throw e;
            }
            if (next.isEmpty()) {
                return next;
            }
            if (requests.replaceIfStatus(current.status(), next.get())) {
                return next;
            }
            conflict(requestId, transition, attempt);
        }
        throw new WriteConflictException(requestId, maxWriteAttempts);
    }

    private void notifyFormerMembers(DeletionRequest completed, List<OrganizationMember> formerMembers) {
        String deletedAt = formatter.formatInstant(completed.completedAt());
        for (OrganizationMember member : formerMembers) {
            directory.findUser(member.userId())
                    .filter(profile -> profile.email() != null)
                    .ifPresent(profile -> notifySafely(new DeletionNotification.Complete(
                            profile.email(), completed.organizationId(), completed.organizationName(), deletedAt)));
        }
    }

    private void alertDeleters(DeletionRequest confirmed) {
        String confirmedBy = directory.findUser(confirmed.requestedBy())
                .map(UserProfile::bestName)
                .orElse("A team member");
        String scheduledAt = formatter.formatInstant(confirmed.scheduledDeletionAt());
        String undoLink = formatter.undoLink(confirmed.id(), confirmed.undoToken());
        String undoExpiresAt = formatter.formatInstant(confirmed.undoExpiresAt());

        for (OrganizationMember member : members.listByOrganization(confirmed.organizationId())) {
            if (member.userId().equals(confirmed.requestedBy())
                    || !PermissionChecker.hasCapability(member, Permissions.ORG_DELETE)) {
                continue;
            }
            directory.findUser(member.userId())
                    .filter(profile -> profile.email() != null)
                    .ifPresent(profile -> notifySafely(new DeletionNotification.Alert(
                            profile.email(), confirmed.organizationId(), confirmed.organizationName(),
                            confirmedBy, scheduledAt, undoLink, undoExpiresAt)));
        }
    }

    private OrganizationMember requireMember(String organizationId, String userId) {
        OrganizationMember member = members.findByOrganizationAndUser(organizationId, userId)
                .orElseThrow(() -> {
                    rejected(PermissionDeniedException.CODE);
                    return PermissionDeniedException.notAMember(userId, organizationId);
                });
        TenantIsolationEnforcer.enforce(member, organizationId);
        return member;
    }

    private void guard(Runnable check) {
        try {
            check.run();
        } catch (BrayfordException e) {
            rejected(e.errorCode());
            throw e;
        }
    }

    private void notifySafely(DeletionNotification notification) {
        try {
            notifier.send(notification);
        } catch (RuntimeException e) {
            metrics.counter(METRIC_NOTIFICATION_FAILURES, "Deletion emails that failed to send",
                    "template", notification.templateAlias()).increment();
            log.error("Failed to send {} email for organization {}",
                    notification.templateAlias(), notification.organizationId(), e);
        }
    }

    private void transitioned(String transition) {
        metrics.counter(METRIC_TRANSITIONS, "Applied deletion lifecycle transitions",
                "transition", transition).increment();
    }

    private void rejected(String errorCode) {
        metrics.counter(METRIC_REJECTIONS, "Rejected deletion lifecycle operations",
                "reason", errorCode).increment();
    }

    private void conflict(String resourceId, String transition, int attempt) {
        metrics.counter(METRIC_WRITE_CONFLICTS, "Lost compare-and-swap writes",
                "transition", transition).increment();
        log.info("Concurrent update of {} during {}; re-reading (attempt {}/{})",
                resourceId, transition, attempt, maxWriteAttempts);
    }
}
