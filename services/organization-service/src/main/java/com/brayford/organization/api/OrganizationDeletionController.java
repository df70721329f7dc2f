package com.brayford.organization.api;

import com.brayford.lifecycle.OrganizationDeletionService;
import com.brayford.lifecycle.ResourceNotFoundException;
import com.brayford.security.AuthenticatedUser;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry points of the organization deletion flow.
 *
 * <p>Confirm carries no caller: the emailed token is the credential. Undo needs both the token and
 * an authenticated member allowed to delete the organization.
 */
@RestController
@RequestMapping("/api/v1/organizations")
public class OrganizationDeletionController {

    private final OrganizationDeletionService deletionService;

    public OrganizationDeletionController(OrganizationDeletionService deletionService) {
        this.deletionService = deletionService;
    }

    @PostMapping("/{organizationId}/deletion")
    @ResponseStatus(HttpStatus.CREATED)
    public DeletionRequestView initiate(
            @PathVariable String organizationId,
            @Valid @RequestBody InitiateDeletionRequest body,
            AuthenticatedUser caller) {
        return DeletionRequestView.of(deletionService.initiate(organizationId, body.organizationName(), caller));
    }

    @GetMapping("/{organizationId}/deletion")
    public DeletionRequestView current(@PathVariable String organizationId, AuthenticatedUser caller) {
        return deletionService.currentRequest(organizationId, caller)
                .map(DeletionRequestView::of)
                .orElseThrow(() -> new ResourceNotFoundException("deletion request for organization", organizationId));
    }

    @PostMapping("/deletion/confirm")
    public DeletionRequestView confirm(@Valid @RequestBody TokenActionRequest body) {
        return DeletionRequestView.of(deletionService.confirm(body.requestId(), body.token()));
    }

    @PostMapping("/deletion/undo")
    public DeletionRequestView undo(@Valid @RequestBody TokenActionRequest body, AuthenticatedUser caller) {
        return DeletionRequestView.of(deletionService.undo(body.requestId(), body.token(), caller));
    }
}
