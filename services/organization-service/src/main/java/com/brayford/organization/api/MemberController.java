package com.brayford.organization.api;

import com.brayford.organization.domain.MembershipService;
import com.brayford.security.AuthenticatedUser;
import com.brayford.security.OrganizationMember;
import com.brayford.security.OrganizationRole;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/organizations/{organizationId}/members")
public class MemberController {

    private final MembershipService membershipService;

    public MemberController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @GetMapping
    public List<MemberView> list(@PathVariable String organizationId, AuthenticatedUser caller) {
        return membershipService.listMembers(organizationId, caller).stream().map(MemberView::of).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MemberView add(
            @PathVariable String organizationId,
            @Valid @RequestBody AddMemberRequest body,
            AuthenticatedUser caller) {
        OrganizationMember added = membershipService.addInvitedMember(
                organizationId, caller, body.userId(), parseRole(body.role()), body.brandAccess());
        return MemberView.of(added);
    }

    @PatchMapping("/{memberId}")
    public MemberView update(
            @PathVariable String organizationId,
            @PathVariable String memberId,
            @RequestBody UpdateMemberRequest body,
            AuthenticatedUser caller) {
        if (body.role() == null && body.brandAccess() == null) {
            throw new IllegalArgumentException("Nothing to update: provide role and/or brandAccess");
        }
        OrganizationMember result = null;
        if (body.role() != null) {
            result = membershipService.changeRole(organizationId, memberId, caller, parseRole(body.role()));
        }
        if (body.brandAccess() != null) {
            result = membershipService.updateBrandAccess(organizationId, memberId, caller, body.brandAccess());
        }
        return MemberView.of(result);
    }

    @DeleteMapping("/{memberId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(
            @PathVariable String organizationId, @PathVariable String memberId, AuthenticatedUser caller) {
        membershipService.removeMember(organizationId, memberId, caller);
    }

    private static OrganizationRole parseRole(String value) {
        return OrganizationRole.fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}
