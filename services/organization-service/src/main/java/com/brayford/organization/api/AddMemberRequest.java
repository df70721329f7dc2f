package com.brayford.organization.api;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * @param userId      the invited user
 * @param role        role value, e.g. "admin"
 * @param brandAccess brands granted to a member-role user; may be omitted
 */
public record AddMemberRequest(@NotBlank String userId, @NotBlank String role, List<String> brandAccess) {
}
