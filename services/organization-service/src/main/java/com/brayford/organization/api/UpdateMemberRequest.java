package com.brayford.organization.api;

import java.util.List;

/**
 * Partial update of a member. Omitted fields are left as they are.
 */
public record UpdateMemberRequest(String role, List<String> brandAccess) {
}
