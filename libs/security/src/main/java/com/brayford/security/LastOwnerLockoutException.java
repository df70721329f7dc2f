package com.brayford.security;

/**
 * The sole owner of an organization tried to give up ownership.
 *
 * <p>An organization with zero owners can never regain one, so this is refused outright. The
 * message tells the caller to promote another owner first.
 */
public class LastOwnerLockoutException extends BrayfordException {

    public static final String CODE = "last-owner-lockout";

    private final String organizationId;
    private final String userId;
    private final int ownerCount;

    public LastOwnerLockoutException(String organizationId, String userId, int ownerCount) {
        super("Cannot change role. You are the only owner of this organisation. "
                + "Invite or promote another owner first.");
        this.organizationId = organizationId;
        this.userId = userId;
        this.ownerCount = ownerCount;
    }

    public String organizationId() {
        return organizationId;
    }

    public String userId() {
        return userId;
    }

    public int ownerCount() {
        return ownerCount;
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
