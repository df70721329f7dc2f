package com.brayford.observability;

/**
 * Immutable correlation context that flows with a request through the organization service.
 * <p>
 * Every incoming request establishes a {@code CorrelationContext}. Its values are pushed into the
 * SLF4J MDC by {@link CorrelationContextHolder} so every log line carries them, and the
 * correlation id is echoed back to the client for support requests.
 *
 * @param correlationId  unique id for the business flow (e.g. request, confirm, undo of one deletion)
 * @param organizationId organization the request acts on (nullable until resolved)
 * @param userId         authenticated caller (nullable for system-triggered work)
 * @param requestId      unique id for this specific request
 */
public record CorrelationContext(
        String correlationId,
        String organizationId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_ORGANIZATION_ID = "organizationId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Ensures correlationId is never null or blank.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** A system-originated context, e.g. for a scheduled completion run. */
    public static CorrelationContext system(String correlationId, String organizationId) {
        return new CorrelationContext(correlationId, organizationId, null, null);
    }

    public CorrelationContext withOrganization(String newOrganizationId) {
        return new CorrelationContext(correlationId, newOrganizationId, userId, requestId);
    }

    public CorrelationContext withUser(String newUserId) {
        return new CorrelationContext(correlationId, organizationId, newUserId, requestId);
    }
}
