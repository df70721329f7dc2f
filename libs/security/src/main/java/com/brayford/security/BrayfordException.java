package com.brayford.security;

/**
 * Base type for every failure the authorization and tenant-lifecycle core reports.
 *
 * <p>Each subclass carries the structured context of its failure plus a stable
 * {@link #errorCode()} tag that HTTP and other adapters surface to callers. These are local,
 * deterministic failures: none of them is worth retrying.
 */
public abstract class BrayfordException extends RuntimeException {

    protected BrayfordException(String message) {
        super(message);
    }

    /** Stable machine-readable tag, e.g. {@code permission-denied}. */
    public abstract String errorCode();
}
