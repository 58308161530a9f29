package com.conduit.service.resilience;

/**
 * Retry classification of a failed attempt.
 */
public enum FailureKind {
    /** Retryable; counts toward the circuit. */
    TRANSIENT,
    /** Not retryable; does not count toward the circuit. */
    PERMANENT,
    /** Unclassified; retried once as transient, then surfaced. */
    UNKNOWN
}
