package com.conduit.exception;

/**
 * Stable set of outcomes a caller of the gateway can branch on.
 */
public enum ErrorKind {
    INVALID_REQUEST,
    CAPACITY_EXCEEDED,
    CIRCUIT_OPEN,
    PROVIDER_TRANSIENT,
    PROVIDER_PERMANENT,
    BUDGET_EXCEEDED,
    DEADLINE_EXCEEDED,
    ALL_PROVIDERS_FAILED
}
