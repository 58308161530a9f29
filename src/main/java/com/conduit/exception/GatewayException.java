package com.conduit.exception;

import lombok.Getter;

/**
 * Base of every error the gateway surfaces to callers.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    protected GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Whether the failure is confined to one provider attempt, so the next candidate may be tried.
     */
    public boolean isCandidateLocal() {
        return switch (kind) {
            case CAPACITY_EXCEEDED, CIRCUIT_OPEN, PROVIDER_TRANSIENT, PROVIDER_PERMANENT, BUDGET_EXCEEDED -> true;
            default -> false;
        };
    }
}
