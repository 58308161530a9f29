package com.conduit.exception;

import lombok.Getter;

/**
 * Retryable provider failure: network timeout, 5xx, rate limiting.
 * {@code unknown} marks an unclassified failure, which is retried only once.
 */
@Getter
public class ProviderTransientException extends GatewayException {

    private final String provider;
    private final boolean unknown;

    public ProviderTransientException(String provider, String message) {
        this(provider, message, null, false);
    }

    public ProviderTransientException(String provider, String message, Throwable cause) {
        this(provider, message, cause, false);
    }

    private ProviderTransientException(String provider, String message, Throwable cause, boolean unknown) {
        super(ErrorKind.PROVIDER_TRANSIENT, message, cause);
        this.provider = provider;
        this.unknown = unknown;
    }

    public static ProviderTransientException unknown(String provider, Throwable cause) {
        return new ProviderTransientException(provider,
                "Unexpected failure from provider " + provider + ": " + cause.getMessage(), cause, true);
    }
}
