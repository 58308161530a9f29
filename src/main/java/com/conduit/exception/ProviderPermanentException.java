package com.conduit.exception;

import lombok.Getter;

/**
 * Non-retryable provider failure: malformed request, authentication failure.
 */
@Getter
public class ProviderPermanentException extends GatewayException {

    private final String provider;

    public ProviderPermanentException(String provider, String message) {
        super(ErrorKind.PROVIDER_PERMANENT, message);
        this.provider = provider;
    }

    public ProviderPermanentException(String provider, String message, Throwable cause) {
        super(ErrorKind.PROVIDER_PERMANENT, message, cause);
        this.provider = provider;
    }
}
