package com.conduit.exception;

import lombok.Getter;

/**
 * Provider concurrency limit reached.
 */
@Getter
public class CapacityExceededException extends GatewayException {

    private final String provider;

    public CapacityExceededException(String provider, int maxConcurrency) {
        super(ErrorKind.CAPACITY_EXCEEDED,
                "Provider " + provider + " is at its concurrency limit of " + maxConcurrency);
        this.provider = provider;
    }
}
