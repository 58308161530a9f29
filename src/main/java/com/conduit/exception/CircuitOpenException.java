package com.conduit.exception;

import lombok.Getter;

/**
 * Provider rejected locally because its circuit is open (or a half-open trial is already running).
 */
@Getter
public class CircuitOpenException extends GatewayException {

    private final String provider;

    public CircuitOpenException(String provider) {
        super(ErrorKind.CIRCUIT_OPEN, "Circuit for provider " + provider + " is open");
        this.provider = provider;
    }
}
