package com.conduit.exception;

/**
 * Caller mistake. Never retried.
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
