package com.conduit.exception;

/**
 * Request deadline passed. Aborts the whole request.
 */
public class DeadlineExceededException extends GatewayException {

    public DeadlineExceededException(String message) {
        super(ErrorKind.DEADLINE_EXCEEDED, message);
    }

    public DeadlineExceededException(String message, Throwable cause) {
        super(ErrorKind.DEADLINE_EXCEEDED, message, cause);
    }
}
