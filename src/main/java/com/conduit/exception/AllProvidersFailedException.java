package com.conduit.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Terminal failure after every candidate was tried.
 * {@code causes} maps provider name to its last error, in attempt order.
 */
@Getter
public class AllProvidersFailedException extends GatewayException {

    private final Map<String, Throwable> causes;

    public AllProvidersFailedException(String message, Map<String, Throwable> causes) {
        super(ErrorKind.ALL_PROVIDERS_FAILED, describe(message, causes));
        this.causes = Collections.unmodifiableMap(new LinkedHashMap<>(causes));
        causes.values().forEach(this::addSuppressed);
    }

    private static String describe(String message, Map<String, Throwable> causes) {
        if (causes.isEmpty()) {
            return message;
        }
        return message + ": " + causes.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().getMessage())
                .collect(Collectors.joining("; "));
    }
}
