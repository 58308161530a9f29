package com.conduit.controller;

import com.conduit.exception.AllProvidersFailedException;
import com.conduit.exception.BudgetExceededException;
import com.conduit.exception.CapacityExceededException;
import com.conduit.exception.CircuitOpenException;
import com.conduit.exception.ErrorKind;
import com.conduit.exception.GatewayException;
import com.conduit.exception.ProviderPermanentException;
import com.conduit.exception.ProviderTransientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps gateway errors to HTTP responses with an {@code error} body:
 * {@code {"error": {"code", "message", "requestId", "details"}}}.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGateway(GatewayException ex, ServerWebExchange exchange) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getKind(), ex.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", ex.getKind(), ex.getMessage());
        }
        return error(status, ex.getKind().name(), ex.getMessage(), RequestIds.resolve(exchange.getRequest()),
                detailsOf(ex));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        String message = ex.getReason() != null ? ex.getReason() : "Malformed request";
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST.name(), message,
                RequestIds.resolve(exchange.getRequest()), null);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case BUDGET_EXCEEDED -> HttpStatus.PAYMENT_REQUIRED;
            case DEADLINE_EXCEEDED -> HttpStatus.GATEWAY_TIMEOUT;
            case CIRCUIT_OPEN, CAPACITY_EXCEEDED, PROVIDER_TRANSIENT -> HttpStatus.SERVICE_UNAVAILABLE;
            case PROVIDER_PERMANENT, ALL_PROVIDERS_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static Map<String, Object> detailsOf(GatewayException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex instanceof BudgetExceededException) {
            BudgetExceededException budget = (BudgetExceededException) ex;
            details.put("principal", budget.getPrincipal());
            details.put("requested", budget.getRequested());
            details.put("remaining", budget.getRemaining());
        } else if (ex instanceof AllProvidersFailedException) {
            Map<String, String> causes = new LinkedHashMap<>();
            ((AllProvidersFailedException) ex).getCauses()
                    .forEach((provider, cause) -> causes.put(provider, cause.getMessage()));
            details.put("causes", causes);
        } else if (ex instanceof CircuitOpenException) {
            details.put("provider", ((CircuitOpenException) ex).getProvider());
        } else if (ex instanceof CapacityExceededException) {
            details.put("provider", ((CapacityExceededException) ex).getProvider());
        } else if (ex instanceof ProviderTransientException) {
            details.put("provider", ((ProviderTransientException) ex).getProvider());
        } else if (ex instanceof ProviderPermanentException) {
            details.put("provider", ((ProviderPermanentException) ex).getProvider());
        }
        return details.isEmpty() ? null : details;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
                                                             String requestId, Map<String, Object> details) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message);
        err.put("requestId", requestId);
        if (details != null) {
            err.put("details", details);
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }
}
