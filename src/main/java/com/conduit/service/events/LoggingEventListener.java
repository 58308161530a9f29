package com.conduit.service.events;

import com.conduit.model.GatewayEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes every gateway event to the log.
 */
@Slf4j
@Component
public class LoggingEventListener implements GatewayEventListener {

    @Override
    public void onEvent(GatewayEvent event) {
        switch (event.getType()) {
            case PROVIDER_CALL_FAILED, CIRCUIT_OPENED, BUDGET_EXCEEDED ->
                    log.warn("[{}] {} provider={} {}", event.getRequestId(), event.getType(),
                            event.getProviderName(), event.getDetail());
            case CIRCUIT_CLOSED ->
                    log.info("[{}] {} provider={}", event.getRequestId(), event.getType(), event.getProviderName());
            default ->
                    log.debug("[{}] {} provider={} {}", event.getRequestId(), event.getType(),
                            event.getProviderName(), event.getDetail());
        }
    }
}
