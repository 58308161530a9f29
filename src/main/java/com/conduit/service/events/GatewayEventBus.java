package com.conduit.service.events;

import com.conduit.model.GatewayEvent;
import com.conduit.model.GatewayEventType;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous publish/subscribe bus for lifecycle events.
 * Listeners run in subscription order on the publishing thread; a failing listener is
 * logged and skipped, never propagated to the request pipeline.
 */
@Slf4j
public class GatewayEventBus {

    private final List<GatewayEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public GatewayEventBus(Clock clock) {
        this.clock = clock;
    }

    public Disposable subscribe(GatewayEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(GatewayEvent event) {
        for (GatewayEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener {} failed on {} for request {}: {}",
                        listener.getClass().getSimpleName(), event.getType(), event.getRequestId(), e.toString());
            }
        }
    }

    public void publish(GatewayEventType type, String requestId) {
        publish(GatewayEvent.of(type, requestId, clock.instant()));
    }

    public void publish(GatewayEventType type, String requestId, String providerName, String detail) {
        publish(GatewayEvent.builder()
                .type(type)
                .requestId(requestId)
                .timestamp(clock.instant())
                .providerName(providerName)
                .detail(detail)
                .build());
    }

    public int listenerCount() {
        return listeners.size();
    }
}
