package com.conduit.service.events;

import com.conduit.model.GatewayEvent;

/**
 * Subscriber to gateway lifecycle events. Invoked synchronously on the publishing thread,
 * so implementations must return quickly.
 */
@FunctionalInterface
public interface GatewayEventListener {

    void onEvent(GatewayEvent event);
}
