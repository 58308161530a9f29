package com.conduit.service.registry;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-flight slot held on a provider. Closing releases the slot exactly once.
 */
public final class ProviderLease implements AutoCloseable {

    private final String provider;
    private final Runnable releaser;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ProviderLease(String provider, Runnable releaser) {
        this.provider = provider;
        this.releaser = releaser;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.run();
        }
    }
}
