package com.conduit.service.cost;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Amount held against a principal's budget while a provider call is in flight.
 * Settled exactly once, by commit or rollback.
 */
@Getter
@ToString(exclude = "settled")
public final class Reservation {

    private final String principal;
    private final BigDecimal amount;
    private final Instant periodStart;
    private final AtomicBoolean settled = new AtomicBoolean();

    Reservation(String principal, BigDecimal amount, Instant periodStart) {
        this.principal = principal;
        this.amount = amount;
        this.periodStart = periodStart;
    }

    public boolean isSettled() {
        return settled.get();
    }

    boolean settle() {
        return settled.compareAndSet(false, true);
    }
}
