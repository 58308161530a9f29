package com.conduit.service.cost;

import com.conduit.model.BudgetPeriod;
import com.conduit.model.BudgetSnapshot;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Mutable spend counter of one principal. Callers hold the instance monitor.
 */
final class Budget {

    private final String principal;
    private final BigDecimal limit;
    private final BudgetPeriod period;
    private BigDecimal spentSoFar = BigDecimal.ZERO;
    private Instant periodStart;

    Budget(String principal, BigDecimal limit, BudgetPeriod period, Instant now) {
        this.principal = principal;
        this.limit = limit;
        this.period = period;
        this.periodStart = period.periodStart(now);
    }

    void rollIfNeeded(Instant now) {
        Instant current = period.periodStart(now);
        if (current.isAfter(periodStart)) {
            periodStart = current;
            spentSoFar = BigDecimal.ZERO;
        }
    }

    boolean fits(BigDecimal amount) {
        return limit == null || spentSoFar.add(amount).compareTo(limit) <= 0;
    }

    boolean hasHeadroom() {
        return limit == null || spentSoFar.compareTo(limit) < 0;
    }

    BigDecimal remaining() {
        return limit == null ? null : limit.subtract(spentSoFar).max(BigDecimal.ZERO);
    }

    void add(BigDecimal amount) {
        spentSoFar = spentSoFar.add(amount);
    }

    void subtract(BigDecimal amount) {
        spentSoFar = spentSoFar.subtract(amount).max(BigDecimal.ZERO);
    }

    boolean isOverLimit() {
        return limit != null && spentSoFar.compareTo(limit) > 0;
    }

    Instant getPeriodStart() {
        return periodStart;
    }

    BigDecimal getLimit() {
        return limit;
    }

    BigDecimal getSpentSoFar() {
        return spentSoFar;
    }

    BudgetSnapshot snapshot() {
        return BudgetSnapshot.builder()
                .principal(principal)
                .period(period)
                .limit(limit)
                .spentSoFar(spentSoFar)
                .periodStart(periodStart)
                .build();
    }
}
