package com.conduit.service.cost;

import com.conduit.config.ConduitProperties.BudgetConfig;
import com.conduit.exception.BudgetExceededException;
import com.conduit.model.BudgetPeriod;
import com.conduit.model.BudgetSnapshot;
import com.conduit.model.CompletionRequest;
import com.conduit.model.ProviderDescriptor;
import com.conduit.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per-principal spend accounting with reserve/commit/rollback around each provider call.
 * Every mutation of one principal happens under that principal's budget monitor, so
 * concurrent reservations can never jointly exceed the limit.
 */
@Slf4j
public class CostLedger {

    private final Clock clock;
    private final CostEstimator estimator;
    private final Map<String, BudgetConfig> configured;
    private final BigDecimal defaultLimit;
    private final BudgetPeriod defaultPeriod;
    private final Map<String, Budget> budgets = new ConcurrentHashMap<>();

    public CostLedger(Clock clock, CostEstimator estimator, List<BudgetConfig> budgetConfigs,
                      BigDecimal defaultLimit, BudgetPeriod defaultPeriod) {
        this.clock = clock;
        this.estimator = estimator;
        this.defaultLimit = defaultLimit;
        this.defaultPeriod = defaultPeriod != null ? defaultPeriod : BudgetPeriod.MONTHLY;

        Map<String, BudgetConfig> byPrincipal = new HashMap<>();
        for (BudgetConfig config : budgetConfigs) {
            if (config.getPrincipal() == null || config.getPrincipal().isBlank()) {
                throw new IllegalArgumentException("Budget principal must not be blank");
            }
            if (config.getLimit() != null && config.getLimit().signum() < 0) {
                throw new IllegalArgumentException("Budget limit must not be negative: " + config.getPrincipal());
            }
            if (byPrincipal.put(config.getPrincipal(), config) != null) {
                throw new IllegalArgumentException("Duplicate budget for principal: " + config.getPrincipal());
            }
        }
        this.configured = Map.copyOf(byPrincipal);
    }

    public CostLedger(Clock clock, CostEstimator estimator) {
        this(clock, estimator, List.of(), null, BudgetPeriod.MONTHLY);
    }

    public BigDecimal estimateCost(CompletionRequest request, ProviderDescriptor provider) {
        return estimator.estimate(request, provider);
    }

    public BigDecimal actualCost(ProviderDescriptor provider, TokenUsage usage) {
        return estimator.actual(provider, usage);
    }

    /**
     * Holds {@code amount} against the principal's budget.
     *
     * @throws BudgetExceededException if the amount does not fit; nothing is recorded
     */
    public Reservation reserve(String principal, BigDecimal amount) {
        Budget budget = budgetFor(principal);
        synchronized (budget) {
            budget.rollIfNeeded(clock.instant());
            if (!budget.fits(amount)) {
                throw new BudgetExceededException(principal, amount, budget.remaining());
            }
            budget.add(amount);
            log.debug("Reserved {} for {} (spent {})", amount, principal, budget.getSpentSoFar());
            return new Reservation(principal, amount, budget.getPeriodStart());
        }
    }

    /**
     * Replaces the reserved amount with the actual cost. A reservation from a period that
     * has since closed charges the actual cost to the current period.
     */
    public void commit(Reservation reservation, BigDecimal actualCost) {
        if (!reservation.settle()) {
            log.warn("Ignoring commit of already settled reservation {}", reservation);
            return;
        }
        Budget budget = budgetFor(reservation.getPrincipal());
        synchronized (budget) {
            budget.rollIfNeeded(clock.instant());
            if (budget.getPeriodStart().equals(reservation.getPeriodStart())) {
                budget.subtract(reservation.getAmount());
            }
            budget.add(actualCost);
            if (budget.isOverLimit()) {
                log.warn("Principal {} overshot its limit {}: spent {} after committing {} (reserved {})",
                        reservation.getPrincipal(), budget.getLimit(), budget.getSpentSoFar(),
                        actualCost, reservation.getAmount());
            }
        }
    }

    /**
     * Returns the reserved amount. No-op if the reservation's period has closed.
     */
    public void rollback(Reservation reservation) {
        if (!reservation.settle()) {
            return;
        }
        Budget budget = budgetFor(reservation.getPrincipal());
        synchronized (budget) {
            budget.rollIfNeeded(clock.instant());
            if (budget.getPeriodStart().equals(reservation.getPeriodStart())) {
                budget.subtract(reservation.getAmount());
            }
        }
    }

    /**
     * Records a charge outside the reservation cycle, subject to the limit.
     */
    public void charge(String principal, BigDecimal amount) {
        commit(reserve(principal, amount), amount);
    }

    public boolean hasHeadroom(String principal) {
        Budget budget = budgetFor(principal);
        synchronized (budget) {
            budget.rollIfNeeded(clock.instant());
            return budget.hasHeadroom();
        }
    }

    public BigDecimal remaining(String principal) {
        Budget budget = budgetFor(principal);
        synchronized (budget) {
            budget.rollIfNeeded(clock.instant());
            return budget.remaining();
        }
    }

    public Optional<BudgetSnapshot> snapshot(String principal) {
        Budget budget = budgets.get(principal);
        if (budget == null) {
            return configured.containsKey(principal) ? Optional.of(snapshotOf(budgetFor(principal))) : Optional.empty();
        }
        return Optional.of(snapshotOf(budget));
    }

    public List<BudgetSnapshot> snapshots() {
        configured.keySet().forEach(this::budgetFor);
        return budgets.values().stream()
                .map(this::snapshotOf)
                .sorted(Comparator.comparing(BudgetSnapshot::getPrincipal))
                .collect(Collectors.toList());
    }

    private BudgetSnapshot snapshotOf(Budget budget) {
        synchronized (budget) {
            budget.rollIfNeeded(clock.instant());
            return budget.snapshot();
        }
    }

    private Budget budgetFor(String principal) {
        return budgets.computeIfAbsent(principal, this::createBudget);
    }

    private Budget createBudget(String principal) {
        Instant now = clock.instant();
        BudgetConfig config = configured.get(principal);
        if (config != null) {
            BudgetPeriod period = config.getPeriod() != null ? config.getPeriod() : defaultPeriod;
            return new Budget(principal, config.getLimit(), period, now);
        }
        return new Budget(principal, defaultLimit, defaultPeriod, now);
    }
}
