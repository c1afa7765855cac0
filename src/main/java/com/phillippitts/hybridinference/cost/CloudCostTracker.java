package com.phillippitts.hybridinference.cost;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates cloud spend and token counts per provider for the lifetime of the process.
 *
 * <p><b>Thread Safety:</b> writers ({@link #recordRequest}, {@link #reset}) are serialized by a
 * {@link ReentrantLock}. After each write a fresh immutable {@link CostSummary} is published through
 * a volatile field, so {@link #summary()} and {@link #wouldExceedBudget} never take the lock.
 * A reader may see the snapshot from just before a concurrent write.
 *
 * <p>The grand total is derived from the per-provider totals on every write, so
 * {@code totalCostUsd == sum(costByProvider)} holds for every published snapshot.
 */
@Component
public class CloudCostTracker {
    private static final Logger LOG = LogManager.getLogger(CloudCostTracker.class);

    private final ReentrantLock writeLock = new ReentrantLock();

    // Guarded by writeLock
    private final Map<String, Double> costByProvider = new HashMap<>();
    private final Map<String, Long> requestsByProvider = new HashMap<>();
    private long totalInputTokens;
    private long totalOutputTokens;
    private long totalRequests;

    private volatile CostSummary snapshot = CostSummary.EMPTY;

    /**
     * Records one completed cloud request.
     *
     * @throws IllegalArgumentException if any count or cost is negative, or the provider id is blank
     */
    public void recordRequest(String providerId, int inputTokens, int outputTokens, double costUsd) {
        Objects.requireNonNull(providerId, "providerId");
        if (providerId.isBlank()) {
            throw new IllegalArgumentException("providerId must not be blank");
        }
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("token counts must be >= 0");
        }
        if (Double.isNaN(costUsd) || Double.isInfinite(costUsd) || costUsd < 0.0) {
            throw new IllegalArgumentException("costUsd must be a finite value >= 0: " + costUsd);
        }

        writeLock.lock();
        try {
            costByProvider.merge(providerId, costUsd, Double::sum);
            requestsByProvider.merge(providerId, 1L, Long::sum);
            totalInputTokens += inputTokens;
            totalOutputTokens += outputTokens;
            totalRequests++;
            snapshot = buildSnapshot();
        } finally {
            writeLock.unlock();
        }
        LOG.debug("Recorded cloud request: provider={}, in={}, out={}, cost={}", providerId,
                inputTokens, outputTokens, costUsd);
    }

    /** @return the latest snapshot; never blocks */
    public CostSummary summary() {
        return snapshot;
    }

    /**
     * Budget check against the current running total.
     *
     * @param costUsd cost of the pending request
     * @param budgetUsd cap; {@code <= 0} means unlimited
     * @return true if recording {@code costUsd} would take the total strictly above the cap
     */
    public boolean wouldExceedBudget(double costUsd, double budgetUsd) {
        if (budgetUsd <= 0) {
            return false;
        }
        return snapshot.totalCostUsd() + costUsd > budgetUsd;
    }

    /** Clears every counter back to zero. */
    public void reset() {
        writeLock.lock();
        try {
            costByProvider.clear();
            requestsByProvider.clear();
            totalInputTokens = 0;
            totalOutputTokens = 0;
            totalRequests = 0;
            snapshot = CostSummary.EMPTY;
        } finally {
            writeLock.unlock();
        }
        LOG.info("Cloud cost tracker reset");
    }

    private CostSummary buildSnapshot() {
        double total = 0.0;
        for (double cost : costByProvider.values()) {
            total += cost;
        }
        return new CostSummary(total, totalInputTokens, totalOutputTokens, totalRequests,
                requestsByProvider, costByProvider);
    }
}
