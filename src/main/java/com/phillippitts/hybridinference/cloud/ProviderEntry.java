package com.phillippitts.hybridinference.cloud;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable circuit-breaker state for one provider in a {@link ProviderFailoverChain}.
 * Every read and write of the counters happens under the entry's own lock.
 *
 * <p>There is no stored half-open state: "open and cooldown elapsed" is half-open. Clearing the
 * flag lets one attempt through; a failure re-opens the circuit at once because the failure
 * count is still at or above the threshold.
 */
final class ProviderEntry {

    private final CloudProvider provider;
    private final int priority;
    private final ReentrantLock lock = new ReentrantLock();

    private int consecutiveFailures;
    private Instant lastFailureTime;
    private boolean circuitOpen;

    ProviderEntry(CloudProvider provider, int priority) {
        this.provider = provider;
        this.priority = priority;
    }

    CloudProvider provider() {
        return provider;
    }

    String providerId() {
        return provider.providerId();
    }

    int priority() {
        return priority;
    }

    /**
     * Decides whether the chain may call this provider now. An open circuit whose cooldown has
     * elapsed is moved to half-open (flag cleared) and allowed through.
     */
    boolean tryEnter(Instant now, Duration cooldown) {
        lock.lock();
        try {
            if (!circuitOpen) {
                return true;
            }
            if (cooldownElapsed(now, cooldown)) {
                circuitOpen = false;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** Same rule as {@link #tryEnter} without changing state. */
    boolean isAttemptable(Instant now, Duration cooldown) {
        lock.lock();
        try {
            return !circuitOpen || cooldownElapsed(now, cooldown);
        } finally {
            lock.unlock();
        }
    }

    void recordSuccess() {
        lock.lock();
        try {
            consecutiveFailures = 0;
            circuitOpen = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return circuit state right after recording the failure
     */
    ProviderHealth recordFailure(Instant now, int threshold) {
        lock.lock();
        try {
            consecutiveFailures++;
            lastFailureTime = now;
            if (consecutiveFailures >= threshold) {
                circuitOpen = true;
            }
            return new ProviderHealth(providerId(), provider.displayName(), priority,
                    consecutiveFailures, lastFailureTime, circuitOpen, !circuitOpen);
        } finally {
            lock.unlock();
        }
    }

    ProviderHealth snapshot(Instant now, Duration cooldown) {
        lock.lock();
        try {
            return new ProviderHealth(providerId(), provider.displayName(), priority, consecutiveFailures,
                    lastFailureTime, circuitOpen, !circuitOpen || cooldownElapsed(now, cooldown));
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private boolean cooldownElapsed(Instant now, Duration cooldown) {
        return lastFailureTime == null || !now.isBefore(lastFailureTime.plus(cooldown));
    }
}
