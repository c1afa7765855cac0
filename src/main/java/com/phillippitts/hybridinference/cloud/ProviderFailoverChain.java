package com.phillippitts.hybridinference.cloud;

import com.phillippitts.hybridinference.domain.CloudGenerationOptions;
import com.phillippitts.hybridinference.domain.CloudGenerationResult;
import com.phillippitts.hybridinference.event.EventRouter;
import com.phillippitts.hybridinference.event.ProviderFailoverEvent;
import com.phillippitts.hybridinference.exception.NoProviderAvailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Priority-ordered chain of cloud providers, each behind its own circuit breaker.
 *
 * <p><b>Ordering:</b> entries are sorted by priority, highest first. Equal priorities keep
 * insertion order (the sort is stable).
 *
 * <p><b>Circuit rules:</b>
 * <ul>
 *   <li>Failure: {@code consecutiveFailures++}, {@code lastFailureTime = now}; the circuit opens once
 *       the count reaches {@code failureThreshold}</li>
 *   <li>Open circuit: skipped until {@code cooldown} has elapsed since the last failure, then given
 *       one trial (half-open)</li>
 *   <li>Success: failures reset to 0, circuit closed</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> the entry list is replaced wholesale on add/remove (copy-on-write under
 * the chain's monitor) so calls iterate a stable snapshot. Circuit counters are guarded per entry.
 * {@link #healthStatus()} only reads.
 */
public class ProviderFailoverChain {
    private static final Logger LOG = LogManager.getLogger(ProviderFailoverChain.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);

    private static final Comparator<ProviderEntry> BY_PRIORITY_DESC =
            Comparator.comparingInt(ProviderEntry::priority).reversed();

    private final int failureThreshold;
    private final Duration cooldown;
    private final EventRouter eventRouter;
    private final Clock clock;

    private volatile List<ProviderEntry> entries = List.of();

    public ProviderFailoverChain(EventRouter eventRouter) {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN, eventRouter, Clock.systemUTC());
    }

    /**
     * @param failureThreshold consecutive failures that open a circuit (must be positive)
     * @param cooldown time an open circuit is skipped before a half-open trial
     * @param eventRouter receives {@link ProviderFailoverEvent}s (may be null to disable events)
     * @param clock time source for failure stamps and cooldown checks
     */
    public ProviderFailoverChain(int failureThreshold, Duration cooldown, EventRouter eventRouter, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.eventRouter = eventRouter;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Adds a provider and re-sorts the chain. A provider already present under the same id is replaced
     * (its circuit state starts fresh).
     */
    public synchronized void addProvider(CloudProvider provider, int priority) {
        Objects.requireNonNull(provider, "provider");
        List<ProviderEntry> next = new ArrayList<>(entries.size() + 1);
        for (ProviderEntry e : entries) {
            if (!e.providerId().equals(provider.providerId())) {
                next.add(e);
            }
        }
        next.add(new ProviderEntry(provider, priority));
        next.sort(BY_PRIORITY_DESC);
        entries = List.copyOf(next);
        LOG.info("Failover chain: added {} (priority={}), order={}", provider.providerId(), priority, providerOrder());
    }

    /** @return true if a provider with this id was in the chain */
    public synchronized boolean removeProvider(String providerId) {
        List<ProviderEntry> next = new ArrayList<>(entries);
        boolean removed = next.removeIf(e -> e.providerId().equals(providerId));
        if (removed) {
            entries = List.copyOf(next);
            LOG.info("Failover chain: removed {}, order={}", providerId, providerOrder());
        }
        return removed;
    }

    /**
     * Tries providers in priority order until one succeeds.
     *
     * @throws NoProviderAvailableException when every provider was skipped or failed; the cause is
     *         the last provider error, if any provider was actually called
     */
    public CloudGenerationResult generate(String prompt, CloudGenerationOptions options) {
        List<ProviderEntry> snapshot = entries;
        RuntimeException lastError = null;

        for (int i = 0; i < snapshot.size(); i++) {
            ProviderEntry entry = snapshot.get(i);
            if (!entry.tryEnter(clock.instant(), cooldown)) {
                LOG.debug("Skipping {}: circuit open", entry.providerId());
                continue;
            }
            try {
                CloudGenerationResult result = entry.provider().generate(prompt, options);
                entry.recordSuccess();
                if (lastError != null) {
                    LOG.info("Failover chain served by {} after earlier failures", entry.providerId());
                }
                return result;
            } catch (RuntimeException e) {
                lastError = e;
                ProviderHealth state = entry.recordFailure(clock.instant(), failureThreshold);
                String next = nextAttemptable(snapshot, i + 1);
                LOG.warn("Provider {} failed (consecutiveFailures={}, circuitOpen={}): {}; next={}",
                        entry.providerId(), state.consecutiveFailures(), state.circuitOpen(), e.toString(),
                        next == null ? "none" : next);
                publish(ProviderFailoverEvent.of(entry.providerId(), next, e,
                        state.consecutiveFailures(), state.circuitOpen()));
            }
        }
        throw new NoProviderAvailableException(
                lastError == null ? "No cloud provider available (all circuits open or chain empty)"
                        : "All cloud providers failed", lastError);
    }

    /**
     * Selects the first provider that passes the circuit rules and its {@link CloudProvider#isAvailable()}
     * probe, and returns that provider's stream untouched. A stream cannot be retried once tokens have
     * been emitted, so there is no mid-stream failover.
     *
     * @throws NoProviderAvailableException when no provider can be selected
     */
    public Flux<String> generateStream(String prompt, CloudGenerationOptions options) {
        return openStream(prompt, options).stream();
    }

    /**
     * Same selection as {@link #generateStream}, also reporting which provider was chosen.
     *
     * @throws NoProviderAvailableException when no provider can be selected
     */
    public ProviderStream openStream(String prompt, CloudGenerationOptions options) {
        CloudProvider selected = selectForStreaming();
        LOG.debug("Streaming via {}", selected.providerId());
        return new ProviderStream(selected.providerId(), selected.generateStream(prompt, options));
    }

    /**
     * Pre-call estimate from the provider the chain would try first.
     *
     * @return USD estimate, or 0 when no provider is currently attemptable
     */
    public double estimateCostUsd(String prompt, CloudGenerationOptions options) {
        Instant now = clock.instant();
        for (ProviderEntry entry : entries) {
            if (entry.isAttemptable(now, cooldown)) {
                return entry.provider().estimateCostUsd(prompt, options);
            }
        }
        return 0.0;
    }

    /** Snapshot of every entry in priority order. Never changes circuit state. */
    public List<ProviderHealth> healthStatus() {
        Instant now = clock.instant();
        List<ProviderHealth> out = new ArrayList<>();
        for (ProviderEntry entry : entries) {
            out.add(entry.snapshot(now, cooldown));
        }
        return List.copyOf(out);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    private CloudProvider selectForStreaming() {
        for (ProviderEntry entry : entries) {
            if (!entry.isAttemptable(clock.instant(), cooldown)) {
                LOG.debug("Skipping {} for streaming: circuit open", entry.providerId());
                continue;
            }
            if (!probe(entry)) {
                LOG.debug("Skipping {} for streaming: health probe negative", entry.providerId());
                continue;
            }
            // Circuit state only moves for the entry that actually serves the stream
            if (entry.tryEnter(clock.instant(), cooldown)) {
                return entry.provider();
            }
        }
        throw new NoProviderAvailableException("No cloud provider available for streaming");
    }

    private boolean probe(ProviderEntry entry) {
        try {
            return entry.provider().isAvailable();
        } catch (RuntimeException e) {
            LOG.warn("Health probe for {} threw: {}", entry.providerId(), e.toString());
            return false;
        }
    }

    private String nextAttemptable(List<ProviderEntry> snapshot, int from) {
        Instant now = clock.instant();
        for (int j = from; j < snapshot.size(); j++) {
            if (snapshot.get(j).isAttemptable(now, cooldown)) {
                return snapshot.get(j).providerId();
            }
        }
        return null;
    }

    private void publish(ProviderFailoverEvent event) {
        if (eventRouter != null) {
            eventRouter.publish(event);
        }
    }

    private List<String> providerOrder() {
        return entries.stream().map(ProviderEntry::providerId).toList();
    }
}
