package com.phillippitts.hybridinference.routing;

import com.phillippitts.hybridinference.cloud.ProviderFailoverChain;
import com.phillippitts.hybridinference.cloud.ProviderHealth;
import com.phillippitts.hybridinference.cost.CostSummary;
import com.phillippitts.hybridinference.event.CloudCostEvent;
import com.phillippitts.hybridinference.event.LatencyTimeoutEvent;
import com.phillippitts.hybridinference.event.ProviderFailoverEvent;
import com.phillippitts.hybridinference.metrics.RoutingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Operational handler for routing events bridged into the Spring context. Throttled to avoid log spam.
 */
@Component
class RoutingEventsListener {
    private static final Logger LOG = LogManager.getLogger(RoutingEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final RoutingMetrics metrics;
    private final RoutingEngine routingEngine;

    RoutingEventsListener(RoutingMetrics metrics, RoutingEngine routingEngine) {
        this.metrics = metrics;
        this.routingEngine = routingEngine;
    }

    @EventListener
    void onProviderFailover(ProviderFailoverEvent e) {
        metrics.incrementProviderFailure(e.failedProviderId(), e.circuitOpen());
        String key = "failover-" + e.failedProviderId() + '-' + e.circuitOpen();
        if (shouldLog(key)) {
            LOG.warn("Cloud provider {} failed ({}), consecutiveFailures={}, circuitOpen={}, next={}",
                    e.failedProviderId(), e.errorType(), e.consecutiveFailures(), e.circuitOpen(),
                    e.nextProviderId() == null ? "none" : e.nextProviderId());
        }
    }

    @EventListener
    void onLatencyTimeout(LatencyTimeoutEvent e) {
        if (shouldLog("latency-timeout")) {
            LOG.warn("On-device generation exceeded {}ms budget. Consider raising routing.max-local-latency-ms "
                    + "or using a smaller model.", e.maxLatencyMs());
        }
    }

    @EventListener
    void onCloudCost(CloudCostEvent e) {
        LOG.debug("Cloud spend: provider={}, cost=${}, cumulative=${}",
                e.providerId(), e.costUsd(), e.cumulativeTotalUsd());
    }

    /**
     * Logs cloud spend and circuit states once a minute.
     */
    @Scheduled(fixedRate = 60_000)
    public void logRoutingSummary() {
        CostSummary costs = routingEngine.cloudCostSummary();
        ProviderFailoverChain chain = routingEngine.getFailoverChain();
        String circuits = chain == null ? "none" : chain.healthStatus().stream()
                .map(RoutingEventsListener::describe)
                .collect(Collectors.joining(", ", "[", "]"));
        LOG.info("Routing summary: cloudRequests={}, cloudCost=${}, tokensIn={}, tokensOut={}, circuits={}",
                costs.totalRequests(), String.format(Locale.ROOT, "%.4f", costs.totalCostUsd()),
                costs.totalInputTokens(), costs.totalOutputTokens(), circuits);
    }

    private static String describe(ProviderHealth h) {
        return h.providerId() + '=' + (h.circuitOpen() ? "open" : "closed") + '/' + h.consecutiveFailures();
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
