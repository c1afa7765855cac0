package com.phillippitts.hybridinference.health;

import com.phillippitts.hybridinference.cloud.ProviderFailoverChain;
import com.phillippitts.hybridinference.cloud.ProviderHealth;
import com.phillippitts.hybridinference.routing.RoutingEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the cloud provider failover chain.
 *
 * <p>Reports cloud availability for monitoring and alerting:
 * <ul>
 *   <li>UP: every provider attemptable, or no chain configured</li>
 *   <li>DEGRADED: at least one provider attemptable</li>
 *   <li>DOWN: every circuit open and cooling down</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class FailoverChainHealthIndicator implements HealthIndicator {

    private final RoutingEngine routingEngine;

    public FailoverChainHealthIndicator(RoutingEngine routingEngine) {
        this.routingEngine = routingEngine;
    }

    @Override
    public Health health() {
        ProviderFailoverChain chain = routingEngine.getFailoverChain();
        if (chain == null || chain.isEmpty()) {
            return Health.up().withDetail("status", "No failover chain configured").build();
        }

        List<ProviderHealth> states = chain.healthStatus();
        long attemptable = states.stream().filter(ProviderHealth::attemptable).count();

        Health.Builder builder = new Health.Builder();
        if (attemptable == states.size()) {
            builder.up().withDetail("status", "All providers available");
        } else if (attemptable > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial provider availability");
        } else {
            builder.down().withDetail("status", "All provider circuits open");
        }
        for (ProviderHealth state : states) {
            builder.withDetail(state.providerId(), describe(state));
        }
        return builder.build();
    }

    private String describe(ProviderHealth state) {
        if (!state.circuitOpen()) {
            return state.consecutiveFailures() == 0 ? "ready" : "failing (" + state.consecutiveFailures() + ")";
        }
        return state.attemptable() ? "half-open" : "circuit open";
    }
}
