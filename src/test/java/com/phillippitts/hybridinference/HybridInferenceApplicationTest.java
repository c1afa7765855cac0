package com.phillippitts.hybridinference;

import com.phillippitts.hybridinference.cloud.CloudProvider;
import com.phillippitts.hybridinference.domain.ExecutionTarget;
import com.phillippitts.hybridinference.domain.RoutedGenerationResult;
import com.phillippitts.hybridinference.domain.RoutingPolicy;
import com.phillippitts.hybridinference.health.FailoverChainHealthIndicator;
import com.phillippitts.hybridinference.routing.RoutingEngine;
import com.phillippitts.hybridinference.testutil.FakeCloudProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "routing.mode=HYBRID_AUTO",
        "routing.max-local-latency-ms=200",
        "routing.failover.priorities.primary=10"
    }
)
class HybridInferenceApplicationTest {

    @TestConfiguration
    static class Providers {
        @Bean
        CloudProvider primaryProvider() {
            return new FakeCloudProvider("primary", 0.001, 0.001);
        }
    }

    @Autowired
    RoutingEngine routingEngine;

    @Autowired
    FailoverChainHealthIndicator healthIndicator;

    @Test
    void contextLoads() {
        assertThat(routingEngine.getDefaultPolicy())
                .isEqualTo(RoutingPolicy.hybridAuto(0.7f).withMaxLocalLatencyMs(200));
        assertThat(routingEngine.getFailoverChain().size()).isEqualTo(1);
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void missingOnDeviceModelFallsBackToConfiguredProvider() {
        routingEngine.resetCloudCosts();

        RoutedGenerationResult result = routingEngine.generate("hello");

        assertThat(result.routingDecision().executionTarget()).isEqualTo(ExecutionTarget.HYBRID_FALLBACK);
        assertThat(result.routingDecision().cloudProviderId()).isEqualTo("primary");
        assertThat(routingEngine.cloudCostSummary().totalRequests()).isEqualTo(1);
    }
}
