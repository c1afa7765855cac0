package com.phillippitts.hybridinference.health;

import com.phillippitts.hybridinference.cloud.ProviderFailoverChain;
import com.phillippitts.hybridinference.cloud.ProviderHealth;
import com.phillippitts.hybridinference.routing.RoutingEngine;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FailoverChainHealthIndicatorTest {

    @Test
    void upWhenNoChainConfigured() {
        RoutingEngine engine = mock(RoutingEngine.class);
        when(engine.getFailoverChain()).thenReturn(null);

        Health health = new FailoverChainHealthIndicator(engine).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void upWhenAllProvidersAttemptable() {
        Health health = healthFor(List.of(closed("openai"), closed("anthropic")));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("openai", "ready");
    }

    @Test
    void degradedWhenSomeCircuitsOpen() {
        Health health = healthFor(List.of(open("openai"), closed("anthropic")));

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("openai", "circuit open");
    }

    @Test
    void downWhenEveryCircuitOpen() {
        Health health = healthFor(List.of(open("openai"), open("anthropic")));

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }

    private static Health healthFor(List<ProviderHealth> states) {
        ProviderFailoverChain chain = mock(ProviderFailoverChain.class);
        when(chain.isEmpty()).thenReturn(states.isEmpty());
        when(chain.healthStatus()).thenReturn(states);
        RoutingEngine engine = mock(RoutingEngine.class);
        when(engine.getFailoverChain()).thenReturn(chain);
        return new FailoverChainHealthIndicator(engine).health();
    }

    private static ProviderHealth closed(String id) {
        return new ProviderHealth(id, id, 1, 0, null, false, true);
    }

    private static ProviderHealth open(String id) {
        return new ProviderHealth(id, id, 1, 3, Instant.now(), true, false);
    }
}
