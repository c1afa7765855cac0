package com.phillippitts.hybridinference.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingPolicyTest {

    @Test
    void defaultsAreHybridManualWithoutBudgets() {
        RoutingPolicy policy = RoutingPolicy.defaults();

        assertThat(policy.mode()).isEqualTo(RoutingMode.HYBRID_MANUAL);
        assertThat(policy.confidenceThreshold()).isEqualTo(0.7f);
        assertThat(policy.hasLatencyBudget()).isFalse();
        assertThat(policy.hasCostCap()).isFalse();
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new RoutingPolicy(RoutingMode.HYBRID_AUTO, 1.5f, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidenceThreshold");
        assertThatThrownBy(() -> new RoutingPolicy(RoutingMode.HYBRID_AUTO, 0.5f, -1, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxLocalLatencyMs");
        assertThatThrownBy(() -> new RoutingPolicy(RoutingMode.HYBRID_AUTO, 0.5f, 0, -0.01))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("costCapUsd");
        assertThatThrownBy(() -> new RoutingPolicy(null, 0.5f, 0, 0))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void copyMethodsLeaveOriginalUntouched() {
        RoutingPolicy base = RoutingPolicy.hybridAuto(0.8f);
        RoutingPolicy bounded = base.withMaxLocalLatencyMs(50).withCostCapUsd(0.01);

        assertThat(base.maxLocalLatencyMs()).isZero();
        assertThat(bounded.maxLocalLatencyMs()).isEqualTo(50);
        assertThat(bounded.costCapUsd()).isEqualTo(0.01);
        assertThat(bounded.confidenceThreshold()).isEqualTo(0.8f);
        assertThat(bounded.withMode(RoutingMode.ALWAYS_CLOUD).mode()).isEqualTo(RoutingMode.ALWAYS_CLOUD);
    }

    @Test
    void decisionFactoriesSetCloudFieldsOnlyWhenCloudWasUsed() {
        RoutingPolicy policy = RoutingPolicy.defaults();

        RoutingDecision local = RoutingDecision.onDevice(policy, null, false, null);
        assertThat(local.onDeviceConfidence()).isEqualTo(1.0f);
        assertThat(local.cloudProviderId()).isNull();
        assertThat(local.handoffReason()).isEqualTo(HandoffReason.NONE);
        assertThat(local.usedCloud()).isFalse();

        RoutingDecision fallback = RoutingDecision.hybridFallback(policy, 0.3f,
                HandoffReason.ROLLING_WINDOW_DEGRADATION, "openai", "gpt-4o-mini");
        assertThat(fallback.cloudHandoffTriggered()).isTrue();
        assertThat(fallback.executionTarget()).isEqualTo(ExecutionTarget.HYBRID_FALLBACK);
        assertThat(fallback.cloudModel()).isEqualTo("gpt-4o-mini");
        assertThat(fallback.usedCloud()).isTrue();
    }

    @Test
    void cloudOptionsFallBackToDefaultModel() {
        GenerationOptions options = GenerationOptions.defaults().withSystemPrompt("be brief");

        CloudGenerationOptions cloud = CloudGenerationOptions.from(options, null, null);
        assertThat(cloud.model()).isEqualTo(CloudGenerationOptions.DEFAULT_MODEL);
        assertThat(cloud.maxTokens()).isEqualTo(1024);
        assertThat(cloud.systemPrompt()).isEqualTo("be brief");

        assertThat(CloudGenerationOptions.from(options, "claude-3-haiku", "gpt-4o").model())
                .isEqualTo("claude-3-haiku");
        assertThat(CloudGenerationOptions.from(null, " ", "gpt-4o").model()).isEqualTo("gpt-4o");
    }
}
