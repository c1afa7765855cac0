package com.phillippitts.hybridinference.cost;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CloudCostTrackerTest {

    @Test
    void accumulatesPerProvider() {
        CloudCostTracker tracker = new CloudCostTracker();

        tracker.recordRequest("openai", 100, 200, 0.002);
        tracker.recordRequest("openai", 50, 50, 0.001);
        tracker.recordRequest("anthropic", 10, 20, 0.004);

        CostSummary summary = tracker.summary();
        assertThat(summary.totalRequests()).isEqualTo(3);
        assertThat(summary.totalInputTokens()).isEqualTo(160);
        assertThat(summary.totalOutputTokens()).isEqualTo(270);
        assertThat(summary.requestsByProvider()).containsEntry("openai", 2L).containsEntry("anthropic", 1L);
        assertThat(summary.costByProvider().get("openai")).isCloseTo(0.003, within(1e-12));
        assertThat(summary.totalCostUsd()).isCloseTo(0.007, within(1e-12));
        assertThat(summary.averageCostPerRequest()).isCloseTo(0.007 / 3, within(1e-12));
    }

    @Test
    void snapshotsAreImmutableAndIndependent() {
        CloudCostTracker tracker = new CloudCostTracker();
        tracker.recordRequest("openai", 1, 1, 0.001);
        CostSummary before = tracker.summary();

        tracker.recordRequest("openai", 1, 1, 0.001);

        assertThat(before.totalRequests()).isEqualTo(1);
        assertThatThrownBy(() -> before.costByProvider().put("x", 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void budgetCheckUsesStrictlyGreater() {
        CloudCostTracker tracker = new CloudCostTracker();
        tracker.recordRequest("openai", 0, 0, 0.005);

        assertThat(tracker.wouldExceedBudget(0.005, 0.01)).isFalse();
        assertThat(tracker.wouldExceedBudget(0.0051, 0.01)).isTrue();
        assertThat(tracker.wouldExceedBudget(1000, 0)).isFalse();
    }

    @Test
    void rejectsNegativeValues() {
        CloudCostTracker tracker = new CloudCostTracker();

        assertThatThrownBy(() -> tracker.recordRequest("openai", -1, 0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tracker.recordRequest("openai", 0, 0, -0.01))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tracker.recordRequest(" ", 0, 0, 0.01))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.summary()).isEqualTo(CostSummary.EMPTY);
    }

    @Test
    void resetZeroesEverything() {
        CloudCostTracker tracker = new CloudCostTracker();
        tracker.recordRequest("openai", 5, 5, 0.5);

        tracker.reset();

        assertThat(tracker.summary().totalCostUsd()).isZero();
        assertThat(tracker.summary().costByProvider()).isEmpty();
    }

    @Test
    void totalMatchesSumOfProvidersUnderConcurrentWrites() throws Exception {
        CloudCostTracker tracker = new CloudCostTracker();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                String provider = t % 2 == 0 ? "openai" : "anthropic";
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        tracker.recordRequest(provider, 1, 2, 0.0001);
                        CostSummary s = tracker.summary();
                        double sum = s.costByProvider().values().stream().mapToDouble(Double::doubleValue).sum();
                        assertThat(s.totalCostUsd()).isCloseTo(sum, within(1e-9));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        CostSummary summary = tracker.summary();
        assertThat(summary.totalRequests()).isEqualTo(4000);
        assertThat(summary.totalInputTokens()).isEqualTo(4000);
        assertThat(summary.totalCostUsd()).isCloseTo(0.4, within(1e-9));
    }
}
