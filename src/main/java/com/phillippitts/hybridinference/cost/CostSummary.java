package com.phillippitts.hybridinference.cost;

import java.util.Map;

/**
 * Immutable snapshot of cumulative cloud spend.
 *
 * <p>Invariant: {@code totalCostUsd} equals the sum of {@code costByProvider} values.
 */
public record CostSummary(double totalCostUsd,
                          long totalInputTokens,
                          long totalOutputTokens,
                          long totalRequests,
                          Map<String, Long> requestsByProvider,
                          Map<String, Double> costByProvider) {

    public static final CostSummary EMPTY = new CostSummary(0.0, 0, 0, 0, Map.of(), Map.of());

    public CostSummary {
        requestsByProvider = Map.copyOf(requestsByProvider);
        costByProvider = Map.copyOf(costByProvider);
    }

    public double averageCostPerRequest() {
        return totalRequests == 0 ? 0.0 : totalCostUsd / totalRequests;
    }
}
