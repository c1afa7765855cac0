package com.phillippitts.hybridinference.exception;

import java.util.Locale;

/**
 * Thrown before any cloud call when the cumulative spend (plus the estimated cost of the
 * pending request) would exceed the policy's cost cap. Never retried internally.
 */
public class BudgetExceededException extends HybridInferenceException {

    private final double currentUsd;
    private final double capUsd;

    public BudgetExceededException(double currentUsd, double capUsd) {
        super(String.format(Locale.ROOT, "Cloud budget exceeded: current=$%.4f, cap=$%.4f", currentUsd, capUsd));
        this.currentUsd = currentUsd;
        this.capUsd = capUsd;
    }

    public double getCurrentUsd() {
        return currentUsd;
    }

    public double getCapUsd() {
        return capUsd;
    }
}
