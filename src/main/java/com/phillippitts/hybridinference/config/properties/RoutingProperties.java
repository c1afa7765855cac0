package com.phillippitts.hybridinference.config.properties;

import com.phillippitts.hybridinference.domain.CloudGenerationOptions;
import com.phillippitts.hybridinference.domain.RoutingMode;
import com.phillippitts.hybridinference.domain.RoutingPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the process-wide default routing policy.
 * Per-call policies passed to the routing engine override these.
 */
@Validated
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {

    @NotNull
    private final RoutingMode mode;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final float confidenceThreshold;

    /** Latency budget for on-device generation in HYBRID_AUTO; 0 disables the race. */
    @Min(0)
    private final long maxLocalLatencyMs;

    /** Cumulative cloud spend cap in USD; 0 means unlimited. */
    @DecimalMin("0.0")
    private final double costCapUsd;

    @NotBlank
    private final String defaultCloudModel;

    @ConstructorBinding
    public RoutingProperties(RoutingMode mode, Float confidenceThreshold, Long maxLocalLatencyMs,
                             Double costCapUsd, String defaultCloudModel) {
        this.mode = mode == null ? RoutingMode.HYBRID_MANUAL : mode;
        this.confidenceThreshold = confidenceThreshold == null
                ? RoutingPolicy.DEFAULT_CONFIDENCE_THRESHOLD : confidenceThreshold;
        this.maxLocalLatencyMs = maxLocalLatencyMs == null ? 0L : maxLocalLatencyMs;
        this.costCapUsd = costCapUsd == null ? 0.0 : costCapUsd;
        this.defaultCloudModel = defaultCloudModel == null || defaultCloudModel.isBlank()
                ? CloudGenerationOptions.DEFAULT_MODEL : defaultCloudModel;
    }

    /**
     * Constructor for tests: given mode, everything else at defaults.
     */
    public RoutingProperties(RoutingMode mode) {
        this(mode, null, null, null, null);
    }

    public RoutingMode getMode() {
        return mode;
    }

    public float getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public long getMaxLocalLatencyMs() {
        return maxLocalLatencyMs;
    }

    public double getCostCapUsd() {
        return costCapUsd;
    }

    public String getDefaultCloudModel() {
        return defaultCloudModel;
    }

    public RoutingPolicy toPolicy() {
        return new RoutingPolicy(mode, confidenceThreshold, maxLocalLatencyMs, costCapUsd);
    }
}
