package com.phillippitts.hybridinference.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the cloud provider failover chain.
 */
@ConfigurationProperties(prefix = "routing.failover")
@Validated
public class FailoverProperties {

    /** Build a failover chain from the registered providers. */
    private boolean enabled = true;

    /** Consecutive failures that open a provider's circuit. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 3;

    /** Seconds an open circuit is skipped before a half-open trial. */
    @PositiveOrZero(message = "Cooldown seconds must not be negative")
    private long cooldownSeconds = 60;

    /** Priority per provider id (higher is tried first); unlisted providers get 0. */
    private Map<String, Integer> priorities = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public Map<String, Integer> getPriorities() {
        return priorities;
    }

    public void setPriorities(Map<String, Integer> priorities) {
        this.priorities = priorities == null ? new HashMap<>() : priorities;
    }

    public int priorityOf(String providerId) {
        return priorities.getOrDefault(providerId, 0);
    }
}
