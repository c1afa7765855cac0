package com.phillippitts.hybridinference.config;

import com.phillippitts.hybridinference.cloud.CloudProvider;
import com.phillippitts.hybridinference.cloud.CloudProviderRegistry;
import com.phillippitts.hybridinference.cloud.ProviderFailoverChain;
import com.phillippitts.hybridinference.config.properties.FailoverProperties;
import com.phillippitts.hybridinference.event.EventRouter;
import com.phillippitts.hybridinference.local.LocalInferenceService;
import com.phillippitts.hybridinference.local.UnavailableLocalInferenceService;
import com.phillippitts.hybridinference.telemetry.LoggingTelemetrySink;
import com.phillippitts.hybridinference.telemetry.TelemetrySink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the routing collaborators that have no single obvious implementation.
 *
 * <p>Applications override any of these by declaring their own bean of the same type: an on-device
 * capability, a telemetry sink, or a hand-built failover chain.
 */
@Configuration
public class RoutingConfig {
    private static final Logger LOG = LogManager.getLogger(RoutingConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock routingClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TelemetrySink telemetrySink() {
        return new LoggingTelemetrySink();
    }

    @Bean
    @ConditionalOnMissingBean
    public LocalInferenceService localInferenceService() {
        LOG.warn("No on-device inference capability configured; local calls will fail "
                + "(HYBRID_AUTO requests fall back to the cloud)");
        return new UnavailableLocalInferenceService();
    }

    /**
     * Builds the failover chain from every registered provider, using {@code routing.failover.priorities}.
     * An empty chain is ignored by the routing engine, which then uses the registry directly.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "routing.failover", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public ProviderFailoverChain providerFailoverChain(CloudProviderRegistry registry,
                                                       FailoverProperties properties,
                                                       EventRouter eventRouter,
                                                       Clock clock) {
        ProviderFailoverChain chain = new ProviderFailoverChain(properties.getFailureThreshold(),
                Duration.ofSeconds(properties.getCooldownSeconds()), eventRouter, clock);
        for (CloudProvider provider : registry.providers()) {
            chain.addProvider(provider, properties.priorityOf(provider.providerId()));
        }
        LOG.info("Failover chain built: providers={}, failureThreshold={}, cooldown={}s",
                chain.size(), chain.getFailureThreshold(), properties.getCooldownSeconds());
        return chain;
    }
}
