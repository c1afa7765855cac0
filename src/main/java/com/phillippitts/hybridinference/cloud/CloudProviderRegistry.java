package com.phillippitts.hybridinference.cloud;

import com.phillippitts.hybridinference.exception.NoProviderAvailableException;
import com.phillippitts.hybridinference.exception.ProviderNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of cloud providers addressable by id, with a default provider for requests that
 * neither name a provider nor have a failover chain configured.
 *
 * <p>The first provider registered becomes the default until {@link #setDefault(String)} is called.
 * Listings follow registration order, so providers with equal failover priority enter the chain in
 * the order they were registered. All access is synchronized on the registry.
 */
@Component
public class CloudProviderRegistry {
    private static final Logger LOG = LogManager.getLogger(CloudProviderRegistry.class);

    private final Map<String, CloudProvider> providers = new LinkedHashMap<>();
    private String defaultProviderId;

    public CloudProviderRegistry() {
    }

    @Autowired
    public CloudProviderRegistry(ObjectProvider<CloudProvider> discovered) {
        discovered.orderedStream().forEach(this::register);
    }

    public synchronized void register(CloudProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String id = Objects.requireNonNull(provider.providerId(), "providerId");
        CloudProvider previous = providers.put(id, provider);
        if (defaultProviderId == null) {
            defaultProviderId = id;
        }
        if (previous != null) {
            LOG.info("Replaced cloud provider {}", id);
        } else {
            LOG.info("Registered cloud provider {} ({})", id, provider.displayName());
        }
    }

    /** @return true if a provider with this id was registered */
    public synchronized boolean unregister(String providerId) {
        boolean removed = providers.remove(providerId) != null;
        if (removed && providerId.equals(defaultProviderId)) {
            defaultProviderId = providers.isEmpty() ? null : providers.keySet().iterator().next();
        }
        return removed;
    }

    /**
     * @throws ProviderNotFoundException if no provider with this id is registered
     */
    public synchronized CloudProvider get(String providerId) {
        CloudProvider provider = providerId == null ? null : providers.get(providerId);
        if (provider == null) {
            throw new ProviderNotFoundException(providerId);
        }
        return provider;
    }

    /**
     * @throws NoProviderAvailableException if nothing is registered
     */
    public synchronized CloudProvider getDefault() {
        CloudProvider provider = defaultProviderId == null ? null : providers.get(defaultProviderId);
        if (provider == null) {
            throw new NoProviderAvailableException("No cloud provider registered");
        }
        return provider;
    }

    /**
     * @throws ProviderNotFoundException if no provider with this id is registered
     */
    public synchronized void setDefault(String providerId) {
        get(providerId);
        defaultProviderId = providerId;
    }

    /** @return registered ids in registration order */
    public synchronized List<String> providerIds() {
        return List.copyOf(providers.keySet());
    }

    /** @return registered providers in registration order */
    public synchronized List<CloudProvider> providers() {
        return List.copyOf(providers.values());
    }

    public synchronized boolean isEmpty() {
        return providers.isEmpty();
    }
}
