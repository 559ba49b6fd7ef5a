package gpufleet.cloud.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of configured providers, keyed by {@link CloudProvider#name()}.
 */
public final class CloudProviders {

    private static final Logger log = LoggerFactory.getLogger(CloudProviders.class);

    private final Map<String, CloudProvider> providers = new LinkedHashMap<>();

    public CloudProviders register(CloudProvider provider) {
        providers.put(provider.name(), provider);
        log.info("Registered cloud provider: {}", provider.name());
        return this;
    }

    public Optional<CloudProvider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    /**
     * Look up a provider or fail with a permanent error (unknown provider code on the row).
     */
    public CloudProvider require(String name) throws ProviderException {
        CloudProvider provider = providers.get(name);
        if (provider == null) {
            throw ProviderException.permanent("UNKNOWN_PROVIDER", "No provider registered for '" + name + "'");
        }
        return provider;
    }

    public Collection<CloudProvider> all() {
        return providers.values();
    }
}
