package gpufleet.orchestrator.service;

import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.CloudProviders;
import gpufleet.cloud.provider.InstanceTypeOffer;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.InstanceTypeEntry;
import gpufleet.orchestrator.repository.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Copies provider instance type catalogs into the local store.
 */
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CatalogRepository catalog;
    private final CloudProviders providers;
    private final OrchestratorConfig config;

    public CatalogService(CatalogRepository catalog, CloudProviders providers, OrchestratorConfig config) {
        this.catalog = catalog;
        this.providers = providers;
        this.config = config;
    }

    /**
     * Sync one provider, or all registered providers when {@code providerName} is null.
     * A zone that fails to load is logged and skipped.
     *
     * @return number of catalog entries written
     */
    public int sync(String providerName) throws ProviderException {
        Collection<CloudProvider> targets = providerName == null
                ? providers.all()
                : List.of(providers.require(providerName));

        int written = 0;
        for (CloudProvider provider : targets) {
            List<InstanceTypeEntry> entries = new ArrayList<>();
            Instant now = config.clock().instant();
            for (String zone : config.catalogZones()) {
                try {
                    for (InstanceTypeOffer offer : provider.fetchCatalog(zone)) {
                        entries.add(new InstanceTypeEntry(provider.name(), zone, offer.code(), offer.name(),
                                offer.cpuCount(), offer.ramGb(), offer.gpuCount(), offer.vramPerGpuGb(),
                                offer.costPerHour(), now));
                    }
                } catch (ProviderException e) {
                    log.warn("Catalog fetch failed for {} in {}: [{}] {}", provider.name(), zone, e.code(),
                            e.getMessage());
                }
            }
            written += catalog.upsert(entries);
            log.info("Catalog sync for {}: {} entries", provider.name(), entries.size());
        }
        return written;
    }

    public List<InstanceTypeEntry> list(String providerName) {
        return catalog.findByProvider(providerName);
    }
}
