package gpufleet.orchestrator.repository;

import gpufleet.orchestrator.model.InstanceTypeEntry;

import java.util.List;

/**
 * Repository interface for provider instance type catalogs.
 */
public interface CatalogRepository {

    /**
     * Insert or update entries keyed by (provider, zone, code).
     *
     * @return number of entries written
     */
    int upsert(List<InstanceTypeEntry> entries);

    List<InstanceTypeEntry> findByProvider(String provider);
}
