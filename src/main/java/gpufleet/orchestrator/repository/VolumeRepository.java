package gpufleet.orchestrator.repository;

import gpufleet.cloud.provider.AttachedVolume;
import gpufleet.orchestrator.model.InstanceVolume;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Repository interface for provider volumes attached to instances.
 */
public interface VolumeRepository {

    /**
     * Track a volume seen at the provider. Existing non-deleted rows only get reconciled_at refreshed.
     *
     * @return true if a new row was inserted
     */
    boolean upsertDiscovered(String instanceId, AttachedVolume volume, Instant at);

    List<InstanceVolume> findByInstance(String instanceId);

    /**
     * Non-deleted volumes flagged delete_on_terminate.
     */
    List<InstanceVolume> findPendingDeletion(String instanceId);

    /**
     * Claim delete_on_terminate volumes that outlived their terminated (or archived) instance, e.g.
     * after the provider removed the instance on its own. Stamps a per-volume lease like the
     * instance claims.
     */
    List<InstanceVolume> claimLeftovers(Instant now, Duration lease, int limit);

    /**
     * @return false if the volume was already deleted
     */
    boolean markDeleted(String volumeId, Instant at);

    void recordError(String volumeId, String errorMessage);
}
