package gpufleet.orchestrator.model;

import java.time.Instant;

/**
 * Provider volume tracked for an instance.
 * Only volumes with {@code deleteOnTerminate} are removed by the terminator.
 */
public record InstanceVolume(
        String id,
        String instanceId,
        String providerVolumeId,
        String volumeType,
        long sizeBytes,
        boolean boot,
        boolean deleteOnTerminate,
        VolumeStatus status,
        Instant createdAt,
        Instant attachedAt,
        Instant deletedAt,
        Instant reconciledAt,
        String errorMessage) {

    public boolean isDeleted() {
        return status == VolumeStatus.DELETED;
    }
}
