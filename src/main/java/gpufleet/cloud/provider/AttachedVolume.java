package gpufleet.cloud.provider;

/**
 * Volume currently attached to a provider instance.
 */
public record AttachedVolume(
        String providerVolumeId,
        String volumeType,
        long sizeBytes,
        boolean boot,
        boolean deleteOnTerminate) {
}
