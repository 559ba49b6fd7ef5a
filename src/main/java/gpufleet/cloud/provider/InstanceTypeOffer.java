package gpufleet.cloud.provider;

/**
 * Instance type advertised by a provider catalog.
 */
public record InstanceTypeOffer(
        String code,
        String name,
        int cpuCount,
        int ramGb,
        int gpuCount,
        int vramPerGpuGb,
        double costPerHour) {
}
