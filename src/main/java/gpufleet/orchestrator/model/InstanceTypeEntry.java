package gpufleet.orchestrator.model;

import java.time.Instant;

/**
 * Catalog row for an instance type offered by a provider in a zone.
 */
public record InstanceTypeEntry(
        String provider,
        String zone,
        String code,
        String name,
        int cpuCount,
        int ramGb,
        int gpuCount,
        int vramPerGpuGb,
        Double costPerHour,
        Instant updatedAt) {
}
