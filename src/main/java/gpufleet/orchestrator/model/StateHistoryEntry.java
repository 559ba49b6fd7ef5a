package gpufleet.orchestrator.model;

import java.time.Instant;

/**
 * Append-only record of one applied status transition.
 * {@code fromStatus} is null for the initial row insert.
 */
public record StateHistoryEntry(
        String id,
        String instanceId,
        InstanceStatus fromStatus,
        InstanceStatus toStatus,
        String reason,
        String metadata,
        Instant createdAt) {
}
