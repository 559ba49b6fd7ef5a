package gpufleet.orchestrator.model;

import java.time.Instant;

/**
 * Entry of the per-instance action log (provider calls, probes, milestones).
 */
public record InstanceAction(
        String id,
        String instanceId,
        ActionType action,
        ActionStatus status,
        String message,
        String metadata,
        Long durationMs,
        Instant createdAt) {

    public boolean isSuccess() {
        return status == ActionStatus.SUCCESS;
    }
}
