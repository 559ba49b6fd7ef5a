package gpufleet.orchestrator.repository;

import gpufleet.orchestrator.model.ActionStatus;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.InstanceAction;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Repository interface for the per-instance action log.
 */
public interface ActionLogRepository {

    void record(String instanceId, ActionType action, ActionStatus status, String message, String metadata,
            Long durationMs, Instant at);

    default void success(String instanceId, ActionType action, String message, Instant at) {
        record(instanceId, action, ActionStatus.SUCCESS, message, null, null, at);
    }

    default void failure(String instanceId, ActionType action, String message, Instant at) {
        record(instanceId, action, ActionStatus.FAILED, message, null, null, at);
    }

    List<InstanceAction> findByInstance(String instanceId);

    /**
     * Action types with at least one successful entry.
     */
    Set<ActionType> completedActions(String instanceId);
}
