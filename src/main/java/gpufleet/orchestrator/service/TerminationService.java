package gpufleet.orchestrator.service;

import gpufleet.cloud.provider.AttachedVolume;
import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.CloudProviders;
import gpufleet.cloud.provider.DeleteOutcome;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.ActionStatus;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.InstanceVolume;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.repository.ActionLogRepository;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.repository.VolumeRepository;
import gpufleet.orchestrator.repository.WorkerTokenRepository;
import gpufleet.orchestrator.statemachine.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Tears down one terminating instance: volume discovery, provider delete, confirmation,
 * deletion of volumes flagged delete_on_terminate, then {@code terminated}.
 *
 * Every step tolerates resources that are already gone, so a step that failed half-way is simply
 * run again on the next attempt.
 */
public class TerminationService {

    private static final Logger log = LoggerFactory.getLogger(TerminationService.class);

    public static final String MANUAL_INTERVENTION = "TERMINATION_MANUAL_INTERVENTION";

    public enum Outcome {
        TERMINATED,
        /** Attempt failed, will be retried */
        RETRY_PENDING,
        /** Attempts exhausted, row flagged for an operator */
        MANUAL_INTERVENTION,
        SKIPPED
    }

    private final InstanceRepository instances;
    private final VolumeRepository volumes;
    private final WorkerTokenRepository tokens;
    private final ActionLogRepository actions;
    private final StateMachine stateMachine;
    private final CloudProviders providers;
    private final OrchestratorConfig config;
    private final Clock clock;

    public TerminationService(InstanceRepository instances, VolumeRepository volumes, WorkerTokenRepository tokens,
            ActionLogRepository actions, StateMachine stateMachine, CloudProviders providers,
            OrchestratorConfig config) {
        this.instances = instances;
        this.volumes = volumes;
        this.tokens = tokens;
        this.actions = actions;
        this.stateMachine = stateMachine;
        this.providers = providers;
        this.config = config;
        this.clock = config.clock();
    }

    /**
     * Run one teardown attempt for an instance in {@code terminating}.
     */
    public Outcome terminate(Instance instance) {
        if (instance.status() != InstanceStatus.TERMINATING) {
            return Outcome.SKIPPED;
        }

        if (!instance.hasProviderInstance()) {
            return finish(instance, "no_provider_resource");
        }

        try {
            CloudProvider provider = providers.require(instance.provider());
            String zone = instance.zone();
            String providerInstanceId = instance.providerInstanceId();

            discoverVolumes(provider, instance);

            long startedAt = System.currentTimeMillis();
            DeleteOutcome deleted = provider.deleteInstance(zone, providerInstanceId);
            actions.record(instance.id(), ActionType.PROVIDER_DELETE, ActionStatus.SUCCESS,
                    deleted == DeleteOutcome.DELETED ? "Deleted " + providerInstanceId : "Already gone",
                    null, System.currentTimeMillis() - startedAt, clock.instant());

            if (provider.instanceExists(zone, providerInstanceId)) {
                return attemptFailed(instance, "DELETE_NOT_CONFIRMED",
                        "Provider still reports " + providerInstanceId + " after delete");
            }

            int failedVolumes = deleteFlaggedVolumes(provider, instance);
            if (failedVolumes > 0) {
                return attemptFailed(instance, "VOLUME_DELETE_FAILED",
                        failedVolumes + " volume(s) could not be deleted");
            }

            return finish(instance, null);

        } catch (ProviderException e) {
            actions.failure(instance.id(), ActionType.PROVIDER_DELETE, "[" + e.code() + "] " + e.getMessage(),
                    clock.instant());
            return attemptFailed(instance, e.code(), e.getMessage());
        }
    }

    /**
     * Record every volume attached at the provider, tracked or not.
     */
    private void discoverVolumes(CloudProvider provider, Instance instance) throws ProviderException {
        List<AttachedVolume> attached;
        try {
            attached = provider.listAttachedVolumes(instance.zone(), instance.providerInstanceId());
        } catch (ProviderException e) {
            if (e.kind() == ProviderException.Kind.NOT_FOUND) {
                log.debug("Instance {} already gone, skipping volume discovery", instance.id());
                return;
            }
            throw e;
        }

        for (AttachedVolume volume : attached) {
            if (volumes.upsertDiscovered(instance.id(), volume, clock.instant())) {
                actions.success(instance.id(), ActionType.VOLUME_DISCOVERED, volume.providerVolumeId(),
                        clock.instant());
            }
        }
    }

    /**
     * @return number of volumes that failed to delete
     */
    private int deleteFlaggedVolumes(CloudProvider provider, Instance instance) {
        int failed = 0;
        for (InstanceVolume volume : volumes.findPendingDeletion(instance.id())) {
            if (!deleteVolume(provider, instance, volume)) {
                failed++;
            }
        }
        return failed;
    }

    /**
     * Delete one tracked volume at the provider and mark its row deleted. A volume already gone at
     * the provider counts as deleted.
     *
     * @return false if the provider call failed; the error is recorded on the volume row
     */
    public boolean deleteVolume(CloudProvider provider, Instance instance, InstanceVolume volume) {
        try {
            DeleteOutcome outcome = provider.deleteVolume(instance.zone(), volume.providerVolumeId());
            if (volumes.markDeleted(volume.id(), clock.instant())) {
                actions.success(instance.id(), ActionType.VOLUME_DELETE,
                        volume.providerVolumeId() + (outcome == DeleteOutcome.ALREADY_GONE ? " (already gone)" : ""),
                        clock.instant());
            }
            return true;
        } catch (ProviderException e) {
            volumes.recordError(volume.id(), "[" + e.code() + "] " + e.getMessage());
            actions.failure(instance.id(), ActionType.VOLUME_DELETE,
                    volume.providerVolumeId() + ": " + e.getMessage(), clock.instant());
            log.warn("Failed to delete volume {} of instance {}: {}", volume.providerVolumeId(), instance.id(),
                    e.getMessage());
            return false;
        }
    }

    private Outcome finish(Instance instance, String deletionReason) {
        TransitionResult result = stateMachine.transition(
                Transition.of(instance.id(), InstanceStatus.TERMINATING, InstanceStatus.TERMINATED)
                        .reason(deletionReason != null ? deletionReason : "provider_delete_confirmed")
                        .deletionReason(deletionReason)
                        .metadata(StateMachine.metadata(Map.of("attempts", instance.terminationAttempts() + 1)))
                        .clearError(true)
                        .build());
        if (result != TransitionResult.APPLIED) {
            return Outcome.SKIPPED;
        }
        tokens.revoke(instance.id(), clock.instant());
        return Outcome.TERMINATED;
    }

    private Outcome attemptFailed(Instance instance, String code, String message) {
        int attempts = instances.recordTerminationFailure(instance.id(), code, message);
        if (attempts >= config.terminatorMaxAttempts()) {
            instances.recordError(instance.id(), MANUAL_INTERVENTION,
                    "Teardown failed " + attempts + " times, last error: [" + code + "] " + message, false);
            log.error("Instance {} needs manual teardown after {} attempts: {}", instance.id(), attempts, message);
            return Outcome.MANUAL_INTERVENTION;
        }
        log.warn("Teardown attempt {}/{} for {} failed: [{}] {}", attempts, config.terminatorMaxAttempts(),
                instance.id(), code, message);
        return Outcome.RETRY_PENDING;
    }
}
