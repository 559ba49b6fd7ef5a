package gpufleet.orchestrator.scheduler;

import gpufleet.cloud.provider.AttachedVolume;
import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.CloudProviders;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.repository.ActionLogRepository;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.repository.VolumeRepository;
import gpufleet.orchestrator.repository.WorkerTokenRepository;
import gpufleet.orchestrator.statemachine.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Orphan detection for running instances. An instance the provider no longer knows is marked
 * terminated with {@code deleted_by_provider}; a present one without tracked volumes gets its
 * volumes recorded.
 */
public class WatchDogJob extends ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(WatchDogJob.class);

    public static final String PROVIDER_DELETED = "provider_deleted";

    private final InstanceRepository instances;
    private final VolumeRepository volumes;
    private final WorkerTokenRepository tokens;
    private final ActionLogRepository actions;
    private final StateMachine stateMachine;
    private final CloudProviders providers;
    private final OrchestratorConfig config;

    public WatchDogJob(InstanceRepository instances, VolumeRepository volumes, WorkerTokenRepository tokens,
            ActionLogRepository actions, StateMachine stateMachine, CloudProviders providers,
            OrchestratorConfig config) {
        this.instances = instances;
        this.volumes = volumes;
        this.tokens = tokens;
        this.actions = actions;
        this.stateMachine = stateMachine;
        this.providers = providers;
        this.config = config;
    }

    @Override
    public String name() {
        return "watch-dog";
    }

    @Override
    public int runOnce() {
        Instant now = config.clock().instant();
        List<Instance> claimed = instances.claimForWatchDog(now, config.watchDogLease(), config.batchSize());

        int orphans = 0;
        for (Instance instance : claimed) {
            try {
                if (check(instance)) {
                    orphans++;
                }
            } catch (ProviderException e) {
                log.warn("Watch-dog could not check {}: [{}] {}", instance.id(), e.code(), e.getMessage());
            } catch (Exception e) {
                log.error("Watch-dog failed on instance {}", instance.id(), e);
            }
        }

        if (orphans > 0) {
            log.warn("Watch-dog: {} instance(s) deleted outside the orchestrator", orphans);
        }
        return orphans;
    }

    /**
     * @return true if the instance was found deleted at the provider
     */
    private boolean check(Instance instance) throws ProviderException {
        CloudProvider provider = providers.require(instance.provider());

        if (provider.instanceExists(instance.zone(), instance.providerInstanceId())) {
            if (volumes.findByInstance(instance.id()).isEmpty()) {
                recordVolumes(provider, instance);
            }
            return false;
        }

        TransitionResult result = stateMachine.transition(
                Transition.of(instance.id(), instance.status(), InstanceStatus.TERMINATED)
                        .reason(PROVIDER_DELETED)
                        .deletionReason(PROVIDER_DELETED)
                        .deletedByProvider(true)
                        .metadata(StateMachine.metadata(
                                Map.of("provider_instance_id", instance.providerInstanceId())))
                        .build());
        if (result == TransitionResult.APPLIED) {
            tokens.revoke(instance.id(), config.clock().instant());
            log.warn("Instance {} ({}) no longer exists at {}", instance.id(), instance.providerInstanceId(),
                    provider.name());
            return true;
        }
        return false;
    }

    private void recordVolumes(CloudProvider provider, Instance instance) throws ProviderException {
        List<AttachedVolume> attached = provider.listAttachedVolumes(instance.zone(), instance.providerInstanceId());
        for (AttachedVolume volume : attached) {
            if (volumes.upsertDiscovered(instance.id(), volume, config.clock().instant())) {
                actions.success(instance.id(), ActionType.VOLUME_DISCOVERED, volume.providerVolumeId(),
                        config.clock().instant());
            }
        }
    }
}
