package gpufleet.orchestrator.scheduler;

import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.CloudProviders;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceVolume;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.repository.VolumeRepository;
import gpufleet.orchestrator.service.TerminationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Deletes delete_on_terminate volumes left behind by terminated instances. The terminator removes
 * volumes of instances it tears down itself; this sweep covers instances the watch-dog found deleted
 * at the provider and volume deletes that failed. A failed delete is retried once the volume lease
 * has elapsed.
 */
public class VolumeReconciliationJob extends ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(VolumeReconciliationJob.class);

    private final InstanceRepository instances;
    private final VolumeRepository volumes;
    private final TerminationService terminationService;
    private final CloudProviders providers;
    private final OrchestratorConfig config;

    public VolumeReconciliationJob(InstanceRepository instances, VolumeRepository volumes,
            TerminationService terminationService, CloudProviders providers, OrchestratorConfig config) {
        this.instances = instances;
        this.volumes = volumes;
        this.terminationService = terminationService;
        this.providers = providers;
        this.config = config;
    }

    @Override
    public String name() {
        return "volume-reconciliation";
    }

    @Override
    public int runOnce() {
        List<InstanceVolume> claimed = volumes.claimLeftovers(config.clock().instant(), config.volumeSweepLease(),
                config.batchSize());

        int deleted = 0;
        for (InstanceVolume volume : claimed) {
            try {
                Optional<Instance> owner = instances.findById(volume.instanceId());
                if (owner.isEmpty()) {
                    log.warn("Volume {} belongs to unknown instance {}", volume.providerVolumeId(), volume.instanceId());
                    continue;
                }
                CloudProvider provider = providers.require(owner.get().provider());
                if (terminationService.deleteVolume(provider, owner.get(), volume)) {
                    deleted++;
                }
            } catch (Exception e) {
                log.error("Volume sweep failed on {}", volume.providerVolumeId(), e);
            }
        }

        if (deleted > 0) {
            log.info("Volume reconciliation: deleted {} leftover volume(s)", deleted);
        }
        return deleted;
    }
}
