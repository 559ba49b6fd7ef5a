package gpufleet.orchestrator.scheduler;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.service.ProvisioningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Re-runs provisioning for rows left in {@code provisioning}. The command bus may lose PROVISION
 * messages; this job is what guarantees every requested instance gets provisioned or failed.
 */
public class ProvisioningRequeueJob extends ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningRequeueJob.class);

    private final InstanceRepository instances;
    private final ProvisioningService provisioningService;
    private final OrchestratorConfig config;

    public ProvisioningRequeueJob(InstanceRepository instances, ProvisioningService provisioningService,
            OrchestratorConfig config) {
        this.instances = instances;
        this.provisioningService = provisioningService;
        this.config = config;
    }

    @Override
    public String name() {
        return "provisioning-requeue";
    }

    @Override
    public int runOnce() {
        Instant now = config.clock().instant();
        List<Instance> claimed = instances.claimForRequeue(now, config.requeueLease(),
                now.minus(config.requeueThreshold()), config.requeueMaxRetries(), config.requeueBatchSize());

        int advanced = 0;
        for (Instance instance : claimed) {
            try {
                if (!instances.renewClaim(instance, config.clock().instant())) {
                    log.debug("Instance {} changed since it was claimed, skipping", instance.id());
                    continue;
                }
                log.info("Requeueing provisioning of {} (retry_count={})", instance.id(), instance.retryCount());
                ProvisioningService.Outcome outcome = provisioningService.resume(instance);
                if (outcome == ProvisioningService.Outcome.BOOTING || outcome == ProvisioningService.Outcome.FAILED) {
                    advanced++;
                }
            } catch (Exception e) {
                log.error("Failed to requeue instance {}", instance.id(), e);
            } finally {
                instances.releaseClaim(instance);
            }
        }
        return advanced;
    }
}
