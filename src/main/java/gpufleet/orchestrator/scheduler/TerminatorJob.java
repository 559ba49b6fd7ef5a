package gpufleet.orchestrator.scheduler;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.service.TerminationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Drives terminating instances to terminated. Backstop for the TERMINATE fast path.
 */
public class TerminatorJob extends ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(TerminatorJob.class);

    private final InstanceRepository instances;
    private final TerminationService terminationService;
    private final OrchestratorConfig config;

    public TerminatorJob(InstanceRepository instances, TerminationService terminationService,
            OrchestratorConfig config) {
        this.instances = instances;
        this.terminationService = terminationService;
        this.config = config;
    }

    @Override
    public String name() {
        return "terminator";
    }

    @Override
    public int runOnce() {
        Instant now = config.clock().instant();
        List<Instance> claimed = instances.claimForTermination(now, config.terminatorLease(),
                config.terminatorMaxAttempts(), config.batchSize());

        int terminated = 0;
        for (Instance instance : claimed) {
            try {
                if (!instances.renewClaim(instance, config.clock().instant())) {
                    log.debug("Instance {} changed since it was claimed, skipping", instance.id());
                    continue;
                }
                if (terminationService.terminate(instance) == TerminationService.Outcome.TERMINATED) {
                    terminated++;
                }
            } catch (Exception e) {
                log.error("Failed to terminate instance {}", instance.id(), e);
            } finally {
                instances.releaseClaim(instance);
            }
        }

        if (!claimed.isEmpty()) {
            log.info("Terminator: {} terminated, {} claimed", terminated, claimed.size());
        }
        return terminated;
    }
}
