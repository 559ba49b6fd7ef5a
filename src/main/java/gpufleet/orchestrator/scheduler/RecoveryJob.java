package gpufleet.orchestrator.scheduler;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.statemachine.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Force-moves rows stuck in a non-terminal status past its timeout. Each transition happens inside
 * the claim transaction and carries error code {@code RECOVERY_TIMEOUT}.
 */
public class RecoveryJob extends ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(RecoveryJob.class);

    public static final String RECOVERY_TIMEOUT = "RECOVERY_TIMEOUT";

    private record Rule(InstanceStatus from, InstanceStatus to, Duration timeout) {
    }

    private final InstanceRepository instances;
    private final OrchestratorConfig config;
    private final List<Rule> rules;

    public RecoveryJob(InstanceRepository instances, OrchestratorConfig config) {
        this.instances = instances;
        this.config = config;
        this.rules = List.of(
                new Rule(InstanceStatus.PROVISIONING, InstanceStatus.PROVISIONING_FAILED, config.provisioningTimeout()),
                new Rule(InstanceStatus.BOOTING, InstanceStatus.STARTUP_FAILED, config.bootTimeout()),
                new Rule(InstanceStatus.INSTALLING, InstanceStatus.STARTUP_FAILED, config.installTimeout()),
                new Rule(InstanceStatus.STARTING, InstanceStatus.STARTUP_FAILED, config.modelLoadTimeout()),
                new Rule(InstanceStatus.DRAINING, InstanceStatus.TERMINATING, config.drainingTimeout()),
                new Rule(InstanceStatus.TERMINATING, InstanceStatus.FAILED, config.terminatingTimeout()));
        for (Rule rule : rules) {
            if (!StateMachine.isAllowed(rule.from(), rule.to())) {
                throw new IllegalStateException("Recovery rule uses undefined edge " + rule.from() + " -> " + rule.to());
            }
        }
    }

    @Override
    public String name() {
        return "recovery";
    }

    @Override
    public int runOnce() {
        Instant now = config.clock().instant();
        int recovered = 0;

        for (Rule rule : rules) {
            String message = "Stuck in " + rule.from().dbValue() + " for more than " + rule.timeout();
            Transition template = Transition.of("*", rule.from(), rule.to())
                    .reason("recovery_timeout")
                    .error(RECOVERY_TIMEOUT, message)
                    .metadata(StateMachine.metadata(Map.of("timeout_seconds", rule.timeout().toSeconds())))
                    .build();
            try {
                List<String> ids = instances.recoverStuck(rule.from(), now.minus(rule.timeout()), template,
                        config.batchSize());
                for (String id : ids) {
                    log.warn("Recovered instance {}: {} -> {} ({})", id, rule.from().dbValue(), rule.to().dbValue(),
                            message);
                }
                recovered += ids.size();
            } catch (Exception e) {
                log.error("Recovery sweep for {} failed", rule.from().dbValue(), e);
            }
        }
        return recovered;
    }
}
