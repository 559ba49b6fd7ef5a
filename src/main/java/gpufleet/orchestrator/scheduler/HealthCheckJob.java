package gpufleet.orchestrator.scheduler;

import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.CloudProviders;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.health.WorkerProbe;
import gpufleet.orchestrator.health.WorkerProbes;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.repository.ActionLogRepository;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.statemachine.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Moves coming-up instances through booting, installing and starting.
 *
 * A fresh worker heartbeat is trusted over probing. Otherwise each phase uses its own probe:
 * TCP reachability while booting, the worker readiness endpoint while installing and the model
 * listing while starting. A phase that does not pass within its timeout fails the instance to
 * {@code startup_failed}. A startup_failed instance whose worker starts heartbeating again is sent
 * back to booting while its retry count is below the cap.
 */
public class HealthCheckJob extends ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckJob.class);

    private final InstanceRepository instances;
    private final ActionLogRepository actions;
    private final StateMachine stateMachine;
    private final CloudProviders providers;
    private final WorkerProbes probes;
    private final OrchestratorConfig config;

    public HealthCheckJob(InstanceRepository instances, ActionLogRepository actions, StateMachine stateMachine,
            CloudProviders providers, WorkerProbes probes, OrchestratorConfig config) {
        this.instances = instances;
        this.actions = actions;
        this.stateMachine = stateMachine;
        this.providers = providers;
        this.probes = probes;
        this.config = config;
    }

    @Override
    public String name() {
        return "health-check";
    }

    @Override
    public int runOnce() {
        Instant now = config.clock().instant();
        List<Instance> claimed = instances.claimForHealthCheck(now, config.healthCheckLease(),
                now.minus(config.heartbeatTrustWindow()), config.startupRetryCap(), config.batchSize());

        int advanced = 0;
        for (Instance instance : claimed) {
            try {
                if (check(instance, now)) {
                    advanced++;
                }
            } catch (Exception e) {
                log.error("Health check failed on instance {}", instance.id(), e);
            }
        }
        return advanced;
    }

    /**
     * @return true if the instance changed status
     */
    private boolean check(Instance instance, Instant now) {
        if (instance.status() == InstanceStatus.STARTUP_FAILED) {
            return selfHeal(instance);
        }

        Instance current = ensureIp(instance);
        if (!current.hasIp()) {
            return failIfTimedOut(current, now);
        }

        boolean fresh = hasFreshHeartbeat(current, now);
        WorkerProbe probe = probes.forProvider(current.provider());
        int healthPort = current.workerHealthPort() != null ? current.workerHealthPort() : config.workerHealthPort();
        int vllmPort = current.workerVllmPort() != null ? current.workerVllmPort() : config.vllmPort();
        String model = current.workerModelId() != null ? current.workerModelId() : current.modelId();

        boolean passed;
        InstanceStatus next;
        ActionType milestone;
        switch (current.status()) {
            case BOOTING -> {
                passed = fresh || probe.isReachable(current.ipAddress(), healthPort);
                next = InstanceStatus.INSTALLING;
                milestone = ActionType.WORKER_INSTALL;
            }
            case INSTALLING -> {
                passed = fresh || probe.isWorkerReady(current.ipAddress(), healthPort);
                next = InstanceStatus.STARTING;
                milestone = ActionType.WORKER_HTTP_READY;
            }
            case STARTING -> {
                passed = (fresh && "ready".equals(current.workerStatus()))
                        || probe.isModelLoaded(current.ipAddress(), vllmPort, model);
                next = InstanceStatus.READY;
                milestone = ActionType.WORKER_MODEL_LOADED;
            }
            default -> {
                return false;
            }
        }

        if (!passed) {
            instances.recordHealthCheck(current.id(), false, now);
            return failIfTimedOut(current, now);
        }

        instances.recordHealthCheck(current.id(), true, now);
        actions.success(current.id(), milestone, fresh ? "heartbeat" : "probe", now);
        if (next == InstanceStatus.READY) {
            if (fresh) {
                actions.success(current.id(), ActionType.WORKER_WARMUP, "worker reported ready", now);
            }
            actions.success(current.id(), ActionType.HEALTH_CHECK_PASS, model, now);
        }

        TransitionResult result = stateMachine.transition(
                Transition.of(current.id(), current.status(), next)
                        .reason(fresh ? "heartbeat_trusted" : "health_check_passed")
                        .clearError(true)
                        .build());
        return result == TransitionResult.APPLIED;
    }

    /**
     * A startup_failed instance is only claimed when its worker heartbeats again.
     */
    private boolean selfHeal(Instance instance) {
        TransitionResult result = stateMachine.transition(
                Transition.of(instance.id(), InstanceStatus.STARTUP_FAILED, InstanceStatus.BOOTING)
                        .reason("late_heartbeat")
                        .incrementRetry(true)
                        .clearError(true)
                        .build());
        if (result == TransitionResult.APPLIED) {
            log.info("Instance {} heartbeating again, retrying startup (retry {}/{})",
                    instance.id(), instance.retryCount() + 1, config.startupRetryCap());
            return true;
        }
        return false;
    }

    private Instance ensureIp(Instance instance) {
        if (instance.hasIp() || !instance.hasProviderInstance()) {
            return instance;
        }
        try {
            CloudProvider provider = providers.require(instance.provider());
            Optional<String> ip = provider.getIp(instance.zone(), instance.providerInstanceId());
            if (ip.isPresent()) {
                instances.updateIp(instance.id(), ip.get());
                actions.success(instance.id(), ActionType.PROVIDER_GET_IP, ip.get(), config.clock().instant());
                return instance.toBuilder().ipAddress(ip.get()).build();
            }
        } catch (ProviderException e) {
            log.warn("Could not fetch IP for {}: [{}] {}", instance.id(), e.code(), e.getMessage());
        }
        return instance;
    }

    private boolean hasFreshHeartbeat(Instance instance, Instant now) {
        Instant heartbeat = instance.workerLastHeartbeat();
        return heartbeat != null && heartbeat.isAfter(now.minus(config.heartbeatTrustWindow()));
    }

    private boolean failIfTimedOut(Instance instance, Instant now) {
        Duration timeout;
        String code;
        switch (instance.status()) {
            case BOOTING -> {
                timeout = config.bootTimeout();
                code = "BOOT_TIMEOUT";
            }
            case INSTALLING -> {
                timeout = config.installTimeout();
                code = "INSTALL_TIMEOUT";
            }
            case STARTING -> {
                timeout = config.modelLoadTimeout();
                code = "MODEL_LOAD_TIMEOUT";
            }
            default -> {
                return false;
            }
        }

        Instant started = instance.phaseStartedAt();
        if (started == null || !started.plus(timeout).isBefore(now)) {
            return false;
        }

        String message = instance.status().dbValue() + " did not complete within " + timeout;
        actions.failure(instance.id(), ActionType.HEALTH_CHECK_FAIL, message, now);
        TransitionResult result = stateMachine.transition(
                Transition.of(instance.id(), instance.status(), InstanceStatus.STARTUP_FAILED)
                        .reason("health_check_timeout")
                        .error(code, message)
                        .build());
        if (result == TransitionResult.APPLIED) {
            log.warn("Instance {} failed startup: {}", instance.id(), message);
            return true;
        }
        return false;
    }
}
