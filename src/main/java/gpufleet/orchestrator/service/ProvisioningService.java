package gpufleet.orchestrator.service;

import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.CloudProviders;
import gpufleet.cloud.provider.InstanceSpec;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.ActionStatus;
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

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Drives an instance from {@code provisioning} to {@code booting}.
 *
 * The workflow is resumable: every step checks what is already persisted on the row, so the
 * dispatcher and the requeue job can both run it for the same instance. When two runs race on
 * provider creation, the one that loses the guarded id update deletes the instance it created.
 */
public class ProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningService.class);

    public enum Outcome {
        /** Instance moved to booting */
        BOOTING,
        /** Transient failure recorded, requeue will retry */
        RETRY_PENDING,
        /** Moved to provisioning_failed */
        FAILED,
        /** Row missing or no longer provisioning */
        SKIPPED
    }

    private final InstanceRepository instances;
    private final ActionLogRepository actions;
    private final StateMachine stateMachine;
    private final CloudProviders providers;
    private final OrchestratorConfig config;
    private final Clock clock;

    public ProvisioningService(InstanceRepository instances, ActionLogRepository actions, StateMachine stateMachine,
            CloudProviders providers, OrchestratorConfig config) {
        this.instances = instances;
        this.actions = actions;
        this.stateMachine = stateMachine;
        this.providers = providers;
        this.config = config;
        this.clock = config.clock();
    }

    /**
     * Make sure the row exists, then run the workflow on it.
     */
    public Outcome provision(String instanceId, String provider, String zone, String instanceType, String modelId) {
        Instance requested = Instance.builder()
                .id(instanceId)
                .provider(provider != null ? provider : config.defaultProvider())
                .zone(zone)
                .instanceType(instanceType)
                .modelId(modelId)
                .status(InstanceStatus.PROVISIONING)
                .createdAt(clock.instant())
                .build();

        if (zone != null && instanceType != null && instances.insertIfAbsent(requested, "provision_requested")) {
            actions.success(instanceId, ActionType.REQUEST_CREATE, "Instance requested", clock.instant());
        }

        Optional<Instance> row = instances.findById(instanceId);
        if (row.isEmpty()) {
            log.warn("PROVISION for unknown instance {} without zone/type, ignoring", instanceId);
            return Outcome.SKIPPED;
        }
        return resume(row.get());
    }

    /**
     * Continue provisioning from the last persisted step.
     */
    public Outcome resume(Instance instance) {
        if (instance.status() != InstanceStatus.PROVISIONING) {
            log.debug("Instance {} is {}, nothing to provision", instance.id(), instance.status().dbValue());
            return Outcome.SKIPPED;
        }

        String instanceId = instance.id();
        ActionType step = ActionType.PROVIDER_CREATE;
        try {
            CloudProvider provider = providers.require(instance.provider());

            String providerInstanceId = instance.providerInstanceId();
            if (providerInstanceId == null) {
                Optional<String> created = createAtProvider(provider, instance);
                if (created.isEmpty()) {
                    return Outcome.SKIPPED;
                }
                providerInstanceId = created.get();
            }

            step = ActionType.PROVIDER_START;
            long startedAt = System.currentTimeMillis();
            provider.startInstance(instance.zone(), providerInstanceId);
            actions.record(instanceId, ActionType.PROVIDER_START, ActionStatus.SUCCESS,
                    "Instance started", null, System.currentTimeMillis() - startedAt, clock.instant());

            String ip = instance.ipAddress();
            if (ip == null) {
                step = ActionType.PROVIDER_GET_IP;
                ip = pollIp(provider, instance.zone(), providerInstanceId).orElse(null);
                if (ip != null) {
                    instances.updateIp(instanceId, ip);
                    actions.success(instanceId, ActionType.PROVIDER_GET_IP, ip, clock.instant());
                } else {
                    log.info("Instance {} has no IP yet, health-check will fetch it", instanceId);
                }
            }

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("provider_instance_id", providerInstanceId);
            meta.put("ip_address", ip);
            TransitionResult result = stateMachine.transition(
                    Transition.of(instanceId, InstanceStatus.PROVISIONING, InstanceStatus.BOOTING)
                            .reason("provider_instance_created")
                            .metadata(StateMachine.metadata(meta))
                            .clearError(true)
                            .build());
            return result == TransitionResult.APPLIED ? Outcome.BOOTING : Outcome.SKIPPED;

        } catch (ProviderException e) {
            return handleFailure(instance, step, e);
        }
    }

    /**
     * Create the provider instance and persist its id. Returns the id the row ends up with, or empty
     * if the row left provisioning meanwhile.
     */
    private Optional<String> createAtProvider(CloudProvider provider, Instance instance) throws ProviderException {
        String image = provider.resolveBootImage(instance.zone(), instance.instanceType())
                .orElse(config.defaultImage());

        InstanceSpec spec = new InstanceSpec(instance.id(), instance.zone(), instance.instanceType(), image,
                workerEnv(instance));

        long startedAt = System.currentTimeMillis();
        String providerInstanceId = provider.createInstance(spec);
        long duration = System.currentTimeMillis() - startedAt;

        if (instances.setProviderInstanceId(instance.id(), providerInstanceId)) {
            actions.record(instance.id(), ActionType.PROVIDER_CREATE, ActionStatus.SUCCESS,
                    "Created " + providerInstanceId,
                    StateMachine.metadata(Map.of("provider_instance_id", providerInstanceId, "image", image)),
                    duration, clock.instant());
            log.info("Instance {} created at {} as {}", instance.id(), provider.name(), providerInstanceId);
            return Optional.of(providerInstanceId);
        }

        // Another run stored its id first, drop ours.
        log.warn("Instance {} already has a provider id, deleting orphan {}", instance.id(), providerInstanceId);
        try {
            provider.deleteInstance(instance.zone(), providerInstanceId);
        } catch (ProviderException e) {
            log.error("Failed to delete orphan {} for instance {}: {}", providerInstanceId, instance.id(),
                    e.getMessage());
        }

        return instances.findById(instance.id())
                .filter(current -> current.status() == InstanceStatus.PROVISIONING)
                .map(Instance::providerInstanceId);
    }

    private Optional<String> pollIp(CloudProvider provider, String zone, String providerInstanceId)
            throws ProviderException {
        for (int attempt = 1; attempt <= config.ipPollAttempts(); attempt++) {
            Optional<String> ip = provider.getIp(zone, providerInstanceId);
            if (ip.isPresent()) {
                return ip;
            }
            if (attempt < config.ipPollAttempts() && !sleep(config.ipPollInterval().toMillis())) {
                break;
            }
        }
        return Optional.empty();
    }

    private Outcome handleFailure(Instance instance, ActionType step, ProviderException e) {
        Instant now = clock.instant();
        actions.failure(instance.id(), step, "[" + e.code() + "] " + e.getMessage(), now);

        if (e.isTransient()) {
            int retries = instance.retryCount() + 1;
            if (retries < config.requeueMaxRetries()) {
                instances.recordError(instance.id(), e.code(), e.getMessage(), true);
                log.warn("Transient provisioning failure for {} (attempt {}/{}): {}",
                        instance.id(), retries, config.requeueMaxRetries(), e.getMessage());
                return Outcome.RETRY_PENDING;
            }
            log.error("Provisioning of {} exhausted {} retries", instance.id(), retries);
            return fail(instance, e.code(), "Retries exhausted: " + e.getMessage(), true);
        }

        log.error("Permanent provisioning failure for {}: [{}] {}", instance.id(), e.code(), e.getMessage());
        return fail(instance, e.code(), e.getMessage(), false);
    }

    private Outcome fail(Instance instance, String code, String message, boolean incrementRetry) {
        TransitionResult result = stateMachine.transition(
                Transition.of(instance.id(), InstanceStatus.PROVISIONING, InstanceStatus.PROVISIONING_FAILED)
                        .reason("provider_error")
                        .error(code, message)
                        .incrementRetry(incrementRetry)
                        .build());
        return result == TransitionResult.APPLIED ? Outcome.FAILED : Outcome.SKIPPED;
    }

    private Map<String, String> workerEnv(Instance instance) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("GPUFLEET_INSTANCE_ID", instance.id());
        env.put("GPUFLEET_CONTROL_PLANE_URL", config.publicUrl());
        env.put("GPUFLEET_VLLM_PORT", String.valueOf(config.vllmPort()));
        env.put("GPUFLEET_HEALTH_PORT", String.valueOf(config.workerHealthPort()));
        if (instance.modelId() != null) {
            env.put("GPUFLEET_MODEL_ID", instance.modelId());
        }
        return env;
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
