package gpufleet.orchestrator.service;

import gpufleet.orchestrator.bus.Command;
import gpufleet.orchestrator.bus.CommandBus;
import gpufleet.orchestrator.bus.CommandCodec;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceAction;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.InstanceVolume;
import gpufleet.orchestrator.model.StateHistoryEntry;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.repository.ActionLogRepository;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.repository.VolumeRepository;
import gpufleet.orchestrator.statemachine.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for instance lifecycle requests and read views.
 */
public class InstanceService {

    private static final Logger log = LoggerFactory.getLogger(InstanceService.class);

    /** A racing actor may move the row between read and transition; retry a few times. */
    private static final int TRANSITION_ATTEMPTS = 3;

    private final InstanceRepository instances;
    private final VolumeRepository volumes;
    private final ActionLogRepository actions;
    private final StateMachine stateMachine;
    private final CommandBus bus;
    private final OrchestratorConfig config;
    private final Clock clock;

    public InstanceService(InstanceRepository instances, VolumeRepository volumes, ActionLogRepository actions,
            StateMachine stateMachine, CommandBus bus, OrchestratorConfig config) {
        this.instances = instances;
        this.volumes = volumes;
        this.actions = actions;
        this.stateMachine = stateMachine;
        this.bus = bus;
        this.config = config;
        this.clock = config.clock();
    }

    /**
     * Insert a provisioning row and publish PROVISION for it. If the message is lost, the requeue
     * job picks the row up.
     */
    public Instance create(String provider, String zone, String instanceType, String modelId) {
        if (zone == null || zone.isBlank()) {
            throw new IllegalArgumentException("zone is required");
        }
        if (instanceType == null || instanceType.isBlank()) {
            throw new IllegalArgumentException("instance_type is required");
        }

        String providerName = provider != null && !provider.isBlank() ? provider : config.defaultProvider();
        Instance instance = Instance.builder()
                .id(UUID.randomUUID().toString())
                .provider(providerName)
                .zone(zone)
                .instanceType(instanceType)
                .modelId(modelId)
                .status(InstanceStatus.PROVISIONING)
                .createdAt(clock.instant())
                .build();

        instances.insertIfAbsent(instance, "create_requested");
        actions.success(instance.id(), ActionType.REQUEST_CREATE, "Instance requested", clock.instant());

        publish(Command.provision(instance.id(), providerName, zone, instanceType, modelId));
        log.info("Instance {} requested ({} {} {})", instance.id(), providerName, zone, instanceType);

        return instances.findById(instance.id()).orElse(instance);
    }

    /**
     * Move any non-terminal instance to terminating.
     *
     * @return APPLIED, SKIPPED if already terminating, NOT_FOUND, or REJECTED for terminal rows
     */
    public TransitionResult requestTermination(String instanceId, String reason) {
        for (int attempt = 0; attempt < TRANSITION_ATTEMPTS; attempt++) {
            Optional<Instance> found = instances.findById(instanceId);
            if (found.isEmpty()) {
                return TransitionResult.NOT_FOUND;
            }
            InstanceStatus current = found.get().status();
            if (current == InstanceStatus.TERMINATING) {
                return TransitionResult.SKIPPED;
            }
            if (current.isTerminal()) {
                return TransitionResult.REJECTED;
            }

            TransitionResult result = stateMachine.transition(
                    Transition.of(instanceId, current, InstanceStatus.TERMINATING)
                            .reason(reason)
                            .deletionReason(reason)
                            .build());
            if (result != TransitionResult.SKIPPED) {
                return result;
            }
        }
        return TransitionResult.SKIPPED;
    }

    /**
     * Publish TERMINATE for an instance.
     */
    public void terminate(String instanceId) {
        publish(Command.terminate(instanceId));
    }

    /**
     * Reset worker state and send the instance back through the install checks.
     * Only ready and startup_failed instances can be reinstalled.
     */
    public TransitionResult reinstall(String instanceId) {
        Optional<Instance> found = instances.findById(instanceId);
        if (found.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }

        Instance instance = found.get();
        InstanceStatus target = switch (instance.status()) {
            case READY -> InstanceStatus.INSTALLING;
            case STARTUP_FAILED -> InstanceStatus.BOOTING;
            default -> null;
        };
        if (target == null) {
            log.warn("Cannot reinstall instance {} in status {}", instanceId, instance.status().dbValue());
            return TransitionResult.REJECTED;
        }

        TransitionResult result = stateMachine.transition(
                Transition.of(instanceId, instance.status(), target)
                        .reason("reinstall")
                        .resetWorker(true)
                        .clearError(true)
                        .build());
        if (result == TransitionResult.APPLIED) {
            actions.success(instanceId, ActionType.REINSTALL, "From " + instance.status().dbValue(), clock.instant());
        }
        return result;
    }

    public TransitionResult drain(String instanceId) {
        return stateMachine.transition(instanceId, InstanceStatus.READY, InstanceStatus.DRAINING, "drain_requested");
    }

    /**
     * Archive a terminated or failed instance. Archived rows are immutable.
     */
    public TransitionResult archive(String instanceId) {
        Optional<Instance> found = instances.findById(instanceId);
        if (found.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }
        return stateMachine.transition(instanceId, found.get().status(), InstanceStatus.ARCHIVED, "archived");
    }

    public Optional<Instance> findById(String instanceId) {
        return instances.findById(instanceId);
    }

    public List<Instance> findAll() {
        return instances.findAll();
    }

    public int progress(Instance instance) {
        return ProgressCalculator.progress(instance.status(), actions.completedActions(instance.id()));
    }

    public List<StateHistoryEntry> history(String instanceId) {
        return instances.findHistory(instanceId);
    }

    public List<InstanceVolume> volumes(String instanceId) {
        return volumes.findByInstance(instanceId);
    }

    public List<InstanceAction> actions(String instanceId) {
        return actions.findByInstance(instanceId);
    }

    /**
     * Publish a command on the orchestrator channel.
     *
     * @return number of subscribers that received it
     */
    public int publish(Command command) {
        command.validate();
        Command withId = command.correlationId() != null
                ? command
                : command.withCorrelationId(UUID.randomUUID().toString());
        int delivered = bus.publish(config.commandChannel(), CommandCodec.encode(withId));
        if (delivered == 0) {
            log.warn("{} for {} was not delivered, reconciliation will catch up", command.type(),
                    command.instanceId());
        }
        return delivered;
    }
}
