package gpufleet.orchestrator.statemachine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static gpufleet.orchestrator.model.InstanceStatus.*;

/**
 * Instance lifecycle state machine.
 *
 * Owns the edge table and is the only writer of instance status. Every applied transition is a
 * guarded compare-and-swap plus one history row in the same transaction (see
 * {@link InstanceRepository#transition(Transition)}). A guard miss means another actor already moved
 * the row and is reported as {@link TransitionResult#SKIPPED}.
 */
public class StateMachine {

    private static final Logger log = LoggerFactory.getLogger(StateMachine.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<InstanceStatus, Set<InstanceStatus>> EDGES = new EnumMap<>(InstanceStatus.class);

    static {
        edge(PROVISIONING, BOOTING, PROVISIONING_FAILED, TERMINATING);
        edge(BOOTING, INSTALLING, STARTUP_FAILED, TERMINATING);
        edge(INSTALLING, STARTING, STARTUP_FAILED, TERMINATING);
        edge(STARTING, READY, STARTUP_FAILED, TERMINATING);
        edge(READY, DRAINING, INSTALLING, TERMINATING, TERMINATED);
        edge(DRAINING, TERMINATING, TERMINATED, FAILED);
        edge(STARTUP_FAILED, BOOTING, TERMINATING, ARCHIVED);
        edge(PROVISIONING_FAILED, TERMINATING, ARCHIVED);
        edge(FAILED, TERMINATING, ARCHIVED);
        edge(TERMINATING, TERMINATED, FAILED);
        edge(TERMINATED, ARCHIVED);
        EDGES.put(ARCHIVED, Collections.emptySet());
    }

    private static void edge(InstanceStatus from, InstanceStatus... to) {
        EnumSet<InstanceStatus> targets = EnumSet.noneOf(InstanceStatus.class);
        Collections.addAll(targets, to);
        EDGES.put(from, Collections.unmodifiableSet(targets));
    }

    private final InstanceRepository instances;

    public StateMachine(InstanceRepository instances) {
        this.instances = instances;
    }

    public static boolean isAllowed(InstanceStatus from, InstanceStatus to) {
        return EDGES.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public static Set<InstanceStatus> allowedFrom(InstanceStatus from) {
        return EDGES.getOrDefault(from, Collections.emptySet());
    }

    /**
     * Apply a transition. Undefined edges are rejected without touching the store.
     */
    public TransitionResult transition(Transition transition) {
        if (!isAllowed(transition.from(), transition.to())) {
            log.warn("Rejected undefined transition {} -> {} for instance {}",
                    transition.from().dbValue(), transition.to().dbValue(), transition.instanceId());
            return TransitionResult.REJECTED;
        }

        TransitionResult result = instances.transition(transition);
        switch (result) {
            case APPLIED -> log.info("Instance {}: {} -> {} ({})", transition.instanceId(),
                    transition.from().dbValue(), transition.to().dbValue(), transition.reason());
            case SKIPPED -> log.debug("Instance {} no longer {}, skipped transition to {}",
                    transition.instanceId(), transition.from().dbValue(), transition.to().dbValue());
            case NOT_FOUND -> log.warn("Transition for unknown instance {}", transition.instanceId());
            default -> {
            }
        }
        return result;
    }

    public TransitionResult transition(String instanceId, InstanceStatus from, InstanceStatus to, String reason) {
        return transition(Transition.of(instanceId, from, to).reason(reason).build());
    }

    /**
     * Serialize a metadata map for a history row or action log entry.
     */
    public static String metadata(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable", e);
        }
    }
}
