package gpufleet.orchestrator.service;

import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.InstanceStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Coarse 0..100 progress for an instance, derived from its status and the milestones recorded in
 * its action log. The value never decreases as more milestones complete.
 */
public final class ProgressCalculator {

    private static final int REQUESTED = 5;
    private static final int CREATED = 20;

    private static final Map<ActionType, Integer> MILESTONES;

    static {
        Map<ActionType, Integer> m = new EnumMap<>(ActionType.class);
        m.put(ActionType.PROVIDER_CREATE, CREATED);
        m.put(ActionType.PROVIDER_START, 30);
        m.put(ActionType.PROVIDER_GET_IP, 40);
        m.put(ActionType.WORKER_INSTALL, 50);
        m.put(ActionType.WORKER_HTTP_READY, 60);
        m.put(ActionType.WORKER_MODEL_LOADED, 75);
        m.put(ActionType.WORKER_WARMUP, 90);
        m.put(ActionType.HEALTH_CHECK_PASS, 95);
        MILESTONES = Collections.unmodifiableMap(m);
    }

    private ProgressCalculator() {
    }

    public static int progress(InstanceStatus status, Set<ActionType> completed) {
        switch (status) {
            case READY:
                return 100;
            case PROVISIONING:
                return completed.contains(ActionType.PROVIDER_CREATE) ? CREATED : REQUESTED;
            case BOOTING:
            case INSTALLING:
            case STARTING:
                int best = CREATED;
                for (ActionType action : completed) {
                    best = Math.max(best, MILESTONES.getOrDefault(action, 0));
                }
                return best;
            default:
                return 0;
        }
    }

    public static Map<ActionType, Integer> milestones() {
        return MILESTONES;
    }
}
