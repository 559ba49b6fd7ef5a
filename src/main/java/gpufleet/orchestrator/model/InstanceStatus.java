package gpufleet.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a GPU instance.
 * Stored in the database as the lowercase name.
 */
public enum InstanceStatus {
    /** Row created, provider resource being created */
    PROVISIONING,
    /** Provider VM running, waiting for the host to become reachable */
    BOOTING,
    /** Worker agent being installed / coming up */
    INSTALLING,
    /** Worker up, inference server loading the model */
    STARTING,
    /** Serving traffic */
    READY,
    /** No new traffic, in-flight requests finishing */
    DRAINING,
    /** Provider resources being torn down */
    TERMINATING,
    /** Provider resources confirmed gone */
    TERMINATED,
    /** Frozen, no further mutation */
    ARCHIVED,
    PROVISIONING_FAILED,
    STARTUP_FAILED,
    FAILED;

    private static final Set<InstanceStatus> COMING_UP = EnumSet.of(BOOTING, INSTALLING, STARTING);
    private static final Set<InstanceStatus> FAILURES = EnumSet.of(PROVISIONING_FAILED, STARTUP_FAILED, FAILED);

    public String dbValue() {
        return name().toLowerCase();
    }

    public static InstanceStatus fromDb(String value) {
        return valueOf(value.toUpperCase());
    }

    /** Terminated and archived rows only accept archival. */
    public boolean isTerminal() {
        return this == TERMINATED || this == ARCHIVED;
    }

    public boolean isComingUp() {
        return COMING_UP.contains(this);
    }

    public boolean isFailure() {
        return FAILURES.contains(this);
    }

    /** Statuses whose ip/port pairs must stay unique. */
    public boolean isActive() {
        return !isTerminal() && !isFailure();
    }
}
