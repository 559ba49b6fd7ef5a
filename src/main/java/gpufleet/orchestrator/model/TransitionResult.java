package gpufleet.orchestrator.model;

/**
 * Outcome of a guarded status transition.
 */
public enum TransitionResult {
    /** Status updated and history row appended */
    APPLIED,

    /**
     * Row was no longer in the expected status - another actor already moved it.
     * Callers treat this as success.
     */
    SKIPPED,

    /** Instance does not exist */
    NOT_FOUND,

    /** Edge is not part of the lifecycle graph; nothing was written */
    REJECTED;

    public boolean isSuccess() {
        return this == APPLIED || this == SKIPPED;
    }
}
