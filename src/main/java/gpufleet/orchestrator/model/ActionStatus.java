package gpufleet.orchestrator.model;

public enum ActionStatus {
    SUCCESS,
    FAILED
}
