package gpufleet.orchestrator.bus;

public enum CommandType {
    PROVISION,
    TERMINATE,
    REINSTALL,
    SYNC_CATALOG,
    RECONCILE
}
