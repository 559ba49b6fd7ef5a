package gpufleet.orchestrator.model;

/**
 * Lifecycle milestones recorded in the instance action log.
 */
public enum ActionType {
    REQUEST_CREATE,
    PROVIDER_CREATE,
    PROVIDER_START,
    PROVIDER_GET_IP,
    WORKER_INSTALL,
    WORKER_HTTP_READY,
    WORKER_MODEL_LOADED,
    WORKER_WARMUP,
    HEALTH_CHECK_PASS,
    HEALTH_CHECK_FAIL,
    PROVIDER_DELETE,
    VOLUME_DELETE,
    VOLUME_DISCOVERED,
    REINSTALL,
    CATALOG_SYNC
}
