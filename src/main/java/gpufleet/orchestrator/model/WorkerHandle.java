package gpufleet.orchestrator.model;

/**
 * Routing target chosen for one inference request.
 */
public record WorkerHandle(
        String instanceId,
        String ipAddress,
        int port,
        String modelId,
        Integer queueDepth) {

    public String baseUrl() {
        return "http://" + ipAddress + ":" + port;
    }
}
