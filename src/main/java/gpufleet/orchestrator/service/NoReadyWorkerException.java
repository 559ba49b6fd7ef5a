package gpufleet.orchestrator.service;

/**
 * No ready, fresh worker serves the requested model.
 */
public class NoReadyWorkerException extends RuntimeException {

    private final String modelId;
    private final int retryAfterSeconds;

    public NoReadyWorkerException(String modelId, int retryAfterSeconds) {
        super(modelId == null || modelId.isBlank()
                ? "No ready worker available"
                : "No ready worker available for model " + modelId);
        this.modelId = modelId;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String modelId() {
        return modelId;
    }

    public int retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
