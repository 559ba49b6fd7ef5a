package gpufleet.orchestrator.service;

/**
 * Worker presented no credential, or one that does not match its instance.
 */
public class WorkerAuthException extends RuntimeException {

    public WorkerAuthException(String message) {
        super(message);
    }
}
