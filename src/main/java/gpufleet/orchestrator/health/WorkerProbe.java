package gpufleet.orchestrator.health;

/**
 * Active checks against a worker, escalating with the lifecycle phase.
 */
public interface WorkerProbe {

    /** TCP connect to the given port. Used while booting. */
    boolean isReachable(String ip, int port);

    /** Worker agent readiness endpoint answers 200. Used while installing. */
    boolean isWorkerReady(String ip, int healthPort);

    /** Inference server lists the model. Used while starting. */
    boolean isModelLoaded(String ip, int vllmPort, String modelId);
}
