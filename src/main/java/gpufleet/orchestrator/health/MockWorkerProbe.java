package gpufleet.orchestrator.health;

import gpufleet.cloud.mock.MockCloudProvider;

/**
 * Answers probes from the mock provider's simulated workers.
 */
public class MockWorkerProbe implements WorkerProbe {

    private final MockCloudProvider provider;

    public MockWorkerProbe(MockCloudProvider provider) {
        this.provider = provider;
    }

    @Override
    public boolean isReachable(String ip, int port) {
        return provider.isReachable(ip);
    }

    @Override
    public boolean isWorkerReady(String ip, int healthPort) {
        return provider.isWorkerHealthy(ip);
    }

    @Override
    public boolean isModelLoaded(String ip, int vllmPort, String modelId) {
        return provider.isWorkerHealthy(ip);
    }
}
