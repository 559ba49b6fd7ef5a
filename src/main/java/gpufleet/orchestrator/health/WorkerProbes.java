package gpufleet.orchestrator.health;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probe lookup by provider name, with a fallback for providers without a dedicated probe.
 */
public class WorkerProbes {

    private final Map<String, WorkerProbe> byProvider = new ConcurrentHashMap<>();
    private final WorkerProbe fallback;

    public WorkerProbes(WorkerProbe fallback) {
        this.fallback = fallback;
    }

    public WorkerProbes register(String provider, WorkerProbe probe) {
        byProvider.put(provider, probe);
        return this;
    }

    public WorkerProbe forProvider(String provider) {
        return provider != null ? byProvider.getOrDefault(provider, fallback) : fallback;
    }
}
