package gpufleet.cloud.provider;

import java.util.Map;
import java.util.Objects;

/**
 * Everything a provider needs to create one instance.
 *
 * @param name         provider-side name, derived from the orchestrator instance id
 * @param zone         provider zone code
 * @param instanceType provider instance type code
 * @param imageId      boot image
 * @param workerEnv    environment handed to the worker agent on first boot
 */
public record InstanceSpec(
        String name,
        String zone,
        String instanceType,
        String imageId,
        Map<String, String> workerEnv) {

    public InstanceSpec {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(zone, "zone is required");
        Objects.requireNonNull(instanceType, "instanceType is required");
        workerEnv = workerEnv == null ? Map.of() : Map.copyOf(workerEnv);
    }
}
