package gpufleet.cloud.provider;

import java.util.List;
import java.util.Optional;

/**
 * Uniform contract over heterogeneous compute providers.
 *
 * Teardown calls are idempotent: a resource that is already gone yields
 * {@link DeleteOutcome#ALREADY_GONE}, never an exception.
 */
public interface CloudProvider {

    /**
     * Provider code stored on the instance row (e.g. "mock", "yandex").
     */
    String name();

    /**
     * Create an instance. Returns the provider instance id.
     */
    String createInstance(InstanceSpec spec) throws ProviderException;

    /**
     * Power on a created instance. Starting a running instance is a no-op.
     */
    void startInstance(String zone, String providerInstanceId) throws ProviderException;

    /**
     * Public IP of the instance, empty while not yet assigned.
     */
    Optional<String> getIp(String zone, String providerInstanceId) throws ProviderException;

    DeleteOutcome deleteInstance(String zone, String providerInstanceId) throws ProviderException;

    boolean instanceExists(String zone, String providerInstanceId) throws ProviderException;

    /**
     * All volumes attached to the instance, including ones the orchestrator never created.
     */
    List<AttachedVolume> listAttachedVolumes(String zone, String providerInstanceId) throws ProviderException;

    DeleteOutcome deleteVolume(String zone, String providerVolumeId) throws ProviderException;

    /**
     * Boot image for the given type, empty when the provider has no preference.
     */
    Optional<String> resolveBootImage(String zone, String instanceType) throws ProviderException;

    List<InstanceTypeOffer> fetchCatalog(String zone) throws ProviderException;
}
