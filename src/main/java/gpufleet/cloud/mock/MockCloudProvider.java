package gpufleet.cloud.mock;

import gpufleet.cloud.provider.AttachedVolume;
import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.DeleteOutcome;
import gpufleet.cloud.provider.InstanceSpec;
import gpufleet.cloud.provider.InstanceTypeOffer;
import gpufleet.cloud.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory provider for local runs and tests.
 *
 * Instances get deterministic 10.10.x.y addresses and a boot volume flagged for deletion.
 * Test hooks allow failure injection, out-of-band deletion and worker health control,
 * the latter read by {@code MockWorkerProbe}.
 */
public class MockCloudProvider implements CloudProvider {

    private static final Logger log = LoggerFactory.getLogger(MockCloudProvider.class);

    public static final String NAME = "mock";
    private static final long GB = 1024L * 1024 * 1024;

    /** Provider calls that can be made to fail. */
    public enum Operation {
        CREATE, START, GET_IP, DELETE, EXISTS, LIST_VOLUMES, DELETE_VOLUME, CATALOG
    }

    private static final List<InstanceTypeOffer> CATALOG = List.of(
            new InstanceTypeOffer("MOCK-GPU-S", "MOCK-GPU-S", 8, 32, 1, 24, 0.25),
            new InstanceTypeOffer("MOCK-4GPU-M", "MOCK-4GPU-M", 16, 64, 4, 48, 0.75));

    private final Map<String, MockInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, MockVolume> volumes = new ConcurrentHashMap<>();
    private final Map<Operation, Deque<ProviderException.Kind>> failures = new EnumMap<>(Operation.class);
    private final AtomicLong ipSequence = new AtomicLong(0);
    private final AtomicInteger createCalls = new AtomicInteger();
    private final AtomicInteger deleteCalls = new AtomicInteger();

    private volatile int ipDelayPolls = 0;
    private volatile boolean workersHealthyByDefault = true;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String createInstance(InstanceSpec spec) throws ProviderException {
        maybeFail(Operation.CREATE);
        createCalls.incrementAndGet();

        if (spec.zone().isBlank()) {
            throw ProviderException.permanent("INVALID_ZONE", "Zone is required");
        }
        if (CATALOG.stream().noneMatch(o -> o.code().equals(spec.instanceType()))) {
            throw ProviderException.permanent("INVALID_INSTANCE_TYPE",
                    "Unknown instance type '" + spec.instanceType() + "' in zone " + spec.zone());
        }

        String id = "mock-" + UUID.randomUUID();
        long seq = ipSequence.incrementAndGet();
        String ip = "10.10." + ((seq / 250) % 250 + 1) + "." + (seq % 250 + 1);

        MockInstance instance = new MockInstance(id, spec.zone(), spec.instanceType(), ip, ipDelayPolls,
                workersHealthyByDefault);
        instances.put(id, instance);

        String bootVolume = "mock-vol-" + UUID.randomUUID();
        volumes.put(bootVolume, new MockVolume(bootVolume, id, "boot", 100 * GB, true, true));

        log.info("Mock instance created: {} (zone={}, type={})", id, spec.zone(), spec.instanceType());
        return id;
    }

    @Override
    public void startInstance(String zone, String providerInstanceId) throws ProviderException {
        maybeFail(Operation.START);
        MockInstance instance = instances.get(providerInstanceId);
        if (instance == null) {
            throw new ProviderException(ProviderException.Kind.NOT_FOUND, "INSTANCE_NOT_FOUND",
                    "Mock instance not found: " + providerInstanceId);
        }
        instance.running = true;
    }

    @Override
    public Optional<String> getIp(String zone, String providerInstanceId) throws ProviderException {
        maybeFail(Operation.GET_IP);
        MockInstance instance = instances.get(providerInstanceId);
        if (instance == null || !instance.running) {
            return Optional.empty();
        }
        synchronized (instance) {
            if (instance.pendingIpPolls > 0) {
                instance.pendingIpPolls--;
                return Optional.empty();
            }
        }
        return Optional.of(instance.ip);
    }

    @Override
    public DeleteOutcome deleteInstance(String zone, String providerInstanceId) throws ProviderException {
        maybeFail(Operation.DELETE);
        deleteCalls.incrementAndGet();
        MockInstance removed = instances.remove(providerInstanceId);
        if (removed == null) {
            return DeleteOutcome.ALREADY_GONE;
        }
        detachVolumes(providerInstanceId);
        log.info("Mock instance deleted: {}", providerInstanceId);
        return DeleteOutcome.DELETED;
    }

    @Override
    public boolean instanceExists(String zone, String providerInstanceId) throws ProviderException {
        maybeFail(Operation.EXISTS);
        return instances.containsKey(providerInstanceId);
    }

    @Override
    public List<AttachedVolume> listAttachedVolumes(String zone, String providerInstanceId) throws ProviderException {
        maybeFail(Operation.LIST_VOLUMES);
        List<AttachedVolume> attached = new ArrayList<>();
        for (MockVolume v : volumes.values()) {
            if (providerInstanceId.equals(v.attachedTo)) {
                attached.add(new AttachedVolume(v.id, v.type, v.sizeBytes, v.boot, v.deleteOnTerminate));
            }
        }
        return attached;
    }

    @Override
    public DeleteOutcome deleteVolume(String zone, String providerVolumeId) throws ProviderException {
        maybeFail(Operation.DELETE_VOLUME);
        return volumes.remove(providerVolumeId) != null ? DeleteOutcome.DELETED : DeleteOutcome.ALREADY_GONE;
    }

    @Override
    public Optional<String> resolveBootImage(String zone, String instanceType) {
        return Optional.of("mock-image-gpu");
    }

    @Override
    public List<InstanceTypeOffer> fetchCatalog(String zone) throws ProviderException {
        maybeFail(Operation.CATALOG);
        return CATALOG;
    }

    // ---------- test hooks ----------

    /**
     * Make the next {@code times} calls of the operation fail with the given kind.
     */
    public void failNext(Operation operation, ProviderException.Kind kind, int times) {
        synchronized (failures) {
            Deque<ProviderException.Kind> queue = failures.computeIfAbsent(operation, o -> new ArrayDeque<>());
            for (int i = 0; i < times; i++) {
                queue.add(kind);
            }
        }
    }

    /**
     * Remove an instance behind the orchestrator's back.
     */
    public void deleteOutOfBand(String providerInstanceId) {
        instances.remove(providerInstanceId);
        detachVolumes(providerInstanceId);
    }

    /**
     * Attach an extra volume to an existing instance. Returns the volume id.
     */
    public String attachVolume(String providerInstanceId, long sizeBytes, boolean deleteOnTerminate) {
        String id = "mock-vol-" + UUID.randomUUID();
        volumes.put(id, new MockVolume(id, providerInstanceId, "data", sizeBytes, false, deleteOnTerminate));
        return id;
    }

    public boolean volumeExists(String providerVolumeId) {
        return volumes.containsKey(providerVolumeId);
    }

    /** Number of empty getIp answers a new instance gives before its address shows up. */
    public void setIpDelayPolls(int polls) {
        this.ipDelayPolls = polls;
    }

    public void setWorkersHealthyByDefault(boolean healthy) {
        this.workersHealthyByDefault = healthy;
    }

    public void setWorkerHealthy(String providerInstanceId, boolean healthy) {
        MockInstance instance = instances.get(providerInstanceId);
        if (instance != null) {
            instance.workerHealthy = healthy;
        }
    }

    /**
     * Whether a running instance answers on the given address.
     */
    public boolean isReachable(String ip) {
        return findByIp(ip).map(i -> i.running).orElse(false);
    }

    /**
     * Whether the simulated worker on the given address is healthy.
     */
    public boolean isWorkerHealthy(String ip) {
        return findByIp(ip).map(i -> i.running && i.workerHealthy).orElse(false);
    }

    public boolean exists(String providerInstanceId) {
        return instances.containsKey(providerInstanceId);
    }

    public int createCalls() {
        return createCalls.get();
    }

    public int deleteCalls() {
        return deleteCalls.get();
    }

    public int instanceCount() {
        return instances.size();
    }

    // ---------- internals ----------

    private Optional<MockInstance> findByIp(String ip) {
        if (ip == null) {
            return Optional.empty();
        }
        return instances.values().stream().filter(i -> ip.equals(i.ip)).findFirst();
    }

    private void detachVolumes(String providerInstanceId) {
        for (MockVolume v : volumes.values()) {
            if (providerInstanceId.equals(v.attachedTo)) {
                v.attachedTo = null;
            }
        }
    }

    private void maybeFail(Operation operation) throws ProviderException {
        ProviderException.Kind kind;
        synchronized (failures) {
            Deque<ProviderException.Kind> queue = failures.get(operation);
            kind = queue != null ? queue.poll() : null;
        }
        if (kind != null) {
            throw new ProviderException(kind, "MOCK_" + operation.name() + "_FAILED",
                    "Injected " + kind.name().toLowerCase() + " failure on " + operation);
        }
    }

    private static final class MockInstance {
        final String id;
        final String zone;
        final String instanceType;
        final String ip;
        volatile boolean running;
        volatile boolean workerHealthy;
        int pendingIpPolls;

        MockInstance(String id, String zone, String instanceType, String ip, int pendingIpPolls,
                boolean workerHealthy) {
            this.id = id;
            this.zone = zone;
            this.instanceType = instanceType;
            this.ip = ip;
            this.pendingIpPolls = pendingIpPolls;
            this.workerHealthy = workerHealthy;
        }
    }

    private static final class MockVolume {
        final String id;
        final String type;
        final long sizeBytes;
        final boolean boot;
        final boolean deleteOnTerminate;
        volatile String attachedTo;

        MockVolume(String id, String attachedTo, String type, long sizeBytes, boolean boot,
                boolean deleteOnTerminate) {
            this.id = id;
            this.attachedTo = attachedTo;
            this.type = type;
            this.sizeBytes = sizeBytes;
            this.boot = boot;
            this.deleteOnTerminate = deleteOnTerminate;
        }
    }
}
