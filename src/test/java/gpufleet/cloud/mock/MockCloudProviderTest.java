package gpufleet.cloud.mock;

import gpufleet.cloud.provider.AttachedVolume;
import gpufleet.cloud.provider.DeleteOutcome;
import gpufleet.cloud.provider.InstanceSpec;
import gpufleet.cloud.provider.ProviderException;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MockCloudProviderTest {

    private MockCloudProvider provider;

    @BeforeEach
    void setUp() {
        provider = new MockCloudProvider();
    }

    private String create() throws ProviderException {
        return provider.createInstance(new InstanceSpec("gpu-1", "zone-a", "MOCK-GPU-S", "mock-image-gpu", Map.of()));
    }

    @Test
    void createStartAndResolveIp() throws ProviderException {
        String id = create();

        assertTrue(provider.instanceExists("zone-a", id));
        assertTrue(provider.getIp("zone-a", id).isEmpty(), "no IP before start");

        provider.startInstance("zone-a", id);
        String ip = provider.getIp("zone-a", id).orElseThrow();
        assertTrue(ip.startsWith("10.10."));
        assertTrue(provider.isReachable(ip));
        assertTrue(provider.isWorkerHealthy(ip));
    }

    @Test
    void ipCanLagBehindStart() throws ProviderException {
        provider.setIpDelayPolls(2);
        String id = create();
        provider.startInstance("zone-a", id);

        assertTrue(provider.getIp("zone-a", id).isEmpty());
        assertTrue(provider.getIp("zone-a", id).isEmpty());
        assertTrue(provider.getIp("zone-a", id).isPresent());
    }

    @Test
    void unknownTypeIsPermanent() {
        ProviderException e = assertThrows(ProviderException.class, () -> provider.createInstance(
                new InstanceSpec("gpu-1", "zone-a", "H100-XXL", "mock-image-gpu", Map.of())));

        assertEquals(ProviderException.Kind.PERMANENT, e.kind());
        assertEquals("INVALID_INSTANCE_TYPE", e.code());
        assertFalse(e.isTransient());
    }

    @Test
    void deleteIsIdempotent() throws ProviderException {
        String id = create();

        assertEquals(DeleteOutcome.DELETED, provider.deleteInstance("zone-a", id));
        assertEquals(DeleteOutcome.ALREADY_GONE, provider.deleteInstance("zone-a", id));
        assertFalse(provider.instanceExists("zone-a", id));
        assertEquals(2, provider.deleteCalls());
    }

    @Test
    void bootVolumeIsDeletedWithInstanceFlag() throws ProviderException {
        String id = create();
        String data = provider.attachVolume(id, 50L * 1024 * 1024 * 1024, false);

        List<AttachedVolume> volumes = provider.listAttachedVolumes("zone-a", id);
        assertEquals(2, volumes.size());
        AttachedVolume boot = volumes.stream().filter(AttachedVolume::boot).findFirst().orElseThrow();
        assertTrue(boot.deleteOnTerminate());
        AttachedVolume attached = volumes.stream().filter(v -> v.providerVolumeId().equals(data))
                .findFirst().orElseThrow();
        assertFalse(attached.deleteOnTerminate());

        provider.deleteInstance("zone-a", id);
        assertTrue(provider.listAttachedVolumes("zone-a", id).isEmpty());
        assertTrue(provider.volumeExists(data), "detached volumes outlive the instance");

        assertEquals(DeleteOutcome.DELETED, provider.deleteVolume("zone-a", data));
        assertEquals(DeleteOutcome.ALREADY_GONE, provider.deleteVolume("zone-a", data));
    }

    @Test
    void injectedFailuresAreConsumedInOrder() throws ProviderException {
        provider.failNext(MockCloudProvider.Operation.CREATE, ProviderException.Kind.TRANSIENT, 1);
        provider.failNext(MockCloudProvider.Operation.CREATE, ProviderException.Kind.PERMANENT, 1);

        ProviderException first = assertThrows(ProviderException.class, this::create);
        assertTrue(first.isTransient());
        ProviderException second = assertThrows(ProviderException.class, this::create);
        assertEquals(ProviderException.Kind.PERMANENT, second.kind());

        assertNotNull(create());
        assertEquals(1, provider.instanceCount());
    }

    @Test
    void outOfBandDeletionIsInvisibleUntilChecked() throws ProviderException {
        String id = create();

        provider.deleteOutOfBand(id);

        assertFalse(provider.exists(id));
        assertEquals(0, provider.deleteCalls());
    }

    @Test
    void catalogListsBothShapes() throws ProviderException {
        assertEquals(2, provider.fetchCatalog("zone-a").size());
        assertEquals("mock-image-gpu", provider.resolveBootImage("zone-a", "MOCK-GPU-S").orElseThrow());
    }
}
