package gpufleet.orchestrator.scheduler;

import gpufleet.cloud.mock.MockCloudProvider;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.InstanceVolume;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VolumeReconciliationJobTest {

    private FleetFixture fleet;
    private WatchDogJob watchDog;
    private VolumeReconciliationJob sweep;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-volume-sweep");
        watchDog = fleet.watchDogJob();
        sweep = fleet.volumeReconciliationJob();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    /**
     * Ready instance with its volumes recorded by the watch-dog, then removed at the provider.
     */
    private Instance deletedOutOfBand(boolean withKeptVolume) {
        Instance ready = fleet.readyInstance("llama");
        if (withKeptVolume) {
            fleet.deps.mockProvider().attachVolume(ready.providerInstanceId(), 10L << 30, false);
        }
        assertEquals(0, watchDog.runOnce());
        assertFalse(fleet.deps.volumeRepository().findByInstance(ready.id()).isEmpty());

        fleet.deps.mockProvider().deleteOutOfBand(ready.providerInstanceId());
        fleet.clock.advance(Duration.ofSeconds(61));
        assertEquals(1, watchDog.runOnce());
        assertEquals(InstanceStatus.TERMINATED, fleet.reload(ready.id()).status());
        return ready;
    }

    @Test
    void deletesVolumesOfInstancesRemovedAtTheProvider() {
        Instance gone = deletedOutOfBand(true);

        assertEquals(1, sweep.runOnce());

        List<InstanceVolume> volumes = fleet.deps.volumeRepository().findByInstance(gone.id());
        assertEquals(2, volumes.size());
        for (InstanceVolume volume : volumes) {
            if (volume.deleteOnTerminate()) {
                assertTrue(volume.isDeleted());
                assertFalse(fleet.deps.mockProvider().volumeExists(volume.providerVolumeId()));
            } else {
                assertFalse(volume.isDeleted());
                assertTrue(fleet.deps.mockProvider().volumeExists(volume.providerVolumeId()));
            }
        }

        assertEquals(0, sweep.runOnce(), "nothing left to delete");
    }

    @Test
    void failedDeleteIsRetriedAfterTheLease() {
        Instance gone = deletedOutOfBand(false);
        fleet.deps.mockProvider().failNext(MockCloudProvider.Operation.DELETE_VOLUME,
                ProviderException.Kind.TRANSIENT, 1);

        assertEquals(0, sweep.runOnce());
        InstanceVolume pending = fleet.deps.volumeRepository().findPendingDeletion(gone.id()).get(0);
        assertNotNull(pending.errorMessage());

        assertEquals(0, sweep.runOnce(), "volume is still leased");

        fleet.clock.advance(Duration.ofMinutes(5).plusSeconds(1));
        assertEquals(1, sweep.runOnce());
        assertTrue(fleet.deps.volumeRepository().findPendingDeletion(gone.id()).isEmpty());
    }

    @Test
    void liveInstancesKeepTheirVolumes() {
        Instance ready = fleet.readyInstance("llama");
        watchDog.runOnce();

        assertEquals(0, sweep.runOnce());
        assertEquals(1, fleet.deps.volumeRepository().findPendingDeletion(ready.id()).size());
    }
}
