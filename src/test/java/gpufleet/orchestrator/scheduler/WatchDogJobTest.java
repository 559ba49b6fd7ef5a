package gpufleet.orchestrator.scheduler;

import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.InstanceVolume;
import gpufleet.orchestrator.model.WorkerToken;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WatchDogJobTest {

    private FleetFixture fleet;
    private WatchDogJob watchDog;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-watchdog");
        watchDog = fleet.watchDogJob();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void detectsInstanceDeletedOutOfBand() {
        Instance ready = fleet.readyInstance("llama");
        fleet.deps.workerService().registerWorker(ready.id(), "llama", 8000, 8080, null, null, ready.ipAddress());

        fleet.deps.mockProvider().deleteOutOfBand(ready.providerInstanceId());
        assertEquals(1, watchDog.runOnce());

        Instance terminated = fleet.reload(ready.id());
        assertEquals(InstanceStatus.TERMINATED, terminated.status());
        assertTrue(terminated.deletedByProvider());
        assertEquals(WatchDogJob.PROVIDER_DELETED, terminated.deletionReason());

        WorkerToken token = fleet.deps.tokenRepository().findByInstance(ready.id()).orElseThrow();
        assertNotNull(token.revokedAt());
    }

    @Test
    void recordsVolumesOfLiveInstances() {
        Instance ready = fleet.readyInstance("llama");

        assertEquals(0, watchDog.runOnce());

        assertEquals(InstanceStatus.READY, fleet.reload(ready.id()).status());
        List<InstanceVolume> volumes = fleet.deps.volumeRepository().findByInstance(ready.id());
        assertEquals(1, volumes.size());
        assertTrue(volumes.get(0).boot());
    }

    @Test
    void drainingInstancesAreWatchedToo() {
        Instance ready = fleet.readyInstance("llama");
        fleet.deps.instanceService().drain(ready.id());
        fleet.deps.mockProvider().deleteOutOfBand(ready.providerInstanceId());

        assertEquals(1, watchDog.runOnce());
        assertEquals(InstanceStatus.TERMINATED, fleet.reload(ready.id()).status());
    }

    @Test
    void provisioningRowsAreLeftAlone() {
        Instance booting = fleet.bootingInstance("llama");
        fleet.deps.mockProvider().deleteOutOfBand(booting.providerInstanceId());

        fleet.clock.advance(Duration.ofMinutes(2));
        assertEquals(0, watchDog.runOnce());
        assertEquals(InstanceStatus.BOOTING, fleet.reload(booting.id()).status());
    }
}
