package gpufleet.orchestrator.scheduler;

import gpufleet.cloud.mock.MockCloudProvider;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.InstanceVolume;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.service.TerminationService;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TerminatorJobTest {

    private static final long GB = 1024L * 1024 * 1024;

    private FleetFixture fleet;
    private TerminatorJob terminator;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-terminator");
        terminator = fleet.terminatorJob();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void deletesOnlyVolumesFlaggedForDeletion() {
        Instance ready = fleet.readyInstance("llama");
        MockCloudProvider mock = fleet.deps.mockProvider();
        String keep = mock.attachVolume(ready.providerInstanceId(), 500 * GB, false);

        assertEquals(TransitionResult.APPLIED,
                fleet.deps.instanceService().requestTermination(ready.id(), "terminate_requested"));
        assertEquals(1, terminator.runOnce());

        Instance terminated = fleet.reload(ready.id());
        assertEquals(InstanceStatus.TERMINATED, terminated.status());
        assertEquals("terminate_requested", terminated.deletionReason());
        assertFalse(mock.exists(ready.providerInstanceId()));

        List<InstanceVolume> volumes = fleet.deps.volumeRepository().findByInstance(ready.id());
        assertEquals(2, volumes.size());
        for (InstanceVolume volume : volumes) {
            if (volume.providerVolumeId().equals(keep)) {
                assertFalse(volume.isDeleted());
                assertTrue(mock.volumeExists(keep));
            } else {
                assertTrue(volume.boot());
                assertTrue(volume.isDeleted());
                assertFalse(mock.volumeExists(volume.providerVolumeId()));
            }
        }
    }

    @Test
    void transientDeleteFailureIsRetriedOnLaterTick() {
        Instance ready = fleet.readyInstance("llama");
        fleet.deps.mockProvider().failNext(MockCloudProvider.Operation.DELETE, ProviderException.Kind.TRANSIENT, 1);
        fleet.deps.instanceService().requestTermination(ready.id(), "terminate_requested");

        assertEquals(0, terminator.runOnce());
        Instance pending = fleet.reload(ready.id());
        assertEquals(InstanceStatus.TERMINATING, pending.status());
        assertEquals(1, pending.terminationAttempts());

        assertEquals(0, terminator.runOnce(), "row is still leased");

        fleet.clock.advance(Duration.ofSeconds(31));
        assertEquals(1, terminator.runOnce());
        assertEquals(InstanceStatus.TERMINATED, fleet.reload(ready.id()).status());
    }

    @Test
    void repeatedFailuresAskForManualIntervention() {
        fleet.deps.config().withTerminatorMaxAttempts(2);
        Instance ready = fleet.readyInstance("llama");
        fleet.deps.mockProvider().failNext(MockCloudProvider.Operation.DELETE, ProviderException.Kind.TRANSIENT, 5);
        fleet.deps.instanceService().requestTermination(ready.id(), "terminate_requested");

        terminator.runOnce();
        fleet.clock.advance(Duration.ofSeconds(31));
        terminator.runOnce();

        Instance stuck = fleet.reload(ready.id());
        assertEquals(InstanceStatus.TERMINATING, stuck.status());
        assertEquals(TerminationService.MANUAL_INTERVENTION, stuck.errorCode());

        fleet.clock.advance(Duration.ofSeconds(31));
        assertEquals(0, terminator.runOnce());
        assertEquals(2, fleet.reload(ready.id()).terminationAttempts());
    }

    @Test
    void instanceWithoutProviderResourceTerminatesDirectly() {
        Instance requested = fleet.deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");
        fleet.deps.instanceService().requestTermination(requested.id(), "terminate_requested");

        assertEquals(1, terminator.runOnce());

        Instance terminated = fleet.reload(requested.id());
        assertEquals(InstanceStatus.TERMINATED, terminated.status());
        assertEquals("no_provider_resource", terminated.deletionReason());
        assertEquals(0, fleet.deps.mockProvider().deleteCalls());
    }
}
