package gpufleet.orchestrator.service;

import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.bus.CommandBus;
import gpufleet.orchestrator.bus.CommandCodec;
import gpufleet.orchestrator.bus.Command;
import gpufleet.orchestrator.bus.CommandType;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.TransitionResult;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InstanceServiceTest {

    private FleetFixture fleet;
    private InstanceService service;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-instance-service");
        service = fleet.deps.instanceService();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void createInsertsRowAndPublishesProvision() throws InterruptedException {
        CommandBus.Subscription sub = fleet.deps.commandBus().subscribe(fleet.deps.config().commandChannel());

        Instance created = service.create(null, "zone-a", "MOCK-GPU-S", "llama");

        assertEquals(InstanceStatus.PROVISIONING, created.status());
        assertEquals("mock", created.provider());
        assertEquals(5, service.progress(created));
        assertTrue(fleet.deps.actionLogRepository().completedActions(created.id())
                .contains(ActionType.REQUEST_CREATE));

        Command published = CommandCodec.decode(sub.poll(Duration.ofSeconds(1))).orElseThrow();
        assertEquals(CommandType.PROVISION, published.type());
        assertEquals(created.id(), published.instanceId());
        assertNotNull(published.correlationId());
        sub.close();
    }

    @Test
    void createNeedsPlacement() {
        assertThrows(IllegalArgumentException.class, () -> service.create("mock", "", "MOCK-GPU-S", null));
        assertThrows(IllegalArgumentException.class, () -> service.create("mock", "zone-a", null, null));
    }

    @Test
    void requestTerminationOutcomes() {
        Instance ready = fleet.readyInstance("llama");

        assertEquals(TransitionResult.APPLIED, service.requestTermination(ready.id(), "user_request"));
        assertEquals(TransitionResult.SKIPPED, service.requestTermination(ready.id(), "user_request"));
        assertEquals(TransitionResult.NOT_FOUND, service.requestTermination("missing", "user_request"));

        Instance terminating = fleet.reload(ready.id());
        assertEquals(InstanceStatus.TERMINATING, terminating.status());
        assertEquals("user_request", terminating.deletionReason());

        fleet.terminatorJob().runOnce();
        assertEquals(TransitionResult.REJECTED, service.requestTermination(ready.id(), "user_request"));
    }

    @Test
    void drainOnlyFromReady() {
        Instance booting = fleet.bootingInstance("llama");
        assertNotEquals(TransitionResult.APPLIED, service.drain(booting.id()));
        assertEquals(InstanceStatus.BOOTING, fleet.reload(booting.id()).status());

        Instance ready = fleet.readyInstance("llama");
        assertEquals(TransitionResult.APPLIED, service.drain(ready.id()));
        assertEquals(InstanceStatus.DRAINING, fleet.reload(ready.id()).status());
    }

    @Test
    void archivedInstancesAreFinal() {
        Instance ready = fleet.readyInstance("llama");
        service.requestTermination(ready.id(), "user_request");
        fleet.terminatorJob().runOnce();

        assertEquals(TransitionResult.APPLIED, service.archive(ready.id()));
        Instance archived = fleet.reload(ready.id());
        assertEquals(InstanceStatus.ARCHIVED, archived.status());
        assertTrue(archived.isArchived());

        assertEquals(TransitionResult.REJECTED, service.requestTermination(ready.id(), "again"));
        assertEquals(TransitionResult.REJECTED, service.reinstall(ready.id()));
    }

    @Test
    void readyInstanceCannotBeArchived() {
        Instance ready = fleet.readyInstance("llama");

        assertEquals(TransitionResult.REJECTED, service.archive(ready.id()));
    }

    @Test
    void historyRecordsEveryStep() {
        Instance ready = fleet.readyInstance("llama");

        assertEquals(5, service.history(ready.id()).size());
        assertEquals("ready", service.history(ready.id()).get(4).toStatus().dbValue());
        assertFalse(service.actions(ready.id()).isEmpty());
    }

    @Test
    void volumesAppearOnceWatchDogRecordsThem() {
        Instance ready = fleet.readyInstance("llama");
        assertTrue(service.volumes(ready.id()).isEmpty());

        fleet.watchDogJob().runOnce();

        assertEquals(1, service.volumes(ready.id()).size());
        assertTrue(service.volumes(ready.id()).get(0).deleteOnTerminate());
    }
}
