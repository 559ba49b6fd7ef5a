package gpufleet.orchestrator.service;

import gpufleet.cloud.mock.MockCloudProvider;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.bus.Command;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import org.junit.jupiter.api.*;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest {

    private FleetFixture fleet;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-dispatcher");
        dispatcher = fleet.deps.dispatcher();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void provisionCreatesRowAndBoots() {
        String id = UUID.randomUUID().toString();

        dispatcher.dispatch(Command.provision(id, "mock", "zone-a", "MOCK-GPU-S", "llama"));

        Instance instance = fleet.reload(id);
        assertEquals(InstanceStatus.BOOTING, instance.status());
        assertNotNull(instance.providerInstanceId());
        assertNotNull(instance.ipAddress());
        assertEquals(1, fleet.deps.mockProvider().createCalls());
        assertEquals(1, dispatcher.handledCount());
    }

    @Test
    void duplicateProvisionDoesNotCreateTwice() {
        String id = UUID.randomUUID().toString();
        Command command = Command.provision(id, "mock", "zone-a", "MOCK-GPU-S", "llama");

        dispatcher.dispatch(command);
        dispatcher.dispatch(command);

        assertEquals(1, fleet.deps.mockProvider().createCalls());
        assertEquals(InstanceStatus.BOOTING, fleet.reload(id).status());
    }

    @Test
    void provisionWithoutRowOrPlacementIsIgnored() {
        dispatcher.dispatch(Command.provision("ghost", null, null, null, null));

        assertTrue(fleet.deps.instanceRepository().findById("ghost").isEmpty());
        assertEquals(0, fleet.deps.mockProvider().createCalls());
    }

    @Test
    void terminateRunsTeardownImmediately() {
        Instance ready = fleet.readyInstance("llama");

        dispatcher.dispatch(Command.terminate(ready.id()));

        Instance terminated = fleet.reload(ready.id());
        assertEquals(InstanceStatus.TERMINATED, terminated.status());
        assertEquals("terminate_requested", terminated.deletionReason());
        assertFalse(fleet.deps.mockProvider().exists(ready.providerInstanceId()));
    }

    @Test
    void terminateWithProviderFailureLeavesRowTerminating() {
        Instance ready = fleet.readyInstance("llama");
        fleet.deps.mockProvider().failNext(MockCloudProvider.Operation.DELETE, ProviderException.Kind.TRANSIENT, 1);

        dispatcher.dispatch(Command.terminate(ready.id()));

        Instance terminating = fleet.reload(ready.id());
        assertEquals(InstanceStatus.TERMINATING, terminating.status());
        assertEquals(1, terminating.terminationAttempts());
    }

    @Test
    void terminateOfTerminalInstanceIsIgnored() {
        Instance ready = fleet.readyInstance("llama");
        dispatcher.dispatch(Command.terminate(ready.id()));
        int deletes = fleet.deps.mockProvider().deleteCalls();

        dispatcher.dispatch(Command.terminate(ready.id()));

        assertEquals(deletes, fleet.deps.mockProvider().deleteCalls());
        assertEquals(InstanceStatus.TERMINATED, fleet.reload(ready.id()).status());
    }

    @Test
    void reinstallSendsReadyInstanceBackToInstalling() {
        Instance ready = fleet.readyInstance("llama");
        fleet.deps.workerService().reportHeartbeat(ready.id(), "ready", "llama", 3, 50.0, null);

        dispatcher.dispatch(Command.reinstall(ready.id()));

        Instance installing = fleet.reload(ready.id());
        assertEquals(InstanceStatus.INSTALLING, installing.status());
        assertNull(installing.workerStatus());
        assertNull(installing.workerLastHeartbeat());
        assertTrue(fleet.deps.actionLogRepository().completedActions(ready.id()).contains(ActionType.REINSTALL));
    }

    @Test
    void reinstallOfBootingInstanceIsRejected() {
        Instance booting = fleet.bootingInstance("llama");

        dispatcher.dispatch(Command.reinstall(booting.id()));

        assertEquals(InstanceStatus.BOOTING, fleet.reload(booting.id()).status());
    }

    @Test
    void syncCatalogStoresMockOffers() {
        dispatcher.dispatch(Command.syncCatalog("mock"));

        assertFalse(fleet.deps.catalogService().list("mock").isEmpty());
        assertTrue(fleet.deps.catalogService().list("mock").stream()
                .anyMatch(e -> e.code().equals("MOCK-4GPU-M") && e.gpuCount() == 4));
    }

    @Test
    void syncCatalogForUnknownProviderCountsAsFailure() {
        dispatcher.dispatch(Command.syncCatalog("nimbus"));

        assertEquals(1, dispatcher.failedCount());
    }

    @Test
    void reconcileRunsEveryJobOnce() {
        Instance booting = fleet.bootingInstance("llama");

        dispatcher.dispatch(Command.reconcile());

        assertEquals(InstanceStatus.INSTALLING, fleet.reload(booting.id()).status());
    }

    @Test
    void publishedCommandIsConsumedAfterStart() throws InterruptedException {
        dispatcher.start();
        try {
            Instance created = fleet.deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");

            long deadline = System.currentTimeMillis() + 10_000;
            while (fleet.reload(created.id()).status() == InstanceStatus.PROVISIONING
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertEquals(InstanceStatus.BOOTING, fleet.reload(created.id()).status());
        } finally {
            dispatcher.stop();
        }
        assertFalse(dispatcher.isRunning());
    }

    @Test
    void commandPublishedWithoutDispatcherIsLost() {
        Instance created = fleet.deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");

        assertEquals(InstanceStatus.PROVISIONING, fleet.reload(created.id()).status());
        assertEquals(0, fleet.deps.mockProvider().createCalls());
    }
}
