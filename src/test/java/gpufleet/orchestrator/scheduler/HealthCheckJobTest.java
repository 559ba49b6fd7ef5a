package gpufleet.orchestrator.scheduler;

import gpufleet.cloud.mock.MockCloudProvider;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.service.ProvisioningService;
import gpufleet.orchestrator.service.WorkerService;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckJobTest {

    private FleetFixture fleet;
    private HealthCheckJob healthCheck;
    private WorkerService workers;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-health-check");
        healthCheck = fleet.healthCheckJob();
        workers = fleet.deps.workerService();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void probesAdvanceOnePhasePerTick() {
        Instance booting = fleet.bootingInstance("llama");

        healthCheck.runOnce();
        assertEquals(InstanceStatus.INSTALLING, fleet.reload(booting.id()).status());
        healthCheck.runOnce();
        assertEquals(InstanceStatus.STARTING, fleet.reload(booting.id()).status());
        healthCheck.runOnce();

        Instance ready = fleet.reload(booting.id());
        assertEquals(InstanceStatus.READY, ready.status());
        assertNotNull(ready.readyAt());
        assertNotNull(ready.lastHealthCheck());
    }

    @Test
    void freshHeartbeatIsTrustedOverProbes() {
        fleet.deps.mockProvider().setWorkersHealthyByDefault(false);
        Instance booting = fleet.bootingInstance("llama");

        for (int i = 0; i < 3; i++) {
            workers.reportHeartbeat(booting.id(), "ready", "llama", 0, 12.5, null);
            healthCheck.runOnce();
        }

        assertEquals(InstanceStatus.READY, fleet.reload(booting.id()).status());
        Set<ActionType> done = fleet.deps.actionLogRepository().completedActions(booting.id());
        assertTrue(done.contains(ActionType.WORKER_WARMUP));
        assertEquals(100, fleet.deps.instanceService().progress(fleet.reload(booting.id())));
    }

    @Test
    void unhealthyWorkerTimesOutIntoStartupFailed() {
        fleet.deps.mockProvider().setWorkersHealthyByDefault(false);
        Instance booting = fleet.bootingInstance("llama");

        healthCheck.runOnce();
        assertEquals(InstanceStatus.INSTALLING, fleet.reload(booting.id()).status());

        healthCheck.runOnce();
        Instance installing = fleet.reload(booting.id());
        assertEquals(InstanceStatus.INSTALLING, installing.status());
        assertEquals(1, installing.healthCheckFailures());

        fleet.clock.advance(Duration.ofMinutes(61));
        healthCheck.runOnce();

        Instance failed = fleet.reload(booting.id());
        assertEquals(InstanceStatus.STARTUP_FAILED, failed.status());
        assertEquals("INSTALL_TIMEOUT", failed.errorCode());
        assertTrue(fleet.deps.actionLogRepository().findByInstance(booting.id()).stream()
                .anyMatch(a -> a.action() == ActionType.HEALTH_CHECK_FAIL && !a.isSuccess()));
    }

    @Test
    void lateHeartbeatRevivesStartupFailedUpToCap() {
        fleet.deps.config().withStartupRetryCap(1);
        fleet.deps.mockProvider().setWorkersHealthyByDefault(false);
        Instance booting = fleet.bootingInstance("llama");
        healthCheck.runOnce();
        fleet.clock.advance(Duration.ofMinutes(61));
        healthCheck.runOnce();
        assertEquals(InstanceStatus.STARTUP_FAILED, fleet.reload(booting.id()).status());

        // no heartbeat, nothing to revive
        healthCheck.runOnce();
        assertEquals(InstanceStatus.STARTUP_FAILED, fleet.reload(booting.id()).status());

        workers.reportHeartbeat(booting.id(), "loading", "llama", 0, null, null);
        healthCheck.runOnce();

        Instance revived = fleet.reload(booting.id());
        assertEquals(InstanceStatus.BOOTING, revived.status());
        assertEquals(1, revived.retryCount());
        assertNull(revived.errorCode());

        // second failure stays failed, the cap is reached
        fleet.clock.advance(Duration.ofHours(3));
        workers.reportHeartbeat(booting.id(), "loading", "llama", 0, null, null);
        fleet.recoveryJob().runOnce();
        assertEquals(InstanceStatus.STARTUP_FAILED, fleet.reload(booting.id()).status());
        workers.reportHeartbeat(booting.id(), "loading", "llama", 0, null, null);
        healthCheck.runOnce();
        assertEquals(InstanceStatus.STARTUP_FAILED, fleet.reload(booting.id()).status());
    }

    @Test
    void provisioningRetriesDoNotConsumeSelfHealBudget() {
        fleet.deps.config().withStartupRetryCap(2);
        fleet.deps.mockProvider().setWorkersHealthyByDefault(false);
        fleet.deps.mockProvider().failNext(MockCloudProvider.Operation.CREATE, ProviderException.Kind.TRANSIENT, 2);

        String id = "retried-" + System.nanoTime();
        ProvisioningService provisioning = fleet.deps.provisioningService();
        assertEquals(ProvisioningService.Outcome.RETRY_PENDING,
                provisioning.provision(id, "mock", "zone-a", "MOCK-GPU-S", "llama"));
        assertEquals(ProvisioningService.Outcome.RETRY_PENDING, provisioning.resume(fleet.reload(id)));
        assertEquals(2, fleet.reload(id).retryCount());
        assertEquals(ProvisioningService.Outcome.BOOTING, provisioning.resume(fleet.reload(id)));

        Instance booting = fleet.reload(id);
        assertEquals(InstanceStatus.BOOTING, booting.status());
        assertEquals(0, booting.retryCount());

        healthCheck.runOnce();
        fleet.clock.advance(Duration.ofMinutes(61));
        healthCheck.runOnce();
        assertEquals(InstanceStatus.STARTUP_FAILED, fleet.reload(id).status());

        workers.reportHeartbeat(id, "loading", "llama", 0, null, null);
        healthCheck.runOnce();

        Instance revived = fleet.reload(id);
        assertEquals(InstanceStatus.BOOTING, revived.status());
        assertEquals(1, revived.retryCount());
    }
}
