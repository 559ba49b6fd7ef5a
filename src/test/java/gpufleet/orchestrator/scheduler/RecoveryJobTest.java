package gpufleet.orchestrator.scheduler;

import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryJobTest {

    private FleetFixture fleet;
    private RecoveryJob recovery;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-recovery");
        recovery = fleet.recoveryJob();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void nothingToDoBeforeTimeouts() {
        fleet.bootingInstance("llama");
        fleet.clock.advance(Duration.ofMinutes(90));

        assertEquals(0, recovery.runOnce());
    }

    @Test
    void stuckBootingBecomesStartupFailed() {
        Instance booting = fleet.bootingInstance("llama");
        fleet.clock.advance(Duration.ofHours(3));

        assertEquals(1, recovery.runOnce());

        Instance failed = fleet.reload(booting.id());
        assertEquals(InstanceStatus.STARTUP_FAILED, failed.status());
        assertEquals(RecoveryJob.RECOVERY_TIMEOUT, failed.errorCode());
    }

    @Test
    void stuckProvisioningBecomesProvisioningFailed() {
        Instance requested = fleet.deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");
        fleet.clock.advance(Duration.ofMinutes(31));

        assertEquals(1, recovery.runOnce());
        assertEquals(InstanceStatus.PROVISIONING_FAILED, fleet.reload(requested.id()).status());
    }

    @Test
    void stuckDrainingMovesToTerminatingThenFailed() {
        Instance ready = fleet.readyInstance("llama");
        fleet.deps.instanceService().drain(ready.id());

        fleet.clock.advance(Duration.ofMinutes(61));
        assertEquals(1, recovery.runOnce());
        assertEquals(InstanceStatus.TERMINATING, fleet.reload(ready.id()).status());

        fleet.clock.advance(Duration.ofMinutes(121));
        assertEquals(1, recovery.runOnce());

        Instance failed = fleet.reload(ready.id());
        assertEquals(InstanceStatus.FAILED, failed.status());
        assertEquals(RecoveryJob.RECOVERY_TIMEOUT, failed.errorCode());
    }

    @Test
    void readyInstancesAreNeverRecovered() {
        Instance ready = fleet.readyInstance("llama");
        fleet.clock.advance(Duration.ofDays(2));

        assertEquals(0, recovery.runOnce());
        assertEquals(InstanceStatus.READY, fleet.reload(ready.id()).status());
    }
}
