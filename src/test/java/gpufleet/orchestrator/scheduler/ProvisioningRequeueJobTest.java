package gpufleet.orchestrator.scheduler;

import gpufleet.cloud.mock.MockCloudProvider;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.MutableClock;
import gpufleet.orchestrator.TestConfigs;
import gpufleet.orchestrator.config.Dependencies;
import gpufleet.orchestrator.health.MockWorkerProbe;
import gpufleet.orchestrator.health.WorkerProbes;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A PROVISION command nobody received is picked up by the requeue job.
 */
class ProvisioningRequeueJobTest {

    private MutableClock clock;
    private Dependencies deps;
    private ProvisioningRequeueJob requeue;
    private HealthCheckJob healthCheck;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        deps = Dependencies.create(TestConfigs.config("test-requeue", clock));
        requeue = new ProvisioningRequeueJob(deps.instanceRepository(), deps.provisioningService(), deps.config());
        healthCheck = new HealthCheckJob(deps.instanceRepository(), deps.actionLogRepository(),
                deps.stateMachine(), deps.providers(),
                new WorkerProbes(new MockWorkerProbe(deps.mockProvider())), deps.config());
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    void droppedProvisionReachesReadyThroughJobs() {
        // no dispatcher subscribed, the command is dropped
        Instance created = deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");
        assertEquals(InstanceStatus.PROVISIONING, created.status());

        assertEquals(0, requeue.runOnce(), "too young to requeue");

        clock.advance(Duration.ofSeconds(31));
        assertEquals(1, requeue.runOnce());

        Instance booting = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.BOOTING, booting.status());
        assertNotNull(booting.providerInstanceId());
        assertNotNull(booting.ipAddress());
        assertEquals(1, deps.mockProvider().createCalls());

        for (int i = 0; i < 3; i++) {
            healthCheck.runOnce();
        }

        Instance ready = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.READY, ready.status());
        assertEquals(100, deps.instanceService().progress(ready));

        Set<ActionType> done = deps.actionLogRepository().completedActions(created.id());
        assertTrue(done.containsAll(Set.of(ActionType.REQUEST_CREATE, ActionType.PROVIDER_CREATE,
                ActionType.PROVIDER_START, ActionType.PROVIDER_GET_IP, ActionType.WORKER_INSTALL,
                ActionType.WORKER_HTTP_READY, ActionType.WORKER_MODEL_LOADED, ActionType.HEALTH_CHECK_PASS)));
    }

    @Test
    void transientCreateFailureIsRetried() {
        deps.mockProvider().failNext(MockCloudProvider.Operation.CREATE, ProviderException.Kind.TRANSIENT, 1);
        Instance created = deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");

        clock.advance(Duration.ofSeconds(31));
        assertEquals(0, requeue.runOnce());

        Instance pending = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.PROVISIONING, pending.status());
        assertEquals(1, pending.retryCount());
        assertNotNull(pending.errorCode());

        clock.advance(Duration.ofSeconds(31));
        assertEquals(1, requeue.runOnce());

        Instance booting = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.BOOTING, booting.status());
        assertNull(booting.errorCode());
    }

    @Test
    void permanentCreateFailureFailsImmediately() {
        Instance created = deps.instanceService().create("mock", "zone-a", "NO-SUCH-TYPE", "llama");

        clock.advance(Duration.ofSeconds(31));
        assertEquals(1, requeue.runOnce());

        Instance failed = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.PROVISIONING_FAILED, failed.status());
        assertEquals("INVALID_INSTANCE_TYPE", failed.errorCode());
        assertEquals(0, deps.instanceService().progress(failed));
    }

    @Test
    void exhaustedRetriesAreNotClaimedAgain() {
        deps.config().withRequeueMaxRetries(2);
        deps.mockProvider().failNext(MockCloudProvider.Operation.CREATE, ProviderException.Kind.TRANSIENT, 5);
        Instance created = deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");

        clock.advance(Duration.ofSeconds(31));
        requeue.runOnce();
        clock.advance(Duration.ofSeconds(31));
        requeue.runOnce();

        Instance failed = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.PROVISIONING_FAILED, failed.status());
        assertEquals(2, failed.retryCount());
    }

    @Test
    void createdInstanceIdSurvivesFailedStart() {
        deps.mockProvider().failNext(MockCloudProvider.Operation.START, ProviderException.Kind.TRANSIENT, 1);
        Instance created = deps.instanceService().create("mock", "zone-a", "MOCK-GPU-S", "llama");

        clock.advance(Duration.ofSeconds(31));
        assertEquals(0, requeue.runOnce());

        Instance pending = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.PROVISIONING, pending.status());
        assertNotNull(pending.providerInstanceId(), "id is stored before the instance is started");
        String providerId = pending.providerInstanceId();

        clock.advance(Duration.ofSeconds(31));
        assertEquals(1, requeue.runOnce());

        Instance booting = deps.instanceRepository().findById(created.id()).orElseThrow();
        assertEquals(InstanceStatus.BOOTING, booting.status());
        assertEquals(providerId, booting.providerInstanceId());
        assertEquals(1, deps.mockProvider().createCalls());
        assertEquals(1, deps.mockProvider().instanceCount());
    }
}
