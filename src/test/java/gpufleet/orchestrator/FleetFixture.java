package gpufleet.orchestrator;

import gpufleet.orchestrator.config.Dependencies;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.health.MockWorkerProbe;
import gpufleet.orchestrator.health.WorkerProbes;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.scheduler.HealthCheckJob;
import gpufleet.orchestrator.scheduler.RecoveryJob;
import gpufleet.orchestrator.scheduler.TerminatorJob;
import gpufleet.orchestrator.scheduler.VolumeReconciliationJob;
import gpufleet.orchestrator.scheduler.WatchDogJob;

import java.util.UUID;

/**
 * Orchestrator wired against the mock provider with a hand-driven clock. Jobs are run explicitly.
 */
public final class FleetFixture implements AutoCloseable {

    public final MutableClock clock;
    public final Dependencies deps;

    public FleetFixture(String name) {
        this(name, MutableClock.startingAt("2026-01-01T00:00:00Z"));
    }

    private FleetFixture(String name, MutableClock clock) {
        this(TestConfigs.config(name, clock), clock);
    }

    public FleetFixture(OrchestratorConfig config, MutableClock clock) {
        this.clock = clock;
        this.deps = Dependencies.create(config);
    }

    public HealthCheckJob healthCheckJob() {
        return new HealthCheckJob(deps.instanceRepository(), deps.actionLogRepository(), deps.stateMachine(),
                deps.providers(), new WorkerProbes(new MockWorkerProbe(deps.mockProvider())), deps.config());
    }

    public TerminatorJob terminatorJob() {
        return new TerminatorJob(deps.instanceRepository(), deps.terminationService(), deps.config());
    }

    public WatchDogJob watchDogJob() {
        return new WatchDogJob(deps.instanceRepository(), deps.volumeRepository(), deps.tokenRepository(),
                deps.actionLogRepository(), deps.stateMachine(), deps.providers(), deps.config());
    }

    public RecoveryJob recoveryJob() {
        return new RecoveryJob(deps.instanceRepository(), deps.config());
    }

    public VolumeReconciliationJob volumeReconciliationJob() {
        return new VolumeReconciliationJob(deps.instanceRepository(), deps.volumeRepository(),
                deps.terminationService(), deps.providers(), deps.config());
    }

    /**
     * Provision on the mock provider, leaving the row in booting.
     */
    public Instance bootingInstance(String modelId) {
        String id = UUID.randomUUID().toString();
        deps.provisioningService().provision(id, "mock", "zone-a", "MOCK-GPU-S", modelId);
        return reload(id);
    }

    /**
     * Provision and run health checks until the row is ready.
     */
    public Instance readyInstance(String modelId) {
        Instance instance = bootingInstance(modelId);
        HealthCheckJob healthCheck = healthCheckJob();
        for (int i = 0; i < 3; i++) {
            healthCheck.runOnce();
        }
        Instance ready = reload(instance.id());
        if (ready.status() != InstanceStatus.READY) {
            throw new IllegalStateException("Instance did not reach ready: " + ready);
        }
        return ready;
    }

    public Instance reload(String instanceId) {
        return deps.instanceRepository().findById(instanceId).orElseThrow();
    }

    @Override
    public void close() {
        deps.close();
    }
}
