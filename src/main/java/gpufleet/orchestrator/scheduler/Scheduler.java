package gpufleet.orchestrator.scheduler;

import gpufleet.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the reconciliation jobs on fixed-delay timers:
 * - health-check: advances coming-up instances, fails timed-out ones
 * - terminator: tears down terminating instances
 * - watch-dog: detects instances deleted at the provider
 * - provisioning-requeue: retries provisioning rows whose command was lost
 * - recovery: force-moves rows stuck past their timeout
 * - volume-reconciliation: deletes volumes left behind by terminated instances
 *
 * Replicas coordinate through row claims in the database, not here.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<ReconciliationJob, Duration> jobs = new LinkedHashMap<>();

    private volatile boolean running = false;

    public Scheduler(HealthCheckJob healthCheck, TerminatorJob terminator, WatchDogJob watchDog,
            ProvisioningRequeueJob requeue, RecoveryJob recovery, VolumeReconciliationJob volumeReconciliation,
            OrchestratorConfig config) {
        this(timers(healthCheck, terminator, watchDog, requeue, recovery, volumeReconciliation, config));
    }

    /**
     * One thread per job, so a job blocked on a slow provider call never delays the others.
     */
    Scheduler(Map<ReconciliationJob, Duration> jobs) {
        this.jobs.putAll(jobs);
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(Math.max(1, jobs.size()), r -> {
            Thread t = new Thread(r, "gpufleet-scheduler-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static Map<ReconciliationJob, Duration> timers(HealthCheckJob healthCheck, TerminatorJob terminator,
            WatchDogJob watchDog, ProvisioningRequeueJob requeue, RecoveryJob recovery,
            VolumeReconciliationJob volumeReconciliation, OrchestratorConfig config) {
        Map<ReconciliationJob, Duration> jobs = new LinkedHashMap<>();
        jobs.put(healthCheck, config.healthCheckInterval());
        jobs.put(terminator, config.terminatorInterval());
        jobs.put(watchDog, config.watchDogInterval());
        jobs.put(requeue, config.requeueInterval());
        jobs.put(recovery, config.recoveryInterval());
        jobs.put(volumeReconciliation, config.volumeSweepInterval());
        return jobs;
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        for (Map.Entry<ReconciliationJob, Duration> entry : jobs.entrySet()) {
            long intervalMs = entry.getValue().toMillis();
            executor.scheduleWithFixedDelay(entry.getKey(), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("{} scheduled every {}ms", entry.getKey().name(), intervalMs);
        }

        log.info("Scheduler started");
    }

    /**
     * Run one pass of every job on the calling thread.
     *
     * @return rows acted on, summed over all jobs
     */
    public int runAllOnce() {
        int total = 0;
        for (ReconciliationJob job : jobs.keySet()) {
            try {
                total += job.runOnce();
            } catch (Exception e) {
                log.error("{} error", job.name(), e);
            }
        }
        return total;
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            executor.shutdownNow();
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }
}
