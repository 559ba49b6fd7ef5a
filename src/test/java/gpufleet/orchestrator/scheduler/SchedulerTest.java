package gpufleet.orchestrator.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    /**
     * Blocks inside its tick until released, like a job stuck in a provider operation.
     */
    private static final class BlockingJob extends ReconciliationJob {
        private final String name;
        private final CountDownLatch started;
        private final CountDownLatch release;

        BlockingJob(String name, CountDownLatch started, CountDownLatch release) {
            this.name = name;
            this.started = started;
            this.release = release;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int runOnce() {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 0;
        }
    }

    @Test
    void blockedJobsDoNotStarveTheOthers() throws Exception {
        CountDownLatch started = new CountDownLatch(5);
        CountDownLatch release = new CountDownLatch(1);
        Map<ReconciliationJob, Duration> jobs = new LinkedHashMap<>();
        for (String name : new String[] {"health-check", "terminator", "watch-dog", "provisioning-requeue", "recovery"}) {
            jobs.put(new BlockingJob(name, started, release), Duration.ofMillis(10));
        }

        Scheduler scheduler = new Scheduler(jobs);
        try {
            scheduler.start();
            assertTrue(started.await(5, TimeUnit.SECONDS), "every job should be running at the same time");
        } finally {
            release.countDown();
            scheduler.stop();
        }
        assertFalse(scheduler.isRunning());
    }
}
