package gpufleet;

import gpufleet.orchestrator.config.Dependencies;
import gpufleet.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Orchestrator entry point. Runs the HTTP API, command dispatcher and reconciliation jobs until
 * the JVM is asked to stop.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping orchestrator...");
            deps.close();
            stopped.countDown();
        }, "gpufleet-shutdown"));

        try {
            deps.start();
        } catch (RuntimeException e) {
            log.error("Failed to start orchestrator", e);
            deps.close();
            System.exit(1);
        }

        log.info("Orchestrator started on port {}", deps.server().port());
        stopped.await();
    }
}
