package gpufleet.orchestrator;

import gpufleet.orchestrator.config.OrchestratorConfig;

import java.time.Duration;

/**
 * Config presets for tests: private in-memory H2, no IP polling delay.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static String h2Url(String name) {
        return "jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public static OrchestratorConfig config(String name, MutableClock clock) {
        return OrchestratorConfig.defaults()
                .withDatabaseUrl(h2Url(name))
                .withIpPolling(1, Duration.ZERO)
                .withClock(clock);
    }
}
