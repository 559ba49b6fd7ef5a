package gpufleet.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One reconciliation loop: claim a batch, process each row, persist results.
 * A tick never throws, so a bad tick cannot cancel its timer.
 */
public abstract class ReconciliationJob implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    public abstract String name();

    /**
     * Run one pass.
     *
     * @return number of rows acted on
     */
    public abstract int runOnce();

    @Override
    public void run() {
        try {
            int processed = runOnce();
            if (processed > 0) {
                log.debug("{}: processed {} instance(s)", name(), processed);
            }
        } catch (Exception e) {
            log.error("{} error", name(), e);
        }
    }
}
