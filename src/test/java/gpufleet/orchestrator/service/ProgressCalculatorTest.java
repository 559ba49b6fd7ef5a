package gpufleet.orchestrator.service;

import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.InstanceStatus;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProgressCalculatorTest {

    @Test
    void requestedAndCreated() {
        assertEquals(5, ProgressCalculator.progress(InstanceStatus.PROVISIONING, Set.of()));
        assertEquals(20, ProgressCalculator.progress(InstanceStatus.PROVISIONING,
                EnumSet.of(ActionType.REQUEST_CREATE, ActionType.PROVIDER_CREATE)));
    }

    @Test
    void comingUpUsesBestMilestone() {
        assertEquals(20, ProgressCalculator.progress(InstanceStatus.BOOTING, Set.of()));
        assertEquals(40, ProgressCalculator.progress(InstanceStatus.BOOTING,
                EnumSet.of(ActionType.PROVIDER_CREATE, ActionType.PROVIDER_START, ActionType.PROVIDER_GET_IP)));
        assertEquals(75, ProgressCalculator.progress(InstanceStatus.STARTING,
                EnumSet.of(ActionType.WORKER_INSTALL, ActionType.WORKER_MODEL_LOADED)));
        assertEquals(95, ProgressCalculator.progress(InstanceStatus.STARTING,
                EnumSet.of(ActionType.HEALTH_CHECK_PASS)));
    }

    @Test
    void readyIsComplete() {
        assertEquals(100, ProgressCalculator.progress(InstanceStatus.READY, Set.of()));
    }

    @Test
    void failedAndTerminalStatusesReportZero() {
        EnumSet<ActionType> all = EnumSet.allOf(ActionType.class);
        for (InstanceStatus status : List.of(InstanceStatus.PROVISIONING_FAILED, InstanceStatus.STARTUP_FAILED,
                InstanceStatus.FAILED, InstanceStatus.TERMINATING, InstanceStatus.TERMINATED,
                InstanceStatus.ARCHIVED, InstanceStatus.DRAINING)) {
            assertEquals(0, ProgressCalculator.progress(status, all), status.toString());
        }
    }

    @Test
    void progressNeverDecreasesAlongHappyPath() {
        List<InstanceStatus> path = List.of(InstanceStatus.PROVISIONING, InstanceStatus.PROVISIONING,
                InstanceStatus.BOOTING, InstanceStatus.BOOTING, InstanceStatus.INSTALLING, InstanceStatus.STARTING,
                InstanceStatus.STARTING, InstanceStatus.STARTING, InstanceStatus.READY);
        List<ActionType> steps = List.of(ActionType.REQUEST_CREATE, ActionType.PROVIDER_CREATE,
                ActionType.PROVIDER_START, ActionType.PROVIDER_GET_IP, ActionType.WORKER_INSTALL,
                ActionType.WORKER_HTTP_READY, ActionType.WORKER_MODEL_LOADED, ActionType.HEALTH_CHECK_PASS,
                ActionType.HEALTH_CHECK_PASS);

        EnumSet<ActionType> done = EnumSet.noneOf(ActionType.class);
        int previous = 0;
        for (int i = 0; i < path.size(); i++) {
            done.add(steps.get(i));
            int progress = ProgressCalculator.progress(path.get(i), done);
            assertTrue(progress >= previous, "progress went from " + previous + " to " + progress);
            previous = progress;
        }
        assertEquals(100, previous);
    }

    @Test
    void milestonesAreIncreasing() {
        assertTrue(ProgressCalculator.milestones().get(ActionType.PROVIDER_START)
                < ProgressCalculator.milestones().get(ActionType.WORKER_INSTALL));
        assertEquals(95, ProgressCalculator.milestones().get(ActionType.HEALTH_CHECK_PASS));
    }
}
