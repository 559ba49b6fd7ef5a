package gpufleet.orchestrator.service;

import gpufleet.orchestrator.FleetFixture;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.WorkerHandle;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkerSelectorTest {

    private FleetFixture fleet;
    private WorkerSelector selector;
    private WorkerService workers;

    @BeforeEach
    void setUp() {
        fleet = new FleetFixture("test-selector");
        selector = fleet.deps.workerSelector();
        workers = fleet.deps.workerService();
    }

    @AfterEach
    void tearDown() {
        fleet.close();
    }

    @Test
    void prefersShortestQueue() {
        Instance busy = fleet.readyInstance("llama");
        Instance idle = fleet.readyInstance("llama");
        workers.reportHeartbeat(busy.id(), "ready", "llama", 12, 90.0, null);
        workers.reportHeartbeat(idle.id(), "ready", "llama", 1, 10.0, null);

        WorkerHandle handle = selector.select("llama", null);

        assertEquals(idle.id(), handle.instanceId());
        assertEquals(idle.ipAddress(), handle.ipAddress());
        assertEquals(8000, handle.port());
        assertEquals(1, handle.queueDepth());
        assertEquals("http://" + idle.ipAddress() + ":8000", handle.baseUrl());
    }

    @Test
    void staleWorkersAreExcluded() {
        Instance stale = fleet.readyInstance("llama");
        Instance fresh = fleet.readyInstance("llama");
        workers.reportHeartbeat(stale.id(), "ready", "llama", 0, null, null);

        fleet.clock.advance(Duration.ofSeconds(301));
        workers.reportHeartbeat(fresh.id(), "ready", "llama", 50, null, null);

        for (int i = 0; i < 5; i++) {
            assertEquals(fresh.id(), selector.select("llama", "session-" + i).instanceId());
        }
    }

    @Test
    void allStaleMeansNoReadyWorker() {
        fleet.readyInstance("llama");
        fleet.clock.advance(Duration.ofSeconds(301));

        NoReadyWorkerException e = assertThrows(NoReadyWorkerException.class, () -> selector.select("llama", null));
        assertEquals("llama", e.modelId());
        assertTrue(e.retryAfterSeconds() > 0);
    }

    @Test
    void workersReportingBusyStatusAreSkipped() {
        Instance draining = fleet.readyInstance("llama");
        Instance ready = fleet.readyInstance("llama");
        workers.reportHeartbeat(draining.id(), "draining", "llama", 0, null, null);

        assertEquals(ready.id(), selector.select("llama", null).instanceId());
    }

    @Test
    void modelFilterIsApplied() {
        fleet.readyInstance("mistral");

        assertThrows(NoReadyWorkerException.class, () -> selector.select("llama", null));
        assertEquals("mistral", selector.select("mistral", null).modelId());
        assertNotNull(selector.select(null, null));
    }

    @Test
    void stickyKeyIsStableAndSpreads() {
        for (int i = 0; i < 3; i++) {
            fleet.readyInstance("llama");
        }

        String first = selector.select("llama", "user-42").instanceId();
        for (int i = 0; i < 10; i++) {
            assertEquals(first, selector.select("llama", "user-42").instanceId());
        }

        Set<String> chosen = new HashSet<>();
        for (int i = 0; i < 60; i++) {
            chosen.add(selector.select("llama", "user-" + i).instanceId());
        }
        assertTrue(chosen.size() > 1, "sticky keys should not all map to one worker");
    }

    @Test
    void stickyKeyIgnoresTheCandidateWindow() {
        fleet.deps.config().withRoutingCandidateLimit(1);
        List<Instance> ready = List.of(fleet.readyInstance("llama"), fleet.readyInstance("llama"),
                fleet.readyInstance("llama"));

        String expected = null;
        for (int round = 0; round < ready.size(); round++) {
            for (int i = 0; i < ready.size(); i++) {
                workers.reportHeartbeat(ready.get(i).id(), "ready", "llama", (i + round) % ready.size(), null, null);
            }

            String chosen = selector.select("llama", "user-42").instanceId();
            if (expected == null) {
                expected = chosen;
            }
            assertEquals(expected, chosen, "sticky choice moved when queue depths changed");

            Instance shortest = ready.get((ready.size() - round) % ready.size());
            assertEquals(shortest.id(), selector.select("llama", null).instanceId());
        }
    }

    @Test
    void fnvHashMatchesReferenceValues() {
        assertEquals(0xcbf29ce484222325L, WorkerSelector.fnv1a64(""));
        assertEquals(0xaf63dc4c8601ec8cL, WorkerSelector.fnv1a64("a"));
    }
}
