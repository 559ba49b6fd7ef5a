package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.WorkerHandle;
import gpufleet.orchestrator.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the worker for an inference request.
 *
 * Candidates are ready instances with an IP, a worker that reports ready (or nothing), the right
 * model and a heartbeat or health check inside the staleness window. Without a sticky key the
 * least loaded, most recently seen worker wins; with one, the key hashes onto the full candidate
 * set sorted by id so repeat requests land on the same worker while the set is unchanged. Only the
 * unkeyed path reads a bounded, best-first window of candidates.
 */
public class WorkerSelector {

    private static final Logger log = LoggerFactory.getLogger(WorkerSelector.class);

    private static final int RETRY_AFTER_SECONDS = 5;

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    static final Comparator<Instance> RANKING = Comparator
            .comparing(Instance::workerQueueDepth, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Instance::freshness, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Instance::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final InstanceRepository instances;
    private final OrchestratorConfig config;
    private final Clock clock;

    public WorkerSelector(InstanceRepository instances, OrchestratorConfig config) {
        this.instances = instances;
        this.config = config;
        this.clock = config.clock();
    }

    /**
     * @param modelId   requested model, blank for any
     * @param stickyKey session affinity key, may be null
     * @throws NoReadyWorkerException if no candidate qualifies
     */
    public WorkerHandle select(String modelId, String stickyKey) {
        String model = modelId == null || modelId.isBlank() ? null : modelId.trim();
        boolean sticky = stickyKey != null && !stickyKey.isBlank();
        // sticky hashing sees every fresh candidate
        List<Instance> candidates = candidates(model, sticky ? 0 : config.routingCandidateLimit());

        if (candidates.isEmpty()) {
            log.debug("No ready worker for model {}", model);
            throw new NoReadyWorkerException(model, RETRY_AFTER_SECONDS);
        }

        Instance chosen;
        if (sticky) {
            List<Instance> byId = new ArrayList<>(candidates);
            byId.sort(Comparator.comparing(Instance::id));
            int index = (int) Long.remainderUnsigned(fnv1a64(stickyKey), byId.size());
            chosen = byId.get(index);
        } else {
            chosen = candidates.get(0);
        }

        int port = chosen.workerVllmPort() != null ? chosen.workerVllmPort() : config.vllmPort();
        String servedModel = chosen.workerModelId() != null ? chosen.workerModelId() : chosen.modelId();
        return new WorkerHandle(chosen.id(), chosen.ipAddress(), port, servedModel, chosen.workerQueueDepth());
    }

    /**
     * Fresh candidates, best first. {@code limit <= 0} reads all of them.
     */
    private List<Instance> candidates(String modelId, int limit) {
        Instant freshAfter = clock.instant().minus(config.routingStaleness());
        List<Instance> candidates = new ArrayList<>();
        for (Instance instance : instances.findRoutingCandidates(modelId, freshAfter, limit)) {
            Instant freshness = instance.freshness();
            if (freshness != null && freshness.isAfter(freshAfter)) {
                candidates.add(instance);
            }
        }
        candidates.sort(RANKING);
        return candidates;
    }

    static long fnv1a64(String key) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
