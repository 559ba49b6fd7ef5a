package gpufleet.orchestrator.repository;

import gpufleet.orchestrator.model.WorkerToken;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for worker credentials. One token per instance, never reissued.
 */
public interface WorkerTokenRepository {

    /**
     * @return false if the instance already has a token
     */
    boolean insertIfAbsent(WorkerToken token);

    Optional<WorkerToken> findByInstance(String instanceId);

    void touch(String instanceId, Instant at);

    void revoke(String instanceId, Instant at);
}
