package gpufleet.orchestrator.repository;

import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.StateHistoryEntry;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.model.TransitionResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for instance persistence.
 *
 * Status changes go through {@link #transition(Transition)} only. Claim methods lock rows with
 * {@code FOR UPDATE SKIP LOCKED} and stamp {@code last_reconciliation} as a lease in the same
 * transaction, so concurrent replicas receive disjoint batches. Termination and requeue claims also
 * hold the row through {@code lease_until} until {@link #releaseClaim(Instance)}, since their provider
 * calls can outlast the lease.
 */
public interface InstanceRepository {

    /**
     * Insert a new instance row and its initial history entry.
     *
     * @return false if a row with the same id already exists
     */
    boolean insertIfAbsent(Instance instance, String reason);

    Optional<Instance> findById(String instanceId);

    List<Instance> findAll();

    List<Instance> findByStatus(InstanceStatus status);

    int countByStatus(InstanceStatus status);

    /**
     * Guarded status update plus one history row, atomically.
     *
     * @return APPLIED, SKIPPED when the row is no longer in {@code from}, or NOT_FOUND
     */
    TransitionResult transition(Transition transition);

    /**
     * Persist the provider id unless one is already recorded.
     *
     * @return true if this call stored the id
     */
    boolean setProviderInstanceId(String instanceId, String providerInstanceId);

    void updateIp(String instanceId, String ipAddress);

    /**
     * Record a failure on the row without changing status.
     *
     * @param incrementRetry also bump retry_count
     */
    void recordError(String instanceId, String errorCode, String errorMessage, boolean incrementRetry);

    /**
     * Record a probe outcome: success stamps last_health_check and resets the failure counter,
     * failure increments it.
     */
    void recordHealthCheck(String instanceId, boolean success, Instant at);

    /**
     * Count one more failed teardown attempt.
     *
     * @return the new attempt count
     */
    int recordTerminationFailure(String instanceId, String errorCode, String errorMessage);

    // ---------- claims ----------

    /**
     * Rows in booting/installing/starting, plus startup_failed rows with a heartbeat newer than
     * {@code heartbeatAfter} and retry_count below {@code retryCap}.
     */
    List<Instance> claimForHealthCheck(Instant now, Duration lease, Instant heartbeatAfter, int retryCap, int limit);

    /**
     * Terminating rows with fewer than {@code maxAttempts} teardown attempts.
     */
    List<Instance> claimForTermination(Instant now, Duration lease, int maxAttempts, int limit);

    /**
     * Ready/draining rows that have a provider instance.
     */
    List<Instance> claimForWatchDog(Instant now, Duration lease, int limit);

    /**
     * Provisioning rows created before {@code createdBefore} with retry_count below {@code maxRetries}.
     */
    List<Instance> claimForRequeue(Instant now, Duration lease, Instant createdBefore, int maxRetries, int limit);

    /**
     * Claim a single row if it is in the given status and not leased.
     */
    Optional<Instance> claimById(String instanceId, InstanceStatus status, Instant now, Duration lease);

    /**
     * Push the hold of a termination/requeue claim forward from {@code now}. Call before slow work on
     * each claimed row.
     *
     * @return false if the row changed status or was claimed again since, in which case the caller
     *         must leave it alone
     */
    boolean renewClaim(Instance claimed, Instant now);

    /**
     * Drop the hold of a claim once the work on the row is done. The row is claimable again once its
     * lease has elapsed.
     */
    void releaseClaim(Instance claimed);

    /**
     * Claim rows stuck in {@code status} since before {@code changedBefore} and move each one to
     * {@code transition.to()} inside the claim transaction. The transition template's instance id is
     * replaced per row.
     *
     * @return ids of rows transitioned
     */
    List<String> recoverStuck(InstanceStatus status, Instant changedBefore, Transition template, int limit);

    // ---------- worker ----------

    /**
     * Update worker runtime fields only.
     *
     * @return false if the instance is missing, terminated or archived
     */
    boolean updateWorkerHeartbeat(String instanceId, String workerStatus, String modelId, Integer queueDepth,
            Double gpuUtilization, String metadata, Instant at);

    /**
     * Record worker ports.
     *
     * @throws IllegalStateException if another active instance on the same IP uses either port
     */
    boolean registerWorker(String instanceId, String modelId, int vllmPort, int healthPort, String metadata,
            Instant at);

    /**
     * Ready rows with an IP, worker status ready or unknown, serving {@code modelId} (any if null),
     * with a heartbeat or health check after {@code freshAfter}. Shortest queue first; at most
     * {@code limit} rows, or all of them when {@code limit <= 0}.
     */
    List<Instance> findRoutingCandidates(String modelId, Instant freshAfter, int limit);

    List<StateHistoryEntry> findHistory(String instanceId);
}
