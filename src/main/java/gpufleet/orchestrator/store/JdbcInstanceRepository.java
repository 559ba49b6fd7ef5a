package gpufleet.orchestrator.store;

import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.StateHistoryEntry;
import gpufleet.orchestrator.model.Transition;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static gpufleet.orchestrator.store.JdbcSupport.*;

/**
 * JDBC implementation of InstanceRepository.
 */
public class JdbcInstanceRepository implements InstanceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcInstanceRepository.class);

    private static final String ACTIVE_STATUSES = Arrays.stream(InstanceStatus.values())
            .filter(InstanceStatus::isActive)
            .map(s -> "'" + s.dbValue() + "'")
            .collect(Collectors.joining(", "));

    private static final String INSERT_HISTORY_SQL = """
                INSERT INTO instance_state_history (id, instance_id, from_status, to_status, reason, metadata, created_at, seq)
                VALUES (?, ?, ?, ?, ?, ?, ?, NEXT VALUE FOR history_seq)
            """;

    private static final Duration DEFAULT_CLAIM_HOLD = Duration.ofMinutes(20);

    private final Database db;
    private final Clock clock;
    private final Duration claimHold;

    public JdbcInstanceRepository(Database db, Clock clock) {
        this(db, clock, DEFAULT_CLAIM_HOLD);
    }

    /**
     * @param claimHold how long a termination/requeue claim keeps the row out of other claims unless it
     *                  is renewed or released
     */
    public JdbcInstanceRepository(Database db, Clock clock, Duration claimHold) {
        this.db = db;
        this.clock = clock;
        this.claimHold = claimHold;
    }

    @FunctionalInterface
    private interface Binder {
        /** Bind parameters starting at index 1, return the next free index. */
        int bind(PreparedStatement ps) throws SQLException;
    }

    @Override
    public boolean insertIfAbsent(Instance instance, String reason) {
        String sql = """
                    INSERT INTO instances (id, provider, zone, instance_type, model_id, provider_instance_id,
                        ip_address, status, created_at, status_changed_at, retry_count)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
                """;

        Instant now = instance.createdAt() != null ? instance.createdAt() : clock.instant();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, instance.id());
                ps.setString(2, instance.provider());
                ps.setString(3, instance.zone());
                ps.setString(4, instance.instanceType());
                ps.setString(5, instance.modelId());
                ps.setString(6, instance.providerInstanceId());
                ps.setString(7, instance.ipAddress());
                ps.setString(8, instance.status().dbValue());
                setTimestamp(ps, 9, now);
                setTimestamp(ps, 10, now);
                ps.executeUpdate();

                insertHistory(conn, instance.id(), null, instance.status(), reason, null, now);
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isUniqueViolation(e)) {
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert instance: " + instance.id(), e);
        }
    }

    @Override
    public Optional<Instance> findById(String instanceId) {
        String sql = "SELECT * FROM instances WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find instance: " + instanceId, e);
        }
    }

    @Override
    public List<Instance> findAll() {
        String sql = "SELECT * FROM instances ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            return mapRows(rs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all instances", e);
        }
    }

    @Override
    public List<Instance> findByStatus(InstanceStatus status) {
        String sql = "SELECT * FROM instances WHERE status = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find instances by status: " + status, e);
        }
    }

    @Override
    public int countByStatus(InstanceStatus status) {
        String sql = "SELECT COUNT(*) FROM instances WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count instances by status", e);
        }
    }

    @Override
    public TransitionResult transition(Transition transition) {
        try (Connection conn = db.getConnection()) {
            try {
                TransitionResult result = applyTransition(conn, transition, clock.instant());
                if (result == TransitionResult.SKIPPED && !exists(conn, transition.instanceId())) {
                    result = TransitionResult.NOT_FOUND;
                }
                conn.commit();
                return result;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to transition instance: " + transition, e);
        }
    }

    /**
     * Guarded update plus history row on the caller's connection. Does not commit.
     */
    private TransitionResult applyTransition(Connection conn, Transition t, Instant now) throws SQLException {
        StringBuilder sql = new StringBuilder(
                "UPDATE instances SET status = ?, status_changed_at = ?,"
                        + " last_reconciliation = NULL, lease_until = NULL");
        String stampColumn = stampColumn(t.to());
        if (stampColumn != null) {
            sql.append(", ").append(stampColumn).append(" = ?");
        }
        if (t.to() == InstanceStatus.ARCHIVED) {
            sql.append(", is_archived = TRUE");
        }
        if (t.to() == InstanceStatus.TERMINATING) {
            sql.append(", termination_attempts = 0");
        }
        if (t.to().isComingUp()) {
            sql.append(", health_check_failures = 0");
        }
        // provisioning retries and startup self-heals are counted separately
        if (t.from() == InstanceStatus.PROVISIONING && t.to() == InstanceStatus.BOOTING) {
            sql.append(", retry_count = 0");
        }
        if (t.errorCode() != null) {
            sql.append(", error_code = ?, error_message = ?");
        } else if (t.clearError()) {
            sql.append(", error_code = NULL, error_message = NULL");
        }
        if (t.deletionReason() != null) {
            sql.append(", deletion_reason = ?");
        }
        if (t.deletedByProvider()) {
            sql.append(", deleted_by_provider = TRUE");
        }
        if (t.resetWorker()) {
            sql.append(", worker_status = NULL, worker_queue_depth = NULL, worker_gpu_utilization = NULL")
                    .append(", worker_last_heartbeat = NULL, last_health_check = NULL");
        }
        if (t.incrementRetry()) {
            sql.append(", retry_count = retry_count + 1");
        }
        sql.append(" WHERE id = ? AND status = ?");

        int updated;
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, t.to().dbValue());
            setTimestamp(ps, i++, now);
            if (stampColumn != null) {
                setTimestamp(ps, i++, now);
            }
            if (t.errorCode() != null) {
                ps.setString(i++, t.errorCode());
                ps.setString(i++, truncate(t.errorMessage()));
            }
            if (t.deletionReason() != null) {
                ps.setString(i++, t.deletionReason());
            }
            ps.setString(i++, t.instanceId());
            ps.setString(i, t.from().dbValue());
            updated = ps.executeUpdate();
        }

        if (updated == 0) {
            return TransitionResult.SKIPPED;
        }

        insertHistory(conn, t.instanceId(), t.from(), t.to(), t.reason(), t.metadata(), now);
        log.debug("Instance {} {} -> {} ({})", t.instanceId(), t.from().dbValue(), t.to().dbValue(), t.reason());
        return TransitionResult.APPLIED;
    }

    private static String stampColumn(InstanceStatus to) {
        return switch (to) {
            case BOOTING -> "boot_started_at";
            case INSTALLING -> "install_started_at";
            case STARTING -> "starting_started_at";
            case READY -> "ready_at";
            case DRAINING -> "draining_started_at";
            case TERMINATING -> "terminating_started_at";
            case TERMINATED -> "terminated_at";
            case ARCHIVED -> "archived_at";
            case PROVISIONING_FAILED, STARTUP_FAILED, FAILED -> "failed_at";
            case PROVISIONING -> null;
        };
    }

    private void insertHistory(Connection conn, String instanceId, InstanceStatus from, InstanceStatus to,
            String reason, String metadata, Instant at) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_HISTORY_SQL)) {
            ps.setString(1, newId());
            ps.setString(2, instanceId);
            ps.setString(3, from != null ? from.dbValue() : null);
            ps.setString(4, to.dbValue());
            ps.setString(5, reason);
            ps.setString(6, metadata);
            setTimestamp(ps, 7, at);
            ps.executeUpdate();
        }
    }

    private static boolean exists(Connection conn, String instanceId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM instances WHERE id = ?")) {
            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public boolean setProviderInstanceId(String instanceId, String providerInstanceId) {
        String sql = "UPDATE instances SET provider_instance_id = ? WHERE id = ? AND provider_instance_id IS NULL";
        return executeUpdate(sql, "set provider id for " + instanceId, ps -> {
            ps.setString(1, providerInstanceId);
            ps.setString(2, instanceId);
            return 3;
        }) > 0;
    }

    @Override
    public void updateIp(String instanceId, String ipAddress) {
        String sql = "UPDATE instances SET ip_address = ? WHERE id = ?";
        executeUpdate(sql, "update ip for " + instanceId, ps -> {
            ps.setString(1, ipAddress);
            ps.setString(2, instanceId);
            return 3;
        });
    }

    @Override
    public void recordError(String instanceId, String errorCode, String errorMessage, boolean incrementRetry) {
        String sql = "UPDATE instances SET error_code = ?, error_message = ?, retry_count = retry_count + ? WHERE id = ?";
        executeUpdate(sql, "record error for " + instanceId, ps -> {
            ps.setString(1, errorCode);
            ps.setString(2, truncate(errorMessage));
            ps.setInt(3, incrementRetry ? 1 : 0);
            ps.setString(4, instanceId);
            return 5;
        });
    }

    @Override
    public void recordHealthCheck(String instanceId, boolean success, Instant at) {
        String sql = success
                ? "UPDATE instances SET last_health_check = ?, health_check_failures = 0 WHERE id = ?"
                : "UPDATE instances SET health_check_failures = health_check_failures + 1 WHERE id = ?";
        executeUpdate(sql, "record health check for " + instanceId, ps -> {
            int i = 1;
            if (success) {
                setTimestamp(ps, i++, at);
            }
            ps.setString(i++, instanceId);
            return i;
        });
    }

    @Override
    public int recordTerminationFailure(String instanceId, String errorCode, String errorMessage) {
        String updateSql = """
                    UPDATE instances
                    SET termination_attempts = termination_attempts + 1, error_code = ?, error_message = ?
                    WHERE id = ?
                """;
        String selectSql = "SELECT termination_attempts FROM instances WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement update = conn.prepareStatement(updateSql);
                    PreparedStatement select = conn.prepareStatement(selectSql)) {
                update.setString(1, errorCode);
                update.setString(2, truncate(errorMessage));
                update.setString(3, instanceId);
                update.executeUpdate();

                select.setString(1, instanceId);
                int attempts = 0;
                try (ResultSet rs = select.executeQuery()) {
                    if (rs.next()) {
                        attempts = rs.getInt(1);
                    }
                }
                conn.commit();
                return attempts;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record termination failure for: " + instanceId, e);
        }
    }

    // ---------- claims ----------

    @Override
    public List<Instance> claimForHealthCheck(Instant now, Duration lease, Instant heartbeatAfter, int retryCap,
            int limit) {
        String where = """
                (status IN ('booting', 'installing', 'starting')
                 OR (status = 'startup_failed' AND worker_last_heartbeat > ? AND retry_count < ?))
                """;
        return claim(where, ps -> {
            setTimestamp(ps, 1, heartbeatAfter);
            ps.setInt(2, retryCap);
            return 3;
        }, now, lease, null, limit, "health-check");
    }

    @Override
    public List<Instance> claimForTermination(Instant now, Duration lease, int maxAttempts, int limit) {
        return claim("status = 'terminating' AND termination_attempts < ?", ps -> {
            ps.setInt(1, maxAttempts);
            return 2;
        }, now, lease, claimHold, limit, "terminator");
    }

    @Override
    public List<Instance> claimForWatchDog(Instant now, Duration lease, int limit) {
        return claim("status IN ('ready', 'draining') AND provider_instance_id IS NOT NULL",
                ps -> 1, now, lease, null, limit, "watch-dog");
    }

    @Override
    public List<Instance> claimForRequeue(Instant now, Duration lease, Instant createdBefore, int maxRetries,
            int limit) {
        return claim("status = 'provisioning' AND created_at < ? AND retry_count < ?", ps -> {
            setTimestamp(ps, 1, createdBefore);
            ps.setInt(2, maxRetries);
            return 3;
        }, now, lease, claimHold, limit, "requeue");
    }

    @Override
    public Optional<Instance> claimById(String instanceId, InstanceStatus status, Instant now, Duration lease) {
        List<Instance> claimed = claim("id = ? AND status = ?", ps -> {
            ps.setString(1, instanceId);
            ps.setString(2, status.dbValue());
            return 3;
        }, now, lease, claimHold, 1, "single");
        return claimed.stream().findFirst();
    }

    @Override
    public boolean renewClaim(Instance claimed, Instant now) {
        String sql = """
                    UPDATE instances SET lease_until = ?
                    WHERE id = ? AND last_reconciliation = ? AND lease_until IS NOT NULL
                """;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, now.plus(claimHold));
            ps.setString(2, claimed.id());
            setTimestamp(ps, 3, claimed.lastReconciliation());
            int updated = ps.executeUpdate();
            conn.commit();
            return updated == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to renew claim on: " + claimed.id(), e);
        }
    }

    @Override
    public void releaseClaim(Instance claimed) {
        String sql = "UPDATE instances SET lease_until = NULL WHERE id = ? AND last_reconciliation = ?";
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, claimed.id());
            setTimestamp(ps, 2, claimed.lastReconciliation());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release claim on: " + claimed.id(), e);
        }
    }

    /**
     * Lock a batch with SKIP LOCKED, stamp the lease, commit. Rows under a live lease or hold are skipped.
     * A non-null {@code hold} also sets {@code lease_until}, which keeps the row claimed until it is
     * released, renewed past, or expires.
     */
    private List<Instance> claim(String where, Binder binder, Instant now, Duration lease, Duration hold,
            int limit, String label) {
        String selectSql = "SELECT * FROM instances WHERE " + where
                + " AND (last_reconciliation IS NULL OR last_reconciliation < ?)"
                + " AND (lease_until IS NULL OR lease_until < ?)"
                + " ORDER BY created_at LIMIT ? FOR UPDATE SKIP LOCKED";
        String updateSql = "UPDATE instances SET last_reconciliation = ?, lease_until = ? WHERE id = ?";
        // millisecond stamps so the claim can be matched again on renew/release
        Instant stamp = now.truncatedTo(ChronoUnit.MILLIS);
        Instant leaseUntil = hold != null ? stamp.plus(hold) : null;

        List<Instance> claimed = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                int i = binder.bind(selectPs);
                setTimestamp(selectPs, i++, now.minus(lease));
                setTimestamp(selectPs, i++, now);
                selectPs.setInt(i, limit);

                try (ResultSet rs = selectPs.executeQuery()) {
                    while (rs.next()) {
                        Instance instance = mapRow(rs).toBuilder().lastReconciliation(stamp).build();
                        setTimestamp(updatePs, 1, stamp);
                        setTimestamp(updatePs, 2, leaseUntil);
                        updatePs.setString(3, instance.id());
                        updatePs.addBatch();
                        claimed.add(instance);
                    }
                }

                if (!claimed.isEmpty()) {
                    updatePs.executeBatch();
                }

                conn.commit();

                if (!claimed.isEmpty()) {
                    log.debug("Claimed {} instances for {}", claimed.size(), label);
                }
                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim instances for " + label, e);
        }
    }

    @Override
    public List<String> recoverStuck(InstanceStatus status, Instant changedBefore, Transition template, int limit) {
        String selectSql = """
                    SELECT id FROM instances
                    WHERE status = ? AND status_changed_at < ?
                    ORDER BY status_changed_at
                    LIMIT ?
                    FOR UPDATE SKIP LOCKED
                """;

        List<String> recovered = new ArrayList<>();
        Instant now = clock.instant();

        try (Connection conn = db.getConnection()) {
            try {
                List<String> ids = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, status.dbValue());
                    setTimestamp(ps, 2, changedBefore);
                    ps.setInt(3, limit);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            ids.add(rs.getString("id"));
                        }
                    }
                }

                for (String id : ids) {
                    Transition t = template.toBuilder().instanceId(id).from(status).build();
                    if (applyTransition(conn, t, now) == TransitionResult.APPLIED) {
                        recovered.add(id);
                    }
                }

                conn.commit();
                return recovered;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to recover stuck instances in " + status, e);
        }
    }

    // ---------- worker ----------

    @Override
    public boolean updateWorkerHeartbeat(String instanceId, String workerStatus, String modelId, Integer queueDepth,
            Double gpuUtilization, String metadata, Instant at) {
        StringBuilder sql = new StringBuilder("""
                    UPDATE instances
                    SET worker_status = ?, worker_queue_depth = ?, worker_gpu_utilization = ?, worker_last_heartbeat = ?
                """);
        if (modelId != null) {
            sql.append(", worker_model_id = ?");
        }
        if (metadata != null) {
            sql.append(", worker_metadata = ?");
        }
        sql.append(" WHERE id = ? AND status NOT IN ('terminated', 'archived')");

        return executeUpdate(sql.toString(), "update heartbeat for " + instanceId, ps -> {
            int i = 1;
            ps.setString(i++, workerStatus);
            setInteger(ps, i++, queueDepth);
            setDouble(ps, i++, gpuUtilization);
            setTimestamp(ps, i++, at);
            if (modelId != null) {
                ps.setString(i++, modelId);
            }
            if (metadata != null) {
                ps.setString(i++, metadata);
            }
            ps.setString(i++, instanceId);
            return i;
        }) > 0;
    }

    @Override
    public boolean registerWorker(String instanceId, String modelId, int vllmPort, int healthPort, String metadata,
            Instant at) {
        String lockSql = "SELECT ip_address, status FROM instances WHERE id = ? FOR UPDATE";
        String conflictSql = "SELECT id FROM instances WHERE ip_address = ? AND id <> ? AND status IN ("
                + ACTIVE_STATUSES + ") AND (worker_vllm_port IN (?, ?) OR worker_health_port IN (?, ?))";
        String updateSql = """
                    UPDATE instances
                    SET worker_model_id = ?, worker_vllm_port = ?, worker_health_port = ?,
                        worker_metadata = ?, worker_last_heartbeat = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                String ip;
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setString(1, instanceId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next() || InstanceStatus.fromDb(rs.getString("status")).isTerminal()) {
                            conn.rollback();
                            return false;
                        }
                        ip = rs.getString("ip_address");
                    }
                }

                if (ip != null) {
                    try (PreparedStatement ps = conn.prepareStatement(conflictSql)) {
                        ps.setString(1, ip);
                        ps.setString(2, instanceId);
                        ps.setInt(3, vllmPort);
                        ps.setInt(4, healthPort);
                        ps.setInt(5, vllmPort);
                        ps.setInt(6, healthPort);
                        try (ResultSet rs = ps.executeQuery()) {
                            if (rs.next()) {
                                String other = rs.getString("id");
                                conn.rollback();
                                throw new IllegalStateException("Ports " + vllmPort + "/" + healthPort + " on " + ip
                                        + " already used by active instance " + other);
                            }
                        }
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, modelId);
                    ps.setInt(2, vllmPort);
                    ps.setInt(3, healthPort);
                    ps.setString(4, metadata);
                    setTimestamp(ps, 5, at);
                    ps.setString(6, instanceId);
                    ps.executeUpdate();
                }
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register worker for: " + instanceId, e);
        }
    }

    @Override
    public List<Instance> findRoutingCandidates(String modelId, Instant freshAfter, int limit) {
        StringBuilder sql = new StringBuilder("""
                    SELECT * FROM instances
                    WHERE status = 'ready'
                      AND ip_address IS NOT NULL
                      AND (worker_status IS NULL OR worker_status = 'ready')
                      AND (worker_last_heartbeat > ? OR last_health_check > ?)
                """);
        if (modelId != null) {
            sql.append(" AND (worker_model_id = ? OR (worker_model_id IS NULL AND model_id = ?))");
        }
        sql.append(" ORDER BY worker_queue_depth ASC NULLS LAST, created_at DESC");
        if (limit > 0) {
            sql.append(" LIMIT ?");
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int i = 1;
            setTimestamp(ps, i++, freshAfter);
            setTimestamp(ps, i++, freshAfter);
            if (modelId != null) {
                ps.setString(i++, modelId);
                ps.setString(i++, modelId);
            }
            if (limit > 0) {
                ps.setInt(i, limit);
            }

            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find routing candidates for model: " + modelId, e);
        }
    }

    @Override
    public List<StateHistoryEntry> findHistory(String instanceId) {
        String sql = "SELECT * FROM instance_state_history WHERE instance_id = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instanceId);
            List<StateHistoryEntry> history = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_status");
                    history.add(new StateHistoryEntry(
                            rs.getString("id"),
                            rs.getString("instance_id"),
                            from != null ? InstanceStatus.fromDb(from) : null,
                            InstanceStatus.fromDb(rs.getString("to_status")),
                            rs.getString("reason"),
                            rs.getString("metadata"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return history;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load history for: " + instanceId, e);
        }
    }

    // Helper methods

    private int executeUpdate(String sql, String what, Binder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + what, e);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 2048) {
            return message;
        }
        return message.substring(0, 2048);
    }

    private List<Instance> mapRows(ResultSet rs) throws SQLException {
        List<Instance> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private Instance mapRow(ResultSet rs) throws SQLException {
        return Instance.builder()
                .id(rs.getString("id"))
                .provider(rs.getString("provider"))
                .zone(rs.getString("zone"))
                .instanceType(rs.getString("instance_type"))
                .modelId(rs.getString("model_id"))
                .providerInstanceId(rs.getString("provider_instance_id"))
                .ipAddress(rs.getString("ip_address"))
                .status(InstanceStatus.fromDb(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .statusChangedAt(toInstant(rs.getTimestamp("status_changed_at")))
                .bootStartedAt(toInstant(rs.getTimestamp("boot_started_at")))
                .installStartedAt(toInstant(rs.getTimestamp("install_started_at")))
                .startingStartedAt(toInstant(rs.getTimestamp("starting_started_at")))
                .readyAt(toInstant(rs.getTimestamp("ready_at")))
                .drainingStartedAt(toInstant(rs.getTimestamp("draining_started_at")))
                .terminatingStartedAt(toInstant(rs.getTimestamp("terminating_started_at")))
                .terminatedAt(toInstant(rs.getTimestamp("terminated_at")))
                .failedAt(toInstant(rs.getTimestamp("failed_at")))
                .archivedAt(toInstant(rs.getTimestamp("archived_at")))
                .errorCode(rs.getString("error_code"))
                .errorMessage(rs.getString("error_message"))
                .retryCount(rs.getInt("retry_count"))
                .healthCheckFailures(rs.getInt("health_check_failures"))
                .terminationAttempts(rs.getInt("termination_attempts"))
                .lastHealthCheck(toInstant(rs.getTimestamp("last_health_check")))
                .lastReconciliation(toInstant(rs.getTimestamp("last_reconciliation")))
                .workerLastHeartbeat(toInstant(rs.getTimestamp("worker_last_heartbeat")))
                .workerStatus(rs.getString("worker_status"))
                .workerModelId(rs.getString("worker_model_id"))
                .workerVllmPort(getInteger(rs, "worker_vllm_port"))
                .workerHealthPort(getInteger(rs, "worker_health_port"))
                .workerQueueDepth(getInteger(rs, "worker_queue_depth"))
                .workerGpuUtilization(getDouble(rs, "worker_gpu_utilization"))
                .workerMetadata(rs.getString("worker_metadata"))
                .deletionReason(rs.getString("deletion_reason"))
                .deletedByProvider(rs.getBoolean("deleted_by_provider"))
                .archived(rs.getBoolean("is_archived"))
                .build();
    }
}
