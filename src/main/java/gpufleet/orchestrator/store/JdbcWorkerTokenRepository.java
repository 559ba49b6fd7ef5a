package gpufleet.orchestrator.store;

import gpufleet.orchestrator.model.WorkerToken;
import gpufleet.orchestrator.repository.WorkerTokenRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static gpufleet.orchestrator.store.JdbcSupport.*;

/**
 * JDBC implementation of WorkerTokenRepository.
 */
public class JdbcWorkerTokenRepository implements WorkerTokenRepository {

    private final Database db;

    public JdbcWorkerTokenRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insertIfAbsent(WorkerToken token) {
        String sql = """
                    INSERT INTO worker_auth_tokens (instance_id, token_hash, token_prefix, created_at)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, token.instanceId());
                ps.setString(2, token.tokenHash());
                ps.setString(3, token.tokenPrefix());
                setTimestamp(ps, 4, token.createdAt());
                ps.executeUpdate();
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
            throw new RuntimeException("Failed to store worker token for: " + token.instanceId(), e);
        }
    }

    @Override
    public Optional<WorkerToken> findByInstance(String instanceId) {
        String sql = "SELECT * FROM worker_auth_tokens WHERE instance_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new WorkerToken(
                            rs.getString("instance_id"),
                            rs.getString("token_hash"),
                            rs.getString("token_prefix"),
                            toInstant(rs.getTimestamp("created_at")),
                            toInstant(rs.getTimestamp("last_seen_at")),
                            toInstant(rs.getTimestamp("revoked_at"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find worker token for: " + instanceId, e);
        }
    }

    @Override
    public void touch(String instanceId, Instant at) {
        update("UPDATE worker_auth_tokens SET last_seen_at = ? WHERE instance_id = ?", instanceId, at);
    }

    @Override
    public void revoke(String instanceId, Instant at) {
        update("UPDATE worker_auth_tokens SET revoked_at = ? WHERE instance_id = ? AND revoked_at IS NULL",
                instanceId, at);
    }

    private void update(String sql, String instanceId, Instant at) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, at);
            ps.setString(2, instanceId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update worker token for: " + instanceId, e);
        }
    }
}
