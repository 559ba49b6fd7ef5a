package gpufleet.orchestrator.store;

import gpufleet.orchestrator.model.ActionStatus;
import gpufleet.orchestrator.model.ActionType;
import gpufleet.orchestrator.model.InstanceAction;
import gpufleet.orchestrator.repository.ActionLogRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static gpufleet.orchestrator.store.JdbcSupport.*;

/**
 * JDBC implementation of ActionLogRepository.
 */
public class JdbcActionLogRepository implements ActionLogRepository {

    private final Database db;

    public JdbcActionLogRepository(Database db) {
        this.db = db;
    }

    @Override
    public void record(String instanceId, ActionType action, ActionStatus status, String message, String metadata,
            Long durationMs, Instant at) {
        String sql = """
                    INSERT INTO instance_actions (id, instance_id, action, status, message, metadata, duration_ms, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, newId());
            ps.setString(2, instanceId);
            ps.setString(3, action.name());
            ps.setString(4, status.name());
            ps.setString(5, message);
            ps.setString(6, metadata);
            setLong(ps, 7, durationMs);
            setTimestamp(ps, 8, at);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record action " + action + " for: " + instanceId, e);
        }
    }

    @Override
    public List<InstanceAction> findByInstance(String instanceId) {
        String sql = "SELECT * FROM instance_actions WHERE instance_id = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, instanceId);
            List<InstanceAction> actions = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    actions.add(new InstanceAction(
                            rs.getString("id"),
                            rs.getString("instance_id"),
                            ActionType.valueOf(rs.getString("action")),
                            ActionStatus.valueOf(rs.getString("status")),
                            rs.getString("message"),
                            rs.getString("metadata"),
                            getLong(rs, "duration_ms"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return actions;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load actions for: " + instanceId, e);
        }
    }

    @Override
    public Set<ActionType> completedActions(String instanceId) {
        String sql = "SELECT DISTINCT action FROM instance_actions WHERE instance_id = ? AND status = 'SUCCESS'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, instanceId);
            Set<ActionType> done = EnumSet.noneOf(ActionType.class);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    done.add(ActionType.valueOf(rs.getString(1)));
                }
            }
            return done;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load completed actions for: " + instanceId, e);
        }
    }
}
