package gpufleet.orchestrator.store;

import gpufleet.cloud.provider.AttachedVolume;
import gpufleet.orchestrator.model.InstanceVolume;
import gpufleet.orchestrator.model.VolumeStatus;
import gpufleet.orchestrator.repository.VolumeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static gpufleet.orchestrator.store.JdbcSupport.*;

/**
 * JDBC implementation of VolumeRepository.
 */
public class JdbcVolumeRepository implements VolumeRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcVolumeRepository.class);

    private final Database db;

    public JdbcVolumeRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean upsertDiscovered(String instanceId, AttachedVolume volume, Instant at) {
        String touchSql = """
                    UPDATE instance_volumes SET reconciled_at = ?
                    WHERE instance_id = ? AND provider_volume_id = ? AND status <> 'deleted'
                """;
        String insertSql = """
                    INSERT INTO instance_volumes (id, instance_id, provider_volume_id, volume_type, size_bytes,
                        is_boot, delete_on_terminate, status, created_at, attached_at, reconciled_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, 'attached', ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int touched;
                try (PreparedStatement ps = conn.prepareStatement(touchSql)) {
                    setTimestamp(ps, 1, at);
                    ps.setString(2, instanceId);
                    ps.setString(3, volume.providerVolumeId());
                    touched = ps.executeUpdate();
                }

                if (touched == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, newId());
                        ps.setString(2, instanceId);
                        ps.setString(3, volume.providerVolumeId());
                        ps.setString(4, volume.volumeType());
                        ps.setLong(5, volume.sizeBytes());
                        ps.setBoolean(6, volume.boot());
                        ps.setBoolean(7, volume.deleteOnTerminate());
                        setTimestamp(ps, 8, at);
                        setTimestamp(ps, 9, at);
                        setTimestamp(ps, 10, at);
                        ps.executeUpdate();
                    }
                    log.info("Tracking volume {} of instance {} (deleteOnTerminate={})",
                            volume.providerVolumeId(), instanceId, volume.deleteOnTerminate());
                }

                conn.commit();
                return touched == 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert volume " + volume.providerVolumeId(), e);
        }
    }

    @Override
    public List<InstanceVolume> findByInstance(String instanceId) {
        return query("SELECT * FROM instance_volumes WHERE instance_id = ? ORDER BY created_at", instanceId);
    }

    @Override
    public List<InstanceVolume> findPendingDeletion(String instanceId) {
        return query("""
                    SELECT * FROM instance_volumes
                    WHERE instance_id = ? AND delete_on_terminate = TRUE AND status <> 'deleted'
                    ORDER BY created_at
                """, instanceId);
    }

    @Override
    public List<InstanceVolume> claimLeftovers(Instant now, Duration lease, int limit) {
        String selectSql = """
                    SELECT * FROM instance_volumes
                    WHERE delete_on_terminate = TRUE AND status <> 'deleted'
                      AND instance_id IN (SELECT id FROM instances WHERE status IN ('terminated', 'archived'))
                      AND (last_reconciliation IS NULL OR last_reconciliation < ?)
                    ORDER BY created_at LIMIT ? FOR UPDATE SKIP LOCKED
                """;
        String updateSql = "UPDATE instance_volumes SET last_reconciliation = ? WHERE id = ?";

        List<InstanceVolume> claimed = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {
                setTimestamp(selectPs, 1, now.minus(lease));
                selectPs.setInt(2, limit);

                try (ResultSet rs = selectPs.executeQuery()) {
                    while (rs.next()) {
                        InstanceVolume volume = mapRow(rs);
                        setTimestamp(updatePs, 1, now);
                        updatePs.setString(2, volume.id());
                        updatePs.addBatch();
                        claimed.add(volume);
                    }
                }

                if (!claimed.isEmpty()) {
                    updatePs.executeBatch();
                }
                conn.commit();
                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim leftover volumes", e);
        }
    }

    @Override
    public boolean markDeleted(String volumeId, Instant at) {
        String sql = """
                    UPDATE instance_volumes SET status = 'deleted', deleted_at = ?, error_message = NULL
                    WHERE id = ? AND status <> 'deleted'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, at);
            ps.setString(2, volumeId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark volume deleted: " + volumeId, e);
        }
    }

    @Override
    public void recordError(String volumeId, String errorMessage) {
        String sql = "UPDATE instance_volumes SET error_message = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, errorMessage);
            ps.setString(2, volumeId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record volume error: " + volumeId, e);
        }
    }

    private List<InstanceVolume> query(String sql, String instanceId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, instanceId);
            List<InstanceVolume> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load volumes for instance: " + instanceId, e);
        }
    }

    private InstanceVolume mapRow(ResultSet rs) throws SQLException {
        return new InstanceVolume(
                rs.getString("id"),
                rs.getString("instance_id"),
                rs.getString("provider_volume_id"),
                rs.getString("volume_type"),
                rs.getLong("size_bytes"),
                rs.getBoolean("is_boot"),
                rs.getBoolean("delete_on_terminate"),
                VolumeStatus.fromDb(rs.getString("status")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("attached_at")),
                toInstant(rs.getTimestamp("deleted_at")),
                toInstant(rs.getTimestamp("reconciled_at")),
                rs.getString("error_message"));
    }
}
