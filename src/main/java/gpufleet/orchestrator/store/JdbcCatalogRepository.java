package gpufleet.orchestrator.store;

import gpufleet.orchestrator.model.InstanceTypeEntry;
import gpufleet.orchestrator.repository.CatalogRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static gpufleet.orchestrator.store.JdbcSupport.*;

/**
 * JDBC implementation of CatalogRepository.
 */
public class JdbcCatalogRepository implements CatalogRepository {

    private final Database db;

    public JdbcCatalogRepository(Database db) {
        this.db = db;
    }

    @Override
    public int upsert(List<InstanceTypeEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }

        String sql = """
                    MERGE INTO instance_types (provider, zone, code, name, cpu_count, ram_gb, gpu_count,
                        vram_per_gpu_gb, cost_per_hour, updated_at)
                    KEY (provider, zone, code)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (InstanceTypeEntry e : entries) {
                    ps.setString(1, e.provider());
                    ps.setString(2, e.zone());
                    ps.setString(3, e.code());
                    ps.setString(4, e.name());
                    ps.setInt(5, e.cpuCount());
                    ps.setInt(6, e.ramGb());
                    ps.setInt(7, e.gpuCount());
                    ps.setInt(8, e.vramPerGpuGb());
                    setDouble(ps, 9, e.costPerHour());
                    setTimestamp(ps, 10, e.updatedAt());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
                return entries.size();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert catalog entries", e);
        }
    }

    @Override
    public List<InstanceTypeEntry> findByProvider(String provider) {
        String sql = "SELECT * FROM instance_types WHERE provider = ? ORDER BY zone, code";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, provider);
            List<InstanceTypeEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new InstanceTypeEntry(
                            rs.getString("provider"),
                            rs.getString("zone"),
                            rs.getString("code"),
                            rs.getString("name"),
                            rs.getInt("cpu_count"),
                            rs.getInt("ram_gb"),
                            rs.getInt("gpu_count"),
                            rs.getInt("vram_per_gpu_gb"),
                            getDouble(rs, "cost_per_hour"),
                            toInstant(rs.getTimestamp("updated_at"))));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load catalog for provider: " + provider, e);
        }
    }
}
