package gpufleet.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import gpufleet.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("gpufleet-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- INSTANCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS instances (
                            id                      VARCHAR(64) PRIMARY KEY,
                            provider                VARCHAR(32) NOT NULL,
                            zone                    VARCHAR(64) NOT NULL,
                            instance_type           VARCHAR(64) NOT NULL,
                            model_id                VARCHAR(256),
                            provider_instance_id    VARCHAR(128),
                            ip_address              VARCHAR(64),
                            status                  VARCHAR(32) NOT NULL,
                            created_at              TIMESTAMP NOT NULL,
                            status_changed_at       TIMESTAMP NOT NULL,
                            boot_started_at         TIMESTAMP,
                            install_started_at      TIMESTAMP,
                            starting_started_at     TIMESTAMP,
                            ready_at                TIMESTAMP,
                            draining_started_at     TIMESTAMP,
                            terminating_started_at  TIMESTAMP,
                            terminated_at           TIMESTAMP,
                            failed_at               TIMESTAMP,
                            archived_at             TIMESTAMP,
                            error_code              VARCHAR(64),
                            error_message           VARCHAR(2048),
                            retry_count             INT DEFAULT 0 NOT NULL,
                            health_check_failures   INT DEFAULT 0 NOT NULL,
                            termination_attempts    INT DEFAULT 0 NOT NULL,
                            last_health_check       TIMESTAMP,
                            last_reconciliation     TIMESTAMP,
                            lease_until             TIMESTAMP,
                            worker_last_heartbeat   TIMESTAMP,
                            worker_status           VARCHAR(32),
                            worker_model_id         VARCHAR(256),
                            worker_vllm_port        INT,
                            worker_health_port      INT,
                            worker_queue_depth      INT,
                            worker_gpu_utilization  DOUBLE PRECISION,
                            worker_metadata         CLOB,
                            deletion_reason         VARCHAR(64),
                            deleted_by_provider     BOOLEAN DEFAULT FALSE NOT NULL,
                            is_archived             BOOLEAN DEFAULT FALSE NOT NULL
                        );
                    """);

            // ---------- STATE HISTORY (append-only) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS instance_state_history (
                            id              VARCHAR(64) PRIMARY KEY,
                            instance_id     VARCHAR(64) NOT NULL,
                            from_status     VARCHAR(32),
                            to_status       VARCHAR(32) NOT NULL,
                            reason          VARCHAR(256),
                            metadata        CLOB,
                            created_at      TIMESTAMP NOT NULL,
                            seq             BIGINT NOT NULL
                        );
                    """);

            // ---------- VOLUMES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS instance_volumes (
                            id                  VARCHAR(64) PRIMARY KEY,
                            instance_id         VARCHAR(64) NOT NULL,
                            provider_volume_id  VARCHAR(128) NOT NULL,
                            volume_type         VARCHAR(64),
                            size_bytes          BIGINT DEFAULT 0 NOT NULL,
                            is_boot             BOOLEAN DEFAULT FALSE NOT NULL,
                            delete_on_terminate BOOLEAN DEFAULT TRUE NOT NULL,
                            status              VARCHAR(16) NOT NULL,
                            created_at          TIMESTAMP NOT NULL,
                            attached_at         TIMESTAMP,
                            deleted_at          TIMESTAMP,
                            reconciled_at       TIMESTAMP,
                            last_reconciliation TIMESTAMP,
                            error_message       VARCHAR(2048)
                        );
                    """);

            // ---------- WORKER TOKENS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_auth_tokens (
                            instance_id     VARCHAR(64) PRIMARY KEY,
                            token_hash      VARCHAR(128) NOT NULL,
                            token_prefix    VARCHAR(16) NOT NULL,
                            created_at      TIMESTAMP NOT NULL,
                            last_seen_at    TIMESTAMP,
                            revoked_at      TIMESTAMP
                        );
                    """);

            // ---------- ACTION LOG ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS instance_actions (
                            id              VARCHAR(64) PRIMARY KEY,
                            instance_id     VARCHAR(64) NOT NULL,
                            action          VARCHAR(64) NOT NULL,
                            status          VARCHAR(16) NOT NULL,
                            message         VARCHAR(2048),
                            metadata        CLOB,
                            duration_ms     BIGINT,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- CATALOG ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS instance_types (
                            provider        VARCHAR(32) NOT NULL,
                            zone            VARCHAR(64) NOT NULL,
                            code            VARCHAR(64) NOT NULL,
                            name            VARCHAR(128),
                            cpu_count       INT DEFAULT 0 NOT NULL,
                            ram_gb          INT DEFAULT 0 NOT NULL,
                            gpu_count       INT DEFAULT 0 NOT NULL,
                            vram_per_gpu_gb INT DEFAULT 0 NOT NULL,
                            cost_per_hour   DOUBLE PRECISION,
                            updated_at      TIMESTAMP NOT NULL,
                            PRIMARY KEY (provider, zone, code)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_instances_status ON instances(status, last_reconciliation);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_instances_ip ON instances(ip_address);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_history_instance ON instance_state_history(instance_id, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_volumes_instance ON instance_volumes(instance_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_actions_instance ON instance_actions(instance_id, created_at);");
            st.addBatch("CREATE SEQUENCE IF NOT EXISTS history_seq;");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
