package blackcap.coordinator.store;

import blackcap.coordinator.config.CoordinatorConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
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

    /** SQLState for unique/primary key violations */
    public static final String UNIQUE_VIOLATION = "23505";

    /**
     * Unit of work run inside {@link #inTransaction(SqlWork)}.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("blackcap-db-pool");
        hikariConfig.setAutoCommit(false);

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
     * Run {@code work} in a transaction: commit on success, roll back on any exception.
     * The connection is always returned to the pool. SQL failures escaping {@code work}
     * are wrapped in a RuntimeException; runtime exceptions pass through unchanged.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Database transaction failed: " + e.getMessage(), e);
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
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

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                     VARCHAR(64) PRIMARY KEY,
                            name                   VARCHAR(256),
                            owner                  VARCHAR(128) NOT NULL,
                            spec                   CLOB NOT NULL,
                            required_capabilities  VARCHAR(1024) DEFAULT '' NOT NULL,
                            status                 VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            created_at             TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at             TIMESTAMP,
                            finished_at            TIMESTAMP
                        );
                    """);

            // ---------- SCHEDULES ----------
            // active_job_id mirrors job_id while the schedule is active and is NULL once soft-deleted,
            // so the unique constraint allows one active schedule per job.
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedules (
                            id               VARCHAR(64) PRIMARY KEY,
                            job_id           VARCHAR(64) NOT NULL,
                            active_job_id    VARCHAR(64),
                            cluster_id       VARCHAR(128) NOT NULL,
                            external_job_id  VARCHAR(256),
                            created_by       VARCHAR(128),
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at       TIMESTAMP,
                            deleted_at       TIMESTAMP,
                            CONSTRAINT uq_schedules_active_job UNIQUE (active_job_id),
                            CONSTRAINT fk_schedules_job FOREIGN KEY (job_id) REFERENCES jobs(id)
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_job ON schedules(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_cluster ON schedules(cluster_id, deleted_at);");

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
