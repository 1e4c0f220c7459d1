package opsqueue.jobs.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import opsqueue.jobs.config.QueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit off, so every caller commits or rolls back explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    /** SQLState for unique constraint violations (H2 and PostgreSQL) */
    public static final String UNIQUE_VIOLATION = "23505";

    private final HikariDataSource dataSource;

    public Database(QueueConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("opsqueue-db-pool");
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

    /**
     * Create tables and indexes if they do not exist yet.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOB RUNS ----------
            // dedupe_slot mirrors dedupe_key while the row is queued or running
            // and is NULL otherwise, so the unique index only spans active rows.
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_runs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            job_type            VARCHAR(128) NOT NULL,
                            payload             CLOB NOT NULL,
                            priority            INT DEFAULT 0 NOT NULL,
                            status              VARCHAR(20) DEFAULT 'queued' NOT NULL,
                            attempts            INT DEFAULT 0 NOT NULL,
                            max_attempts        INT DEFAULT 3 NOT NULL,
                            run_after           TIMESTAMP NOT NULL,
                            locked_at           TIMESTAMP,
                            lock_owner          VARCHAR(256),
                            heartbeat_at        TIMESTAMP,
                            started_at          TIMESTAMP,
                            finished_at         TIMESTAMP,
                            timeout_seconds     INT,
                            dedupe_key          VARCHAR(512),
                            dedupe_slot         VARCHAR(512),
                            error_message       VARCHAR(2048),
                            error_code          VARCHAR(128),
                            last_error_at       TIMESTAMP,
                            dead_lettered_at    TIMESTAMP,
                            cancel_requested_at TIMESTAMP,
                            canceled_at         TIMESTAMP,
                            result_json         CLOB,
                            source_type         VARCHAR(64),
                            source_id           VARCHAR(128),
                            created_by_user_id  VARCHAR(128),
                            created_at          TIMESTAMP NOT NULL,
                            updated_at          TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- JOB SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_schedules (
                            id                  VARCHAR(64) PRIMARY KEY,
                            schedule_key        VARCHAR(256) NOT NULL,
                            title               VARCHAR(256) NOT NULL,
                            description         VARCHAR(2048),
                            job_type            VARCHAR(128) NOT NULL,
                            is_enabled          BOOLEAN DEFAULT TRUE NOT NULL,
                            cadence_type        VARCHAR(20) NOT NULL,
                            interval_minutes    INT,
                            day_of_week         INT,
                            day_of_month        INT,
                            run_hour            INT,
                            run_minute          INT,
                            timezone            VARCHAR(64) DEFAULT 'UTC' NOT NULL,
                            payload_template    CLOB NOT NULL,
                            priority            INT DEFAULT 50 NOT NULL,
                            max_attempts        INT DEFAULT 3 NOT NULL,
                            timeout_seconds     INT,
                            next_run_at         TIMESTAMP,
                            last_enqueued_at    TIMESTAMP,
                            last_run_job_id     VARCHAR(64),
                            created_at          TIMESTAMP NOT NULL,
                            updated_at          TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- JOB RUN LOGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_run_logs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            seq                 BIGINT GENERATED BY DEFAULT AS IDENTITY,
                            job_run_id          VARCHAR(64) NOT NULL,
                            log_level           VARCHAR(10) NOT NULL,
                            message             VARCHAR(2048) NOT NULL,
                            meta_json           CLOB,
                            created_at          TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE UNIQUE INDEX IF NOT EXISTS ux_job_runs_dedupe_slot ON job_runs(dedupe_slot);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_job_runs_claim ON job_runs(status, run_after, priority DESC, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_runs_locked ON job_runs(status, locked_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_runs_dedupe_key ON job_runs(dedupe_key);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_runs_type ON job_runs(job_type, created_at);");
            st.addBatch(
                    "CREATE UNIQUE INDEX IF NOT EXISTS ux_job_schedules_key ON job_schedules(schedule_key);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_job_schedules_due ON job_schedules(is_enabled, next_run_at);");
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_job_run_logs_run ON job_run_logs(job_run_id, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new JobStoreException("Failed to initialize database schema", e);
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
