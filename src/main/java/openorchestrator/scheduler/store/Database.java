package openorchestrator.scheduler.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import openorchestrator.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; every repository method commits its own work.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(SchedulerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("openorchestrator-db-pool");
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

            // ---------- TRIGGERS ----------
            // One table for all kinds; kind columns are null where they do not apply.
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS triggers (
                            id                  VARCHAR(64) PRIMARY KEY,
                            name                VARCHAR(100) NOT NULL,
                            type                VARCHAR(20) NOT NULL,
                            process_name        VARCHAR(100) NOT NULL,
                            process_path        VARCHAR(250) NOT NULL,
                            process_args        VARCHAR(1000),
                            status              VARCHAR(20) DEFAULT 'IDLE' NOT NULL,
                            is_git_repo         BOOLEAN DEFAULT FALSE NOT NULL,
                            git_branch          VARCHAR(100),
                            is_blocking         BOOLEAN DEFAULT FALSE NOT NULL,
                            priority            INT DEFAULT 0 NOT NULL,
                            scheduler_whitelist VARCHAR(1000) DEFAULT '[]' NOT NULL,
                            last_run            TIMESTAMP,
                            next_run            TIMESTAMP,
                            cron_expr           VARCHAR(200),
                            queue_name          VARCHAR(200),
                            min_batch_size      INT
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            process_name    VARCHAR(100) NOT NULL,
                            scheduler_name  VARCHAR(100) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'RUNNING' NOT NULL,
                            start_time      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            end_time        TIMESTAMP
                        );
                    """);

            // ---------- LOGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS logs (
                            id              VARCHAR(64) PRIMARY KEY,
                            log_time        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            log_level       VARCHAR(10) NOT NULL,
                            process_name    VARCHAR(100) NOT NULL,
                            job_id          VARCHAR(64),
                            message         VARCHAR(8000) NOT NULL
                        );
                    """);

            // ---------- SCHEDULERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedulers (
                            machine_name        VARCHAR(100) PRIMARY KEY,
                            last_update         TIMESTAMP,
                            latest_trigger      VARCHAR(100),
                            last_trigger_start  TIMESTAMP
                        );
                    """);

            // ---------- QUEUE ELEMENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS queue_elements (
                            id              VARCHAR(64) PRIMARY KEY,
                            queue_name      VARCHAR(100) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'NEW' NOT NULL,
                            reference       VARCHAR(100),
                            data            VARCHAR(2000),
                            created_date    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            start_date      TIMESTAMP,
                            end_date        TIMESTAMP,
                            created_by      VARCHAR(100)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_triggers_type_status ON triggers(type, status, priority DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_start ON jobs(start_time);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_logs_time ON logs(log_time);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_name_status ON queue_elements(queue_name, status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
