package io.sentinel.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Job Schedule Migration - creates the scheduling tables on startup.
 *
 * Creates two tables:
 * - job_schedules: one row per job type (interval, timing, dependencies, last run, failure streak)
 * - job_history: append-only execution log
 *
 * Timestamps are epoch seconds; last_run = 0 means never run or forced due.
 */
public final class JobScheduleMigration {
    private static final Logger log = LoggerFactory.getLogger(JobScheduleMigration.class);

    private final DataSource dataSource;

    public JobScheduleMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create missing tables and add columns introduced after the first schema.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting job scheduling tables migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "job_schedules")) {
                log.info("[MIGRATION] Creating job_schedules table...");
                createJobSchedulesTable(conn);
                log.info("[MIGRATION] job_schedules table created");
            } else {
                log.info("[MIGRATION] job_schedules table already exists");
                updateJobSchedulesSchema(conn);
            }

            if (!tableExists(conn, "job_history")) {
                log.info("[MIGRATION] Creating job_history table...");
                createJobHistoryTable(conn);
                log.info("[MIGRATION] job_history table created");
            } else {
                log.info("[MIGRATION] job_history table already exists");
                addColumnIfNotExists(conn, "job_history", "retry_count", "INT NOT NULL DEFAULT 0");
            }

            log.info("[MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Job schedule migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createJobSchedulesTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE job_schedules (
                job_type VARCHAR(100) PRIMARY KEY,
                enabled BOOLEAN NOT NULL DEFAULT TRUE,
                interval_minutes INT NOT NULL,
                interval_market_open_minutes INT,
                market_timing INT NOT NULL DEFAULT 0,
                dependencies VARCHAR(2000) NOT NULL DEFAULT '[]',
                description VARCHAR(500),
                category VARCHAR(50),

                -- Parameterized expansion
                is_parameterized BOOLEAN NOT NULL DEFAULT FALSE,
                parameter_source VARCHAR(100),
                parameter_field VARCHAR(100),

                -- Run state
                last_run BIGINT NOT NULL DEFAULT 0,
                consecutive_failures INT NOT NULL DEFAULT 0,

                created_at BIGINT NOT NULL,
                updated_at BIGINT NOT NULL
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            stmt.executeUpdate("CREATE INDEX idx_job_schedules_category ON job_schedules(category, job_type)");
        }
    }

    private void createJobHistoryTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE job_history (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                job_id VARCHAR(200) NOT NULL,
                job_type VARCHAR(100) NOT NULL,
                status VARCHAR(20) NOT NULL,
                error VARCHAR(4000),
                duration_ms BIGINT,
                executed_at BIGINT NOT NULL,
                retry_count INT NOT NULL DEFAULT 0
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
            stmt.executeUpdate("CREATE INDEX idx_job_history_job_id ON job_history(job_id, executed_at)");
            stmt.executeUpdate("CREATE INDEX idx_job_history_job_type ON job_history(job_type, status, executed_at)");
        }
    }

    /**
     * Columns added after the first job_schedules release.
     */
    private void updateJobSchedulesSchema(Connection conn) throws SQLException {
        addColumnIfNotExists(conn, "job_schedules", "last_run", "BIGINT NOT NULL DEFAULT 0");
        addColumnIfNotExists(conn, "job_schedules", "consecutive_failures", "INT NOT NULL DEFAULT 0");
        addColumnIfNotExists(conn, "job_schedules", "enabled", "BOOLEAN NOT NULL DEFAULT TRUE");
        addColumnIfNotExists(conn, "job_schedules", "dependencies", "VARCHAR(2000) NOT NULL DEFAULT '[]'");
        addColumnIfNotExists(conn, "job_schedules", "is_parameterized", "BOOLEAN NOT NULL DEFAULT FALSE");
        addColumnIfNotExists(conn, "job_schedules", "parameter_source", "VARCHAR(100)");
        addColumnIfNotExists(conn, "job_schedules", "parameter_field", "VARCHAR(100)");
    }

    private void addColumnIfNotExists(Connection conn, String tableName, String columnName,
                                      String columnDef) throws SQLException {
        if (!columnExists(conn, tableName, columnName)) {
            String sql = String.format("ALTER TABLE %s ADD COLUMN %s %s", tableName, columnName, columnDef);

            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate(sql);
                log.info("[MIGRATION] Added column: {}.{}", tableName, columnName);
            }
        }
    }

    private boolean columnExists(Connection conn, String tableName, String columnName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getColumns(null, null, tableName, columnName)) {
            return rs.next();
        }
    }
}
