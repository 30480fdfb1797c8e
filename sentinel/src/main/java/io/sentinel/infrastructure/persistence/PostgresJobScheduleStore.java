package io.sentinel.infrastructure.persistence;

import io.sentinel.application.port.output.JobScheduleStore;
import io.sentinel.domain.job.ExecutionStatus;
import io.sentinel.domain.job.JobExecution;
import io.sentinel.domain.job.JobSchedule;
import io.sentinel.domain.job.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * PostgreSQL implementation of JobScheduleStore.
 *
 * Expiry applies the job type's RetryConfig after failures:
 * - no failures: due once the effective interval has elapsed
 * - failures within the retry budget: due after the backoff delay (never longer than the interval)
 * - retry budget exhausted: back to the effective interval until a success
 */
public final class PostgresJobScheduleStore implements JobScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresJobScheduleStore.class);

    public static final String ML_ENABLED_SECURITIES = "ml_enabled_securities";
    public static final String ACTIVE_SECURITIES = "active_securities";

    private static final String SCHEDULE_COLUMNS = """
        job_type, enabled, interval_minutes, interval_market_open_minutes, market_timing,
        dependencies, is_parameterized, parameter_source, parameter_field, description, category
        """;

    private final DataSource dataSource;
    private final Function<String, RetryConfig> retryConfigs;
    private final Clock clock;
    private final Map<String, Supplier<List<Map<String, Object>>>> parameterSources = new ConcurrentHashMap<>();

    public PostgresJobScheduleStore(DataSource dataSource, Function<String, RetryConfig> retryConfigs) {
        this(dataSource, retryConfigs, Clock.systemUTC());
    }

    /**
     * @param retryConfigs retry policy per job type, usually {@code registry::getRetryConfig}
     */
    public PostgresJobScheduleStore(DataSource dataSource, Function<String, RetryConfig> retryConfigs, Clock clock) {
        this.dataSource = dataSource;
        this.retryConfigs = retryConfigs;
        this.clock = clock;
        registerParameterSource(ML_ENABLED_SECURITIES,
            () -> listSecurities("SELECT symbol FROM securities WHERE ml_enabled = TRUE AND active = TRUE ORDER BY symbol"));
        registerParameterSource(ACTIVE_SECURITIES,
            () -> listSecurities("SELECT symbol FROM securities WHERE active = TRUE ORDER BY symbol"));
    }

    /**
     * Make an entity lister available to parameterized schedules under {@code name}.
     * Registering an existing name replaces it.
     */
    public void registerParameterSource(String name, Supplier<List<Map<String, Object>>> lister) {
        parameterSources.put(name, lister);
    }

    @Override
    public List<JobSchedule> getJobSchedules() {
        String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM job_schedules ORDER BY category, job_type";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<JobSchedule> schedules = new ArrayList<>();
            while (rs.next()) {
                schedules.add(mapScheduleRow(rs));
            }
            return schedules;

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to get job schedules: {}", e.getMessage());
            throw new JobStoreException("getJobSchedules", e);
        }
    }

    @Override
    public Optional<JobSchedule> getJobSchedule(String jobType) {
        String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM job_schedules WHERE job_type = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobType);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapScheduleRow(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to get job schedule {}: {}", jobType, e.getMessage());
            throw new JobStoreException("getJobSchedule", e);
        }
    }

    @Override
    public boolean isJobExpired(String jobType, boolean marketOpen) {
        String sql = """
            SELECT last_run, interval_minutes, interval_market_open_minutes, consecutive_failures
            FROM job_schedules WHERE job_type = ?
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobType);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }

                long lastRun = rs.getLong("last_run");
                if (lastRun == LAST_RUN_NEVER) {
                    return true;
                }

                int intervalMinutes = rs.getInt("interval_minutes");
                int marketOpenMinutes = rs.getInt("interval_market_open_minutes");
                boolean hasMarketOpenInterval = !rs.wasNull() && marketOpenMinutes > 0;
                int failures = rs.getInt("consecutive_failures");

                Duration interval = Duration.ofMinutes(
                    marketOpen && hasMarketOpenInterval ? marketOpenMinutes : intervalMinutes);
                Duration wait = waitAfter(jobType, failures, interval);

                long elapsedMillis = clock.millis() - lastRun * 1000L;
                return elapsedMillis >= wait.toMillis();
            }

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to check expiry of {}: {}", jobType, e.getMessage());
            throw new JobStoreException("isJobExpired", e);
        }
    }

    private Duration waitAfter(String jobType, int failures, Duration interval) {
        RetryConfig retry = retryConfigs.apply(jobType);
        return retry == null ? interval : retry.waitAfter(failures, interval);
    }

    @Override
    public void setJobLastRun(String jobType, long epochSeconds) {
        update("setJobLastRun", jobType,
            "UPDATE job_schedules SET last_run = ?, updated_at = ? WHERE job_type = ?",
            epochSeconds);
    }

    @Override
    public void markJobCompleted(String jobType) {
        update("markJobCompleted", jobType,
            "UPDATE job_schedules SET last_run = ?, consecutive_failures = 0, updated_at = ? WHERE job_type = ?",
            nowSeconds());
    }

    @Override
    public void markJobFailed(String jobType) {
        update("markJobFailed", jobType,
            "UPDATE job_schedules SET last_run = ?, consecutive_failures = consecutive_failures + 1, "
                + "updated_at = ? WHERE job_type = ?",
            nowSeconds());
    }

    private void update(String operation, String jobType, String sql, long lastRun) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, lastRun);
            ps.setLong(2, nowSeconds());
            ps.setString(3, jobType);
            int updated = ps.executeUpdate();
            if (updated == 0) {
                log.debug("[JOB STORE] {}: no schedule row for {}", operation, jobType);
            }

        } catch (SQLException e) {
            log.error("[JOB STORE] {} failed for {}: {}", operation, jobType, e.getMessage());
            throw new JobStoreException(operation, e);
        }
    }

    @Override
    public Optional<Instant> getLastJobCompletionById(String jobId) {
        return lastCompletion("getLastJobCompletionById",
            "SELECT MAX(executed_at) FROM job_history WHERE job_id = ? AND status = ?", jobId);
    }

    @Override
    public Optional<Instant> getLastJobCompletion(String jobType) {
        return lastCompletion("getLastJobCompletion",
            "SELECT MAX(executed_at) FROM job_history WHERE job_type = ? AND status = ?", jobType);
    }

    @Override
    public Optional<Instant> getLastJobFailureById(String jobId) {
        return lastExecution("getLastJobFailureById",
            "SELECT MAX(executed_at) FROM job_history WHERE job_id = ? AND status = ?",
            jobId, ExecutionStatus.FAILED);
    }

    @Override
    public int countFailuresSinceLastCompletion(String jobId) {
        String sql = """
            SELECT COUNT(*) FROM job_history
            WHERE job_id = ? AND status = ?
              AND id > COALESCE((SELECT MAX(id) FROM job_history WHERE job_id = ? AND status = ?), 0)
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, ExecutionStatus.FAILED.dbValue());
            ps.setString(3, jobId);
            ps.setString(4, ExecutionStatus.COMPLETED.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to count failures of {}: {}", jobId, e.getMessage());
            throw new JobStoreException("countFailuresSinceLastCompletion", e);
        }
    }

    private Optional<Instant> lastCompletion(String operation, String sql, String key) {
        return lastExecution(operation, sql, key, ExecutionStatus.COMPLETED);
    }

    private Optional<Instant> lastExecution(String operation, String sql, String key, ExecutionStatus status) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, status.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long executedAt = rs.getLong(1);
                    if (!rs.wasNull()) {
                        return Optional.of(Instant.ofEpochSecond(executedAt));
                    }
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            log.error("[JOB STORE] {} failed for {}: {}", operation, key, e.getMessage());
            throw new JobStoreException(operation, e);
        }
    }

    @Override
    public void logJobExecution(String jobId, String jobType, ExecutionStatus status,
                                String errorMessage, long durationMs, int retryCount) {
        String sql = """
            INSERT INTO job_history (job_id, job_type, status, error, duration_ms, executed_at, retry_count)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, jobId);
            ps.setString(idx++, jobType);
            ps.setString(idx++, status.dbValue());
            ps.setString(idx++, errorMessage);
            ps.setLong(idx++, durationMs);
            ps.setLong(idx++, nowSeconds());
            ps.setInt(idx++, retryCount);
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to log execution of {}: {}", jobId, e.getMessage());
            throw new JobStoreException("logJobExecution", e);
        }
    }

    @Override
    public List<JobExecution> getJobHistory(int limit) {
        String sql = """
            SELECT job_id, job_type, status, error, duration_ms, executed_at, retry_count
            FROM job_history
            ORDER BY executed_at DESC, id DESC
            LIMIT ?
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<JobExecution> history = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    history.add(new JobExecution(
                        rs.getString("job_id"),
                        rs.getString("job_type"),
                        ExecutionStatus.fromDbValue(rs.getString("status")),
                        rs.getString("error"),
                        rs.getLong("duration_ms"),
                        Instant.ofEpochSecond(rs.getLong("executed_at")),
                        rs.getInt("retry_count")
                    ));
                }
            }
            return history;

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to get job history: {}", e.getMessage());
            throw new JobStoreException("getJobHistory", e);
        }
    }

    @Override
    public Optional<List<Map<String, Object>>> findParameterEntities(String parameterSource) {
        if (parameterSource == null) {
            return Optional.empty();
        }
        Supplier<List<Map<String, Object>>> lister = parameterSources.get(parameterSource);
        if (lister == null) {
            return Optional.empty();
        }
        return Optional.of(lister.get());
    }

    /**
     * Insert a schedule, or update every definition column of an existing one.
     * Run state (last_run, consecutive_failures) is left untouched on update.
     */
    public void upsertJobSchedule(JobSchedule schedule) {
        String updateSql = """
            UPDATE job_schedules SET
                enabled = ?, interval_minutes = ?, interval_market_open_minutes = ?, market_timing = ?,
                dependencies = ?, is_parameterized = ?, parameter_source = ?, parameter_field = ?,
                description = ?, category = ?, updated_at = ?
            WHERE job_type = ?
            """;

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                int idx = bindDefinition(ps, schedule, 1);
                ps.setLong(idx++, nowSeconds());
                ps.setString(idx, schedule.jobType());
                updated = ps.executeUpdate();
            }

            if (updated == 0) {
                insertSchedule(conn, schedule);
                log.info("[JOB STORE] Created schedule {}", schedule.jobType());
            } else {
                log.info("[JOB STORE] Updated schedule {}", schedule.jobType());
            }

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to upsert schedule {}: {}", schedule.jobType(), e.getMessage());
            throw new JobStoreException("upsertJobSchedule", e);
        }
    }

    /**
     * Insert the given schedules if the table is empty.
     *
     * @return number of rows inserted
     */
    public int seedDefaultJobSchedules(List<JobSchedule> defaults) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM job_schedules");
                    ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getLong(1) > 0) {
                    log.info("[JOB STORE] job_schedules already populated, skipping seed");
                    return 0;
                }
            }

            for (JobSchedule schedule : defaults) {
                insertSchedule(conn, schedule);
            }
            log.info("[JOB STORE] Seeded {} default job schedules", defaults.size());
            return defaults.size();

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to seed job schedules: {}", e.getMessage());
            throw new JobStoreException("seedDefaultJobSchedules", e);
        }
    }

    private void insertSchedule(Connection conn, JobSchedule schedule) throws SQLException {
        String sql = """
            INSERT INTO job_schedules
                (enabled, interval_minutes, interval_market_open_minutes, market_timing,
                 dependencies, is_parameterized, parameter_source, parameter_field,
                 description, category, job_type, last_run, consecutive_failures, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, 0, ?, ?)
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = bindDefinition(ps, schedule, 1);
            long now = nowSeconds();
            ps.setString(idx++, schedule.jobType());
            ps.setLong(idx++, now);
            ps.setLong(idx, now);
            ps.executeUpdate();
        }
    }

    private int bindDefinition(PreparedStatement ps, JobSchedule schedule, int idx) throws SQLException {
        ps.setBoolean(idx++, schedule.enabled());
        ps.setInt(idx++, schedule.intervalMinutes());
        if (schedule.intervalMarketOpenMinutes() != null) {
            ps.setInt(idx++, schedule.intervalMarketOpenMinutes());
        } else {
            ps.setNull(idx++, Types.INTEGER);
        }
        ps.setInt(idx++, schedule.marketTiming());
        ps.setString(idx++, schedule.dependencies() == null ? "[]" : schedule.dependencies());
        ps.setBoolean(idx++, schedule.parameterized());
        ps.setString(idx++, schedule.parameterSource());
        ps.setString(idx++, schedule.parameterField());
        ps.setString(idx++, schedule.description());
        ps.setString(idx++, schedule.category());
        return idx;
    }

    private List<Map<String, Object>> listSecurities(String sql) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<Map<String, Object>> securities = new ArrayList<>();
            while (rs.next()) {
                securities.add(Map.of("symbol", rs.getString("symbol")));
            }
            return securities;

        } catch (SQLException e) {
            log.error("[JOB STORE] Failed to list securities: {}", e.getMessage());
            throw new JobStoreException("listSecurities", e);
        }
    }

    private JobSchedule mapScheduleRow(ResultSet rs) throws SQLException {
        int marketOpenMinutes = rs.getInt("interval_market_open_minutes");
        Integer intervalMarketOpen = rs.wasNull() ? null : marketOpenMinutes;

        return new JobSchedule(
            rs.getString("job_type"),
            rs.getBoolean("enabled"),
            rs.getInt("interval_minutes"),
            intervalMarketOpen,
            rs.getInt("market_timing"),
            rs.getString("dependencies"),
            rs.getBoolean("is_parameterized"),
            rs.getString("parameter_source"),
            rs.getString("parameter_field"),
            rs.getString("description"),
            rs.getString("category")
        );
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
