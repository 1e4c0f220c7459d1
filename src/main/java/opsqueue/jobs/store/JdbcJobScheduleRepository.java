package opsqueue.jobs.store;

import opsqueue.jobs.model.CadenceType;
import opsqueue.jobs.model.JobSchedule;
import opsqueue.jobs.repository.JobScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static opsqueue.jobs.store.JdbcSupport.*;

/**
 * JDBC implementation of JobScheduleRepository.
 */
public class JdbcJobScheduleRepository implements JobScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobScheduleRepository.class);

    private final Database db;

    public JdbcJobScheduleRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(JobSchedule schedule) {
        String sql = """
                    INSERT INTO job_schedules (id, schedule_key, title, description, job_type, is_enabled, cadence_type,
                                               interval_minutes, day_of_week, day_of_month, run_hour, run_minute,
                                               timezone, payload_template, priority, max_attempts, timeout_seconds,
                                               next_run_at, last_enqueued_at, last_run_job_id, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, schedule.id());
            ps.setString(2, schedule.key());
            ps.setString(3, schedule.title());
            ps.setString(4, schedule.description());
            ps.setString(5, schedule.jobType());
            ps.setBoolean(6, schedule.enabled());
            ps.setString(7, schedule.cadenceType().wire());
            setIntOrNull(ps, 8, schedule.intervalMinutes());
            setIntOrNull(ps, 9, schedule.dayOfWeek());
            setIntOrNull(ps, 10, schedule.dayOfMonth());
            setIntOrNull(ps, 11, schedule.hour());
            setIntOrNull(ps, 12, schedule.minute());
            ps.setString(13, timezoneOrUtc(schedule));
            ps.setString(14, payloadOrEmpty(schedule));
            ps.setInt(15, schedule.priority());
            ps.setInt(16, schedule.maxAttempts());
            setIntOrNull(ps, 17, schedule.timeoutSeconds());
            setTimestamp(ps, 18, schedule.nextRunAt());
            setTimestamp(ps, 19, schedule.lastEnqueuedAt());
            ps.setString(20, schedule.lastRunJobId());
            setTimestamp(ps, 21, schedule.createdAt());
            setTimestamp(ps, 22, schedule.updatedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved schedule {}", schedule.key());
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateScheduleKeyException(schedule.key(), e);
            }
            throw new JobStoreException("Failed to save schedule: " + schedule.key(), e);
        }
    }

    @Override
    public boolean update(JobSchedule schedule) {
        String sql = """
                    UPDATE job_schedules
                    SET title = ?, description = ?, job_type = ?, is_enabled = ?, cadence_type = ?,
                        interval_minutes = ?, day_of_week = ?, day_of_month = ?, run_hour = ?, run_minute = ?,
                        timezone = ?, payload_template = ?, priority = ?, max_attempts = ?, timeout_seconds = ?,
                        next_run_at = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, schedule.title());
            ps.setString(2, schedule.description());
            ps.setString(3, schedule.jobType());
            ps.setBoolean(4, schedule.enabled());
            ps.setString(5, schedule.cadenceType().wire());
            setIntOrNull(ps, 6, schedule.intervalMinutes());
            setIntOrNull(ps, 7, schedule.dayOfWeek());
            setIntOrNull(ps, 8, schedule.dayOfMonth());
            setIntOrNull(ps, 9, schedule.hour());
            setIntOrNull(ps, 10, schedule.minute());
            ps.setString(11, timezoneOrUtc(schedule));
            ps.setString(12, payloadOrEmpty(schedule));
            ps.setInt(13, schedule.priority());
            ps.setInt(14, schedule.maxAttempts());
            setIntOrNull(ps, 15, schedule.timeoutSeconds());
            setTimestamp(ps, 16, schedule.nextRunAt());
            setTimestamp(ps, 17, schedule.updatedAt());
            ps.setString(18, schedule.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to update schedule: " + schedule.id(), e);
        }
    }

    @Override
    public Optional<JobSchedule> findById(String id) {
        String sql = "SELECT * FROM job_schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find schedule: " + id, e);
        }
    }

    @Override
    public Optional<JobSchedule> findByKey(String key) {
        String sql = "SELECT * FROM job_schedules WHERE schedule_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find schedule by key: " + key, e);
        }
    }

    @Override
    public List<JobSchedule> findAll() {
        String sql = "SELECT * FROM job_schedules ORDER BY schedule_key";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list schedules", e);
        }
    }

    @Override
    public List<JobSchedule> findDue(Instant now, int limit) {
        String sql = """
                    SELECT * FROM job_schedules
                    WHERE is_enabled = TRUE AND next_run_at IS NOT NULL AND next_run_at <= ?
                    ORDER BY next_run_at, schedule_key
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find due schedules", e);
        }
    }

    @Override
    public boolean advance(String id, Instant expectedNextRunAt, Instant nextRunAt, Instant lastEnqueuedAt,
            String lastRunJobId) {
        String sql = """
                    UPDATE job_schedules
                    SET next_run_at = ?, last_enqueued_at = ?, last_run_job_id = ?, updated_at = ?
                    WHERE id = ? AND next_run_at = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, nextRunAt);
            setTimestamp(ps, 2, lastEnqueuedAt);
            ps.setString(3, lastRunJobId);
            setTimestamp(ps, 4, lastEnqueuedAt);
            ps.setString(5, id);
            setTimestamp(ps, 6, expectedNextRunAt);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to advance schedule: " + id, e);
        }
    }

    @Override
    public int countDue(Instant now) {
        String sql = """
                    SELECT COUNT(*) FROM job_schedules
                    WHERE is_enabled = TRUE AND next_run_at IS NOT NULL AND next_run_at <= ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count due schedules", e);
        }
    }

    // Helper methods

    private static String timezoneOrUtc(JobSchedule schedule) {
        String tz = schedule.timezone();
        return tz != null && !tz.isBlank() ? tz : "UTC";
    }

    private static String payloadOrEmpty(JobSchedule schedule) {
        String payload = schedule.payloadTemplate();
        return payload != null && !payload.isBlank() ? payload : "{}";
    }

    private List<JobSchedule> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobSchedule> schedules = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
        }
        return schedules;
    }

    private JobSchedule mapRow(ResultSet rs) throws SQLException {
        return JobSchedule.builder()
                .id(rs.getString("id"))
                .key(rs.getString("schedule_key"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .jobType(rs.getString("job_type"))
                .enabled(rs.getBoolean("is_enabled"))
                .cadenceType(CadenceType.fromWire(rs.getString("cadence_type")))
                .intervalMinutes(getIntOrNull(rs, "interval_minutes"))
                .dayOfWeek(getIntOrNull(rs, "day_of_week"))
                .dayOfMonth(getIntOrNull(rs, "day_of_month"))
                .hour(getIntOrNull(rs, "run_hour"))
                .minute(getIntOrNull(rs, "run_minute"))
                .timezone(rs.getString("timezone"))
                .payloadTemplate(rs.getString("payload_template"))
                .priority(rs.getInt("priority"))
                .maxAttempts(rs.getInt("max_attempts"))
                .timeoutSeconds(getIntOrNull(rs, "timeout_seconds"))
                .nextRunAt(getInstant(rs, "next_run_at"))
                .lastEnqueuedAt(getInstant(rs, "last_enqueued_at"))
                .lastRunJobId(rs.getString("last_run_job_id"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
