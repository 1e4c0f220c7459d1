package opsqueue.jobs.store;

import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.repository.JobRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static opsqueue.jobs.store.JdbcSupport.*;

/**
 * JDBC implementation of JobRunRepository.
 * Claims and transitions are single conditional UPDATEs; the affected row
 * count decides who won.
 */
public class JdbcJobRunRepository implements JobRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRunRepository.class);

    static final int ERROR_MESSAGE_MAX = 2048;

    private final Database db;

    public JdbcJobRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(JobRun run) {
        String sql = """
                    INSERT INTO job_runs (id, job_type, payload, priority, status, attempts, max_attempts, run_after,
                                          timeout_seconds, dedupe_key, dedupe_slot, source_type, source_id,
                                          created_by_user_id, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.id());
            ps.setString(2, run.jobType());
            ps.setString(3, run.payload());
            ps.setInt(4, run.priority());
            ps.setString(5, run.status().wire());
            ps.setInt(6, run.attempts());
            ps.setInt(7, run.maxAttempts());
            setTimestamp(ps, 8, run.runAfter());
            setIntOrNull(ps, 9, run.timeoutSeconds());
            ps.setString(10, run.dedupeKey());
            ps.setString(11, run.status().isTerminal() ? null : run.dedupeKey());
            ps.setString(12, run.sourceType());
            ps.setString(13, run.sourceId());
            ps.setString(14, run.createdByUserId());
            setTimestamp(ps, 15, run.createdAt());
            setTimestamp(ps, 16, run.updatedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            if (run.dedupeKey() != null && isUniqueViolation(e)) {
                throw new DedupeConflictException(run.dedupeKey(), e);
            }
            throw new JobStoreException("Failed to insert job run: " + run.id(), e);
        }
    }

    @Override
    public Optional<JobRun> findById(String id) {
        String sql = "SELECT * FROM job_runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find job run: " + id, e);
        }
    }

    @Override
    public Optional<JobRun> findActiveByDedupeKey(String dedupeKey) {
        String sql = "SELECT * FROM job_runs WHERE dedupe_slot = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, dedupeKey);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find job run by dedupe key: " + dedupeKey, e);
        }
    }

    @Override
    public Optional<JobRun> findLatestByDedupeKey(String dedupeKey) {
        String sql = "SELECT * FROM job_runs WHERE dedupe_key = ? ORDER BY created_at DESC LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, dedupeKey);
            return executeQuery(ps).stream().findFirst();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find job run by dedupe key: " + dedupeKey, e);
        }
    }

    @Override
    public List<JobRun> findRunnable(Instant now, int limit) {
        String sql = """
                    SELECT * FROM job_runs
                    WHERE status = 'queued' AND run_after <= ?
                    ORDER BY priority DESC, created_at, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find runnable job runs", e);
        }
    }

    @Override
    public Optional<JobRun> tryClaim(String id, String lockOwner, Instant now) {
        String updateSql = """
                    UPDATE job_runs
                    SET status = 'running', locked_at = ?, lock_owner = ?, heartbeat_at = ?, started_at = ?,
                        attempts = attempts + 1, updated_at = ?
                    WHERE id = ? AND status = 'queued' AND run_after <= ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                Timestamp ts = Timestamp.from(now);
                ps.setTimestamp(1, ts);
                ps.setString(2, lockOwner);
                ps.setTimestamp(3, ts);
                ps.setTimestamp(4, ts);
                ps.setTimestamp(5, ts);
                ps.setString(6, id);
                ps.setTimestamp(7, ts);

                if (ps.executeUpdate() == 0) {
                    conn.rollback();
                    log.debug("Job run {} already claimed elsewhere", id);
                    return Optional.empty();
                }

                Optional<JobRun> claimed;
                try (PreparedStatement select = conn.prepareStatement("SELECT * FROM job_runs WHERE id = ?")) {
                    select.setString(1, id);
                    claimed = executeQuery(select).stream().findFirst();
                }

                conn.commit();
                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to claim job run: " + id, e);
        }
    }

    @Override
    public boolean heartbeat(String id, String lockOwner, int attempts, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET locked_at = ?, heartbeat_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'running' AND lock_owner = ? AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            ps.setTimestamp(3, ts);
            ps.setString(4, id);
            ps.setString(5, lockOwner);
            ps.setInt(6, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to renew lease of job run: " + id, e);
        }
    }

    @Override
    public boolean releaseClaim(String id, String lockOwner, int attempts, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'queued', attempts = attempts - 1, run_after = ?, locked_at = NULL,
                        lock_owner = NULL, heartbeat_at = NULL, updated_at = ?
                    WHERE id = ? AND status = 'running' AND lock_owner = ? AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            ps.setString(3, id);
            ps.setString(4, lockOwner);
            ps.setInt(5, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to release claim on job run: " + id, e);
        }
    }

    @Override
    public boolean markSucceeded(String id, String lockOwner, int attempts, String resultJson, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'succeeded', finished_at = ?, result_json = ?, error_message = NULL,
                        error_code = NULL, locked_at = NULL, lock_owner = NULL, dedupe_slot = NULL, updated_at = ?
                    WHERE id = ? AND status = 'running' AND lock_owner = ? AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setString(2, resultJson);
            ps.setTimestamp(3, ts);
            ps.setString(4, id);
            ps.setString(5, lockOwner);
            ps.setInt(6, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to mark job run succeeded: " + id, e);
        }
    }

    @Override
    public boolean markCanceled(String id, String lockOwner, int attempts, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'canceled', canceled_at = ?, finished_at = ?, locked_at = NULL, lock_owner = NULL,
                        dedupe_slot = NULL, updated_at = ?
                    WHERE id = ? AND status = 'running' AND lock_owner = ? AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            ps.setTimestamp(3, ts);
            ps.setString(4, id);
            ps.setString(5, lockOwner);
            ps.setInt(6, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to mark job run canceled: " + id, e);
        }
    }

    @Override
    public boolean scheduleRetry(String id, String lockOwner, int attempts, Instant runAfter, String errorMessage,
            String errorCode, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'queued', run_after = ?, locked_at = NULL, lock_owner = NULL, heartbeat_at = NULL,
                        error_message = ?, error_code = ?, last_error_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'running' AND lock_owner = ? AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            setTimestamp(ps, 1, runAfter);
            ps.setString(2, truncate(errorMessage, ERROR_MESSAGE_MAX));
            ps.setString(3, errorCode);
            ps.setTimestamp(4, ts);
            ps.setTimestamp(5, ts);
            ps.setString(6, id);
            ps.setString(7, lockOwner);
            ps.setInt(8, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to schedule retry of job run: " + id, e);
        }
    }

    @Override
    public boolean markDeadLetter(String id, String lockOwner, int attempts, String errorMessage, String errorCode,
            Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'dead_letter', dead_lettered_at = ?, finished_at = ?, locked_at = NULL,
                        lock_owner = NULL, dedupe_slot = NULL, error_message = ?, error_code = ?, last_error_at = ?,
                        updated_at = ?
                    WHERE id = ? AND status = 'running' AND lock_owner = ? AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            ps.setString(3, truncate(errorMessage, ERROR_MESSAGE_MAX));
            ps.setString(4, errorCode);
            ps.setTimestamp(5, ts);
            ps.setTimestamp(6, ts);
            ps.setString(7, id);
            ps.setString(8, lockOwner);
            ps.setInt(9, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to dead-letter job run: " + id, e);
        }
    }

    @Override
    public List<JobRun> findStaleRunning(Instant lockedBefore, int limit) {
        String sql = """
                    SELECT * FROM job_runs
                    WHERE status = 'running'
                      AND ((locked_at IS NOT NULL AND locked_at < ?)
                           OR (locked_at IS NULL AND started_at < ?))
                    ORDER BY COALESCE(locked_at, started_at)
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, lockedBefore);
            setTimestamp(ps, 2, lockedBefore);
            ps.setInt(3, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find stale job runs", e);
        }
    }

    @Override
    public boolean recoverToQueued(String id, int attempts, String errorMessage, String errorCode, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'queued', run_after = ?, locked_at = NULL, lock_owner = NULL, heartbeat_at = NULL,
                        error_message = ?, error_code = ?, last_error_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'running' AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setString(2, truncate(errorMessage, ERROR_MESSAGE_MAX));
            ps.setString(3, errorCode);
            ps.setTimestamp(4, ts);
            ps.setTimestamp(5, ts);
            ps.setString(6, id);
            ps.setInt(7, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to requeue stale job run: " + id, e);
        }
    }

    @Override
    public boolean recoverToDeadLetter(String id, int attempts, String errorMessage, String errorCode, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'dead_letter', dead_lettered_at = ?, finished_at = ?, locked_at = NULL,
                        lock_owner = NULL, dedupe_slot = NULL, error_message = ?, error_code = ?, last_error_at = ?,
                        updated_at = ?
                    WHERE id = ? AND status = 'running' AND attempts = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            ps.setString(3, truncate(errorMessage, ERROR_MESSAGE_MAX));
            ps.setString(4, errorCode);
            ps.setTimestamp(5, ts);
            ps.setTimestamp(6, ts);
            ps.setString(7, id);
            ps.setInt(8, attempts);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to dead-letter stale job run: " + id, e);
        }
    }

    @Override
    public boolean cancelQueued(String id, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'canceled', canceled_at = ?, cancel_requested_at = COALESCE(cancel_requested_at, ?),
                        finished_at = ?, dedupe_slot = NULL, updated_at = ?
                    WHERE id = ? AND status = 'queued'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            ps.setTimestamp(3, ts);
            ps.setTimestamp(4, ts);
            ps.setString(5, id);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to cancel job run: " + id, e);
        }
    }

    @Override
    public boolean requestCancel(String id, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET cancel_requested_at = COALESCE(cancel_requested_at, ?), updated_at = ?
                    WHERE id = ? AND status = 'running'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setTimestamp(2, ts);
            ps.setString(3, id);
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to request cancel of job run: " + id, e);
        }
    }

    @Override
    public boolean requeue(String id, JobRunStatus expected, int maxAttempts, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'queued', run_after = ?, max_attempts = ?, dedupe_slot = dedupe_key,
                        error_message = NULL, error_code = NULL, dead_lettered_at = NULL, finished_at = NULL,
                        cancel_requested_at = NULL, canceled_at = NULL, locked_at = NULL, lock_owner = NULL,
                        heartbeat_at = NULL, updated_at = ?
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.from(now);
            ps.setTimestamp(1, ts);
            ps.setInt(2, maxAttempts);
            ps.setTimestamp(3, ts);
            ps.setString(4, id);
            ps.setString(5, expected.wire());
            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                String dedupeKey = findById(id).map(JobRun::dedupeKey).orElse(null);
                throw new DedupeConflictException(dedupeKey, e);
            }
            throw new JobStoreException("Failed to requeue job run: " + id, e);
        }
    }

    @Override
    public List<JobRun> find(JobRunStatus status, String jobType, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM job_runs WHERE 1 = 1");
        List<String> params = new ArrayList<>();
        if (status != null) {
            sql.append(" AND status = ?");
            params.add(status.wire());
        }
        if (jobType != null && !jobType.isBlank()) {
            sql.append(" AND job_type = ?");
            params.add(jobType);
        }
        sql.append(" ORDER BY created_at DESC, id LIMIT ?");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int index = 1;
            for (String param : params) {
                ps.setString(index++, param);
            }
            ps.setInt(index, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list job runs", e);
        }
    }

    @Override
    public Map<JobRunStatus, Integer> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS cnt FROM job_runs GROUP BY status";

        Map<JobRunStatus, Integer> counts = new EnumMap<>(JobRunStatus.class);
        for (JobRunStatus status : JobRunStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.put(JobRunStatus.fromWire(rs.getString("status")), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count job runs by status", e);
        }
    }

    @Override
    public int countSucceededSince(Instant since) {
        String sql = "SELECT COUNT(*) FROM job_runs WHERE status = 'succeeded' AND finished_at >= ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, since);
            return count(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count succeeded job runs", e);
        }
    }

    @Override
    public int countStaleRunning(Instant lockedBefore) {
        String sql = """
                    SELECT COUNT(*) FROM job_runs
                    WHERE status = 'running'
                      AND ((locked_at IS NOT NULL AND locked_at < ?)
                           OR (locked_at IS NULL AND started_at < ?))
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, lockedBefore);
            setTimestamp(ps, 2, lockedBefore);
            return count(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count stale job runs", e);
        }
    }

    // Helper methods

    private boolean commitUpdate(Connection conn, PreparedStatement ps) throws SQLException {
        int updated = ps.executeUpdate();
        conn.commit();
        return updated > 0;
    }

    private int count(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private List<JobRun> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobRun> runs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(mapRow(rs));
            }
        }
        return runs;
    }

    private JobRun mapRow(ResultSet rs) throws SQLException {
        return JobRun.builder()
                .id(rs.getString("id"))
                .jobType(rs.getString("job_type"))
                .payload(rs.getString("payload"))
                .priority(rs.getInt("priority"))
                .status(JobRunStatus.fromWire(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .runAfter(getInstant(rs, "run_after"))
                .lockedAt(getInstant(rs, "locked_at"))
                .lockOwner(rs.getString("lock_owner"))
                .heartbeatAt(getInstant(rs, "heartbeat_at"))
                .startedAt(getInstant(rs, "started_at"))
                .finishedAt(getInstant(rs, "finished_at"))
                .timeoutSeconds(getIntOrNull(rs, "timeout_seconds"))
                .dedupeKey(rs.getString("dedupe_key"))
                .errorMessage(rs.getString("error_message"))
                .errorCode(rs.getString("error_code"))
                .lastErrorAt(getInstant(rs, "last_error_at"))
                .deadLetteredAt(getInstant(rs, "dead_lettered_at"))
                .cancelRequestedAt(getInstant(rs, "cancel_requested_at"))
                .canceledAt(getInstant(rs, "canceled_at"))
                .resultJson(rs.getString("result_json"))
                .sourceType(rs.getString("source_type"))
                .sourceId(rs.getString("source_id"))
                .createdByUserId(rs.getString("created_by_user_id"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
