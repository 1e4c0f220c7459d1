package opsqueue.jobs.store;

import opsqueue.jobs.model.JobRunLog;
import opsqueue.jobs.repository.JobLogRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static opsqueue.jobs.store.JdbcSupport.*;

/**
 * JDBC implementation of JobLogRepository.
 */
public class JdbcJobLogRepository implements JobLogRepository {

    private final Database db;

    public JdbcJobLogRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(JobRunLog entry) {
        String sql = """
                    INSERT INTO job_run_logs (id, job_run_id, log_level, message, meta_json, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.id());
            ps.setString(2, entry.jobRunId());
            ps.setString(3, entry.level().wire());
            ps.setString(4, truncate(entry.message(), JdbcJobRunRepository.ERROR_MESSAGE_MAX));
            ps.setString(5, entry.metaJson());
            setTimestamp(ps, 6, entry.createdAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to append log for job run: " + entry.jobRunId(), e);
        }
    }

    @Override
    public List<JobRunLog> findByJobRunId(String jobRunId) {
        String sql = "SELECT * FROM job_run_logs WHERE job_run_id = ? ORDER BY created_at, seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobRunId);
            List<JobRunLog> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new JobRunLog(
                            rs.getString("id"),
                            rs.getString("job_run_id"),
                            JobRunLog.Level.fromWire(rs.getString("log_level")),
                            rs.getString("message"),
                            rs.getString("meta_json"),
                            getInstant(rs, "created_at")));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find logs for job run: " + jobRunId, e);
        }
    }
}
