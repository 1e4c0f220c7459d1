package opsqueue.jobs.repository;

import opsqueue.jobs.model.JobRunLog;

import java.util.List;

/**
 * Append-only audit trail of job run transitions.
 */
public interface JobLogRepository {

    void append(JobRunLog entry);

    /** Entries for one run, oldest first */
    List<JobRunLog> findByJobRunId(String jobRunId);
}
