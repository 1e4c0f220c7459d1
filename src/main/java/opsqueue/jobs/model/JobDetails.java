package opsqueue.jobs.model;

import java.util.List;

/**
 * A job row together with its audit log, oldest entry first.
 */
public record JobDetails(JobRun job, List<JobRunLog> logs) {

    public JobDetails {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }
}
