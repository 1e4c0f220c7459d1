package opsqueue.jobs.model;

import java.util.List;

/**
 * Counts of one due-schedule pass.
 *
 * @param dueSchedules schedules selected as due by this pass
 * @param jobsEnqueued job rows actually created (de-duplicated calls excluded)
 * @param jobIds       ids of the created rows
 */
public record EnqueueDueResult(int dueSchedules, int jobsEnqueued, List<String> jobIds) {

    public EnqueueDueResult {
        jobIds = jobIds != null ? List.copyOf(jobIds) : List.of();
    }
}
