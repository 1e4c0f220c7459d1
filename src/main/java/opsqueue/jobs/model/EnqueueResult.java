package opsqueue.jobs.model;

/**
 * Outcome of an enqueue call.
 *
 * @param id      the row that now represents the job
 * @param status  its status at the time of the call
 * @param created false when an active row with the same dedupe key was returned instead
 */
public record EnqueueResult(String id, JobRunStatus status, boolean created) {
}
