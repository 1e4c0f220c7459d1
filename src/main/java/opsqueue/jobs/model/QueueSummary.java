package opsqueue.jobs.model;

/**
 * Point-in-time counters for dashboards.
 */
public record QueueSummary(
        int queued,
        int running,
        int failed,
        int deadLetter,
        int succeeded24h,
        int staleRunning,
        int dueSchedules) {
}
