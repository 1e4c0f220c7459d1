package opsqueue.jobs.model;

/**
 * Result of canceling a job.
 */
public enum CancelResult {
    /** Queued row canceled before it ran */
    CANCELED,

    /** Running row flagged; the runner and handler observe the flag */
    CANCEL_REQUESTED,

    /** Row not found */
    NOT_FOUND,

    /** Row had already finished - nothing to do */
    ALREADY_TERMINAL
}
