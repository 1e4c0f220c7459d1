package opsqueue.jobs.model;

/**
 * Result of putting a finished job back into the queue.
 */
public enum RequeueResult {
    /** Row is queued again */
    REQUEUED,

    /** Row not found */
    NOT_FOUND,

    /** Row is queued, running or succeeded */
    NOT_REQUEUEABLE,

    /** A newer active row already holds the same dedupe key */
    DEDUPE_CONFLICT
}
