package opsqueue.jobs.model;

/**
 * Counts of one stale-lock recovery pass.
 */
public record RecoveryResult(int count, int requeued, int deadLettered) {

    public static RecoveryResult empty() {
        return new RecoveryResult(0, 0, 0);
    }
}
