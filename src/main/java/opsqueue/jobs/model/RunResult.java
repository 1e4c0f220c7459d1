package opsqueue.jobs.model;

/**
 * Counts of one claim-and-execute pass.
 * {@code failed} counts rows this pass could not resolve: the lease was lost,
 * no worker thread was free (the claim is handed back), or the outcome could
 * not be written.
 */
public record RunResult(
        int claimed,
        int succeeded,
        int retried,
        int failed,
        int deadLettered,
        int canceled,
        String runnerId) {

    public static RunResult empty(String runnerId) {
        return new RunResult(0, 0, 0, 0, 0, 0, runnerId);
    }
}
