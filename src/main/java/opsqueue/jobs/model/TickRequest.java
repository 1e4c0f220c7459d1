package opsqueue.jobs.model;

/**
 * Which steps a tick performs. Null flags count as true.
 */
public record TickRequest(Boolean run, Boolean enqueueSchedules, Boolean recoverStale, Integer limit) {

    public static final int DEFAULT_LIMIT = 10;

    public static TickRequest all() {
        return new TickRequest(true, true, true, DEFAULT_LIMIT);
    }

    public boolean shouldRun() {
        return run == null || run;
    }

    public boolean shouldEnqueueSchedules() {
        return enqueueSchedules == null || enqueueSchedules;
    }

    public boolean shouldRecoverStale() {
        return recoverStale == null || recoverStale;
    }

    public int limitOrDefault() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }
}
