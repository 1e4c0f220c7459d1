package opsqueue.jobs.handler;

import opsqueue.jobs.model.JobType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Per-attempt view of a claimed job handed to its handler.
 */
public final class JobContext {

    private final String jobId;
    private final JobType jobType;
    private final Map<String, Object> payload;
    private final int attempt;
    private final int maxAttempts;
    private final BooleanSupplier cancelCheck;
    private final BooleanSupplier leaseRenewal;

    public JobContext(String jobId, JobType jobType, Map<String, Object> payload, int attempt, int maxAttempts,
            BooleanSupplier cancelCheck, BooleanSupplier leaseRenewal) {
        this.jobId = jobId;
        this.jobType = jobType;
        this.payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
        this.cancelCheck = cancelCheck;
        this.leaseRenewal = leaseRenewal;
    }

    public String jobId() {
        return jobId;
    }

    public JobType jobType() {
        return jobType;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    /** 1-based number of this attempt */
    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }

    /**
     * Check whether someone asked to cancel this job. Reads the store.
     */
    public boolean isCancelRequested() {
        return cancelCheck.getAsBoolean();
    }

    /**
     * Renew the lease so stale-lock recovery leaves the row alone.
     *
     * @return false if the lease has been lost and the handler should stop
     */
    public boolean heartbeat() {
        return leaseRenewal.getAsBoolean();
    }
}
