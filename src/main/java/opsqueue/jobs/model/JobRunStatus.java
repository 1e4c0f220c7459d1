package opsqueue.jobs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job run lifecycle status.
 * Stored in the database by its wire value.
 */
public enum JobRunStatus {
    /** Waiting to be claimed once run_after has passed */
    QUEUED("queued"),
    /** Claimed by a runner and executing */
    RUNNING("running"),
    /** Handler finished successfully */
    SUCCEEDED("succeeded"),
    /** Terminal failure recorded outside the retry budget */
    FAILED("failed"),
    /** Canceled before or during execution */
    CANCELED("canceled"),
    /** Retry budget exhausted; needs an explicit requeue */
    DEAD_LETTER("dead_letter");

    /** Statuses that occupy a dedupe key */
    public static final Set<JobRunStatus> ACTIVE = EnumSet.of(QUEUED, RUNNING);

    /** Statuses an operator may put back into the queue */
    public static final Set<JobRunStatus> REQUEUEABLE = EnumSet.of(FAILED, CANCELED, DEAD_LETTER);

    private final String wire;

    JobRunStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }

    @JsonCreator
    public static JobRunStatus fromWire(String value) {
        for (JobRunStatus status : values()) {
            if (status.wire.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
