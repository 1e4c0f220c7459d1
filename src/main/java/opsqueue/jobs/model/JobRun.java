package opsqueue.jobs.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one row of the job_runs table.
 * Mutations go through the repository as conditional updates, never by
 * writing a modified copy back.
 */
public final class JobRun {
    private final String id;
    private final String jobType; // wire name, may be unknown to this build
    private final String payload; // JSON object
    private final int priority;
    private final JobRunStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final Instant runAfter;
    private final Instant lockedAt;
    private final String lockOwner;
    private final Instant heartbeatAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Integer timeoutSeconds;
    private final String dedupeKey;
    private final String errorMessage;
    private final String errorCode;
    private final Instant lastErrorAt;
    private final Instant deadLetteredAt;
    private final Instant cancelRequestedAt;
    private final Instant canceledAt;
    private final String resultJson;
    private final String sourceType;
    private final String sourceId;
    private final String createdByUserId;
    private final Instant createdAt;
    private final Instant updatedAt;

    private JobRun(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.payload = builder.payload != null ? builder.payload : "{}";
        this.priority = builder.priority;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.runAfter = builder.runAfter;
        this.lockedAt = builder.lockedAt;
        this.lockOwner = builder.lockOwner;
        this.heartbeatAt = builder.heartbeatAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.dedupeKey = builder.dedupeKey;
        this.errorMessage = builder.errorMessage;
        this.errorCode = builder.errorCode;
        this.lastErrorAt = builder.lastErrorAt;
        this.deadLetteredAt = builder.deadLetteredAt;
        this.cancelRequestedAt = builder.cancelRequestedAt;
        this.canceledAt = builder.canceledAt;
        this.resultJson = builder.resultJson;
        this.sourceType = builder.sourceType;
        this.sourceId = builder.sourceId;
        this.createdByUserId = builder.createdByUserId;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String jobType() {
        return jobType;
    }

    /** The enum kind, empty when the stored name is not known to this build */
    public Optional<JobType> type() {
        return JobType.fromWire(jobType);
    }

    public String payload() {
        return payload;
    }

    public int priority() {
        return priority;
    }

    public JobRunStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Instant runAfter() {
        return runAfter;
    }

    public Instant lockedAt() {
        return lockedAt;
    }

    public String lockOwner() {
        return lockOwner;
    }

    public Instant heartbeatAt() {
        return heartbeatAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public String dedupeKey() {
        return dedupeKey;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String errorCode() {
        return errorCode;
    }

    public Instant lastErrorAt() {
        return lastErrorAt;
    }

    public Instant deadLetteredAt() {
        return deadLetteredAt;
    }

    public Instant cancelRequestedAt() {
        return cancelRequestedAt;
    }

    public Instant canceledAt() {
        return canceledAt;
    }

    public String resultJson() {
        return resultJson;
    }

    public String sourceType() {
        return sourceType;
    }

    public String sourceId() {
        return sourceId;
    }

    public String createdByUserId() {
        return createdByUserId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if another attempt fits in the retry budget */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isCancelRequested() {
        return cancelRequestedAt != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobType;
        private String payload;
        private int priority = 0;
        private JobRunStatus status = JobRunStatus.QUEUED;
        private int attempts = 0;
        private int maxAttempts = 3;
        private Instant runAfter;
        private Instant lockedAt;
        private String lockOwner;
        private Instant heartbeatAt;
        private Instant startedAt;
        private Instant finishedAt;
        private Integer timeoutSeconds;
        private String dedupeKey;
        private String errorMessage;
        private String errorCode;
        private Instant lastErrorAt;
        private Instant deadLetteredAt;
        private Instant cancelRequestedAt;
        private Instant canceledAt;
        private String resultJson;
        private String sourceType;
        private String sourceId;
        private String createdByUserId;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder jobType(JobType jobType) {
            this.jobType = jobType.wire();
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(JobRunStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder runAfter(Instant runAfter) {
            this.runAfter = runAfter;
            return this;
        }

        public Builder lockedAt(Instant lockedAt) {
            this.lockedAt = lockedAt;
            return this;
        }

        public Builder lockOwner(String lockOwner) {
            this.lockOwner = lockOwner;
            return this;
        }

        public Builder heartbeatAt(Instant heartbeatAt) {
            this.heartbeatAt = heartbeatAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder dedupeKey(String dedupeKey) {
            this.dedupeKey = dedupeKey;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder lastErrorAt(Instant lastErrorAt) {
            this.lastErrorAt = lastErrorAt;
            return this;
        }

        public Builder deadLetteredAt(Instant deadLetteredAt) {
            this.deadLetteredAt = deadLetteredAt;
            return this;
        }

        public Builder cancelRequestedAt(Instant cancelRequestedAt) {
            this.cancelRequestedAt = cancelRequestedAt;
            return this;
        }

        public Builder canceledAt(Instant canceledAt) {
            this.canceledAt = canceledAt;
            return this;
        }

        public Builder resultJson(String resultJson) {
            this.resultJson = resultJson;
            return this;
        }

        public Builder sourceType(String sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder createdByUserId(String createdByUserId) {
            this.createdByUserId = createdByUserId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public JobRun build() {
            return new JobRun(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRun run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRun{id='" + id + "', jobType='" + jobType + "', status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
