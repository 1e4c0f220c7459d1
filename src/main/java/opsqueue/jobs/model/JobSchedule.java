package opsqueue.jobs.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Immutable snapshot of a recurring job definition (job_schedules row).
 */
public final class JobSchedule {
    private final String id;
    private final String key;
    private final String title;
    private final String description;
    private final String jobType;
    private final boolean enabled;
    private final CadenceType cadenceType;
    private final Integer intervalMinutes;
    private final Integer dayOfWeek;
    private final Integer dayOfMonth;
    private final Integer hour;
    private final Integer minute;
    private final String timezone;
    private final String payloadTemplate; // JSON object
    private final int priority;
    private final int maxAttempts;
    private final Integer timeoutSeconds;
    private final Instant nextRunAt;
    private final Instant lastEnqueuedAt;
    private final String lastRunJobId;
    private final Instant createdAt;
    private final Instant updatedAt;

    private JobSchedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.key = Objects.requireNonNull(builder.key, "key is required");
        this.title = builder.title != null ? builder.title : builder.key;
        this.description = builder.description;
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.enabled = builder.enabled;
        this.cadenceType = Objects.requireNonNull(builder.cadenceType, "cadenceType is required");
        this.intervalMinutes = builder.intervalMinutes;
        this.dayOfWeek = builder.dayOfWeek;
        this.dayOfMonth = builder.dayOfMonth;
        this.hour = builder.hour;
        this.minute = builder.minute;
        this.timezone = builder.timezone;
        this.payloadTemplate = builder.payloadTemplate;
        this.priority = builder.priority;
        this.maxAttempts = builder.maxAttempts;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.nextRunAt = builder.nextRunAt;
        this.lastEnqueuedAt = builder.lastEnqueuedAt;
        this.lastRunJobId = builder.lastRunJobId;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String key() {
        return key;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String jobType() {
        return jobType;
    }

    public boolean enabled() {
        return enabled;
    }

    public CadenceType cadenceType() {
        return cadenceType;
    }

    public Integer intervalMinutes() {
        return intervalMinutes;
    }

    public Integer dayOfWeek() {
        return dayOfWeek;
    }

    public Integer dayOfMonth() {
        return dayOfMonth;
    }

    public Integer hour() {
        return hour;
    }

    public Integer minute() {
        return minute;
    }

    public String timezone() {
        return timezone;
    }

    public String payloadTemplate() {
        return payloadTemplate;
    }

    public int priority() {
        return priority;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public Instant nextRunAt() {
        return nextRunAt;
    }

    public Instant lastEnqueuedAt() {
        return lastEnqueuedAt;
    }

    public String lastRunJobId() {
        return lastRunJobId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** The recurrence rule described by this schedule's cadence columns */
    public Cadence cadence() {
        return new Cadence(cadenceType, intervalMinutes, dayOfWeek, dayOfMonth, hour, minute,
                Cadence.zoneOf(timezone));
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .key(key)
                .title(title)
                .description(description)
                .jobType(jobType)
                .enabled(enabled)
                .cadenceType(cadenceType)
                .intervalMinutes(intervalMinutes)
                .dayOfWeek(dayOfWeek)
                .dayOfMonth(dayOfMonth)
                .hour(hour)
                .minute(minute)
                .timezone(timezone)
                .payloadTemplate(payloadTemplate)
                .priority(priority)
                .maxAttempts(maxAttempts)
                .timeoutSeconds(timeoutSeconds)
                .nextRunAt(nextRunAt)
                .lastEnqueuedAt(lastEnqueuedAt)
                .lastRunJobId(lastRunJobId)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String key;
        private String title;
        private String description;
        private String jobType;
        private boolean enabled = true;
        private CadenceType cadenceType;
        private Integer intervalMinutes;
        private Integer dayOfWeek;
        private Integer dayOfMonth;
        private Integer hour;
        private Integer minute;
        private String timezone;
        private String payloadTemplate;
        private int priority = 50;
        private int maxAttempts = 3;
        private Integer timeoutSeconds;
        private Instant nextRunAt;
        private Instant lastEnqueuedAt;
        private String lastRunJobId;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
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

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder cadenceType(CadenceType cadenceType) {
            this.cadenceType = cadenceType;
            return this;
        }

        public Builder cadence(Cadence cadence) {
            this.cadenceType = cadence.type();
            this.intervalMinutes = cadence.intervalMinutes();
            this.dayOfWeek = cadence.dayOfWeek();
            this.dayOfMonth = cadence.dayOfMonth();
            this.hour = cadence.hour();
            this.minute = cadence.minute();
            this.timezone = ZoneOffset.UTC.equals(cadence.zone()) ? "UTC" : cadence.zone().getId();
            return this;
        }

        public Builder intervalMinutes(Integer intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
            return this;
        }

        public Builder dayOfWeek(Integer dayOfWeek) {
            this.dayOfWeek = dayOfWeek;
            return this;
        }

        public Builder dayOfMonth(Integer dayOfMonth) {
            this.dayOfMonth = dayOfMonth;
            return this;
        }

        public Builder hour(Integer hour) {
            this.hour = hour;
            return this;
        }

        public Builder minute(Integer minute) {
            this.minute = minute;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder payloadTemplate(String payloadTemplate) {
            this.payloadTemplate = payloadTemplate;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder lastEnqueuedAt(Instant lastEnqueuedAt) {
            this.lastEnqueuedAt = lastEnqueuedAt;
            return this;
        }

        public Builder lastRunJobId(String lastRunJobId) {
            this.lastRunJobId = lastRunJobId;
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

        public JobSchedule build() {
            return new JobSchedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobSchedule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobSchedule{key='" + key + "', jobType='" + jobType + "', cadence=" + cadenceType
                + ", enabled=" + enabled + ", nextRunAt=" + nextRunAt + "}";
    }
}
