package opsqueue.jobs.model;

import java.time.Instant;

/**
 * Audit entry appended for each lifecycle transition of a job run.
 */
public record JobRunLog(
        String id,
        String jobRunId,
        Level level,
        String message,
        String metaJson,
        Instant createdAt) {

    public enum Level {
        INFO, WARN, ERROR;

        public String wire() {
            return name().toLowerCase();
        }

        public static Level fromWire(String value) {
            return Level.valueOf(value.toUpperCase());
        }
    }
}
