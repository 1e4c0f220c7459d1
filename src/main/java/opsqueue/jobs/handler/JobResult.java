package opsqueue.jobs.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a handler reports back when it returns normally.
 *
 * @param outcome completed or stopped on request
 * @param data    result object stored on the row (may be empty)
 */
public record JobResult(Outcome outcome, Map<String, Object> data) {

    public enum Outcome {
        SUCCEEDED, CANCELED
    }

    public JobResult {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static JobResult success() {
        return new JobResult(Outcome.SUCCEEDED, Map.of());
    }

    public static JobResult success(Map<String, Object> data) {
        return new JobResult(Outcome.SUCCEEDED, data);
    }

    /** Handler saw the cancel flag and stopped early */
    public static JobResult canceled() {
        return new JobResult(Outcome.CANCELED, Map.of());
    }

    public boolean isCanceled() {
        return outcome == Outcome.CANCELED;
    }
}
