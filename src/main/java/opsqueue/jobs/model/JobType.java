package opsqueue.jobs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Every job kind the queue knows how to dispatch.
 *
 * <p>
 * Rows store the wire name; the handler for each kind is registered in
 * {@link opsqueue.jobs.handler.JobHandlerRegistry}, which refuses to start
 * with a kind left unmapped.
 */
public enum JobType {

    /** Weekly pipeline metrics snapshot. */
    CAPTURE_METRICS_SNAPSHOT("capture_metrics_snapshot"),

    /** Daily operator score snapshot. */
    CAPTURE_OPERATOR_SCORE_SNAPSHOT("capture_operator_score_snapshot"),

    /** Revenue forecast snapshot. */
    CAPTURE_FORECAST_SNAPSHOT("capture_forecast_snapshot"),

    /** Evaluate reminder rules against open leads and projects. */
    RUN_REMINDER_RULES("run_reminder_rules"),

    /** Produce automation suggestions from recent activity. */
    GENERATE_AUTOMATION_SUGGESTIONS("generate_automation_suggestions"),

    /** Deliver pending notifications. */
    NOTIFICATIONS_DISPATCH_PENDING("notifications.dispatch_pending"),

    /** Escalate notifications left unacknowledged. */
    NOTIFICATIONS_EVALUATE_ESCALATIONS("notifications.evaluate_escalations"),

    /** Recompute the score of one entity. */
    SCORE_COMPUTE("score.compute"),

    /** Re-send deliveries that failed for a next action. */
    RETRY_FAILED_DELIVERIES("retry_failed_deliveries");

    private final String wire;

    JobType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Resolve a stored or requested job type name.
     *
     * @return empty when the name matches no known kind
     */
    public static Optional<JobType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (JobType type : values()) {
            if (type.wire.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static JobType parse(String value) {
        return fromWire(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job type: " + value));
    }
}
