package opsqueue.jobs.model;

import java.util.Map;

/**
 * Partial schedule update. Null means "leave unchanged"; any non-null
 * cadence field makes the patch a cadence change. {@code clearTimeout}
 * drops the schedule's timeout so its jobs use the runner default.
 */
public record SchedulePatch(
        String title,
        String description,
        Boolean enabled,
        CadenceType cadenceType,
        Integer intervalMinutes,
        Integer dayOfWeek,
        Integer dayOfMonth,
        Integer hour,
        Integer minute,
        String timezone,
        Map<String, Object> payloadTemplate,
        Integer priority,
        Integer maxAttempts,
        Integer timeoutSeconds,
        boolean clearTimeout) {

    public static SchedulePatch enabled(boolean enabled) {
        return new SchedulePatch(null, null, enabled, null, null, null, null, null, null, null, null, null, null,
                null, false);
    }

    public static SchedulePatch cadence(Cadence cadence) {
        return new SchedulePatch(null, null, null, cadence.type(), cadence.intervalMinutes(), cadence.dayOfWeek(),
                cadence.dayOfMonth(), cadence.hour(), cadence.minute(), cadence.zone().getId(), null, null, null,
                null, false);
    }

    public static SchedulePatch clearingTimeout() {
        return new SchedulePatch(null, null, null, null, null, null, null, null, null, null, null, null, null,
                null, true);
    }

    public boolean changesCadence() {
        return cadenceType != null || intervalMinutes != null || dayOfWeek != null || dayOfMonth != null
                || hour != null || minute != null || timezone != null;
    }
}
