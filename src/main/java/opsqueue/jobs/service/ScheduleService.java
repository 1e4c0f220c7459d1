package opsqueue.jobs.service;

import opsqueue.jobs.model.Cadence;
import opsqueue.jobs.model.EnqueueDueResult;
import opsqueue.jobs.model.EnqueueRequest;
import opsqueue.jobs.model.EnqueueResult;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobSchedule;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.model.ScheduleDefinition;
import opsqueue.jobs.model.SchedulePatch;
import opsqueue.jobs.repository.JobRunRepository;
import opsqueue.jobs.repository.JobScheduleRepository;
import opsqueue.jobs.scheduler.CadenceCalculator;
import opsqueue.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Recurring job definitions: administration and the due-schedule pass.
 *
 * <p>
 * A due schedule produces one job per due window. The window is encoded in
 * the dedupe key ({@code schedule:<key>:<due epoch seconds>}), so a second
 * pass over the same window finds the existing job instead of creating one.
 * Advancing {@code next_run_at} is a compare-and-swap on the value that was
 * read; two concurrent passes advance a schedule once.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 50;
    public static final String SOURCE_TYPE = "schedule";

    /** How far a schedule with an unusable stored cadence is pushed back */
    static final Duration INVALID_CADENCE_BACKOFF = Duration.ofDays(1);

    private final JobScheduleRepository scheduleRepository;
    private final JobRunRepository jobRunRepository;
    private final EnqueueService enqueueService;
    private final Clock clock;

    public ScheduleService(JobScheduleRepository scheduleRepository, JobRunRepository jobRunRepository,
            EnqueueService enqueueService, Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.jobRunRepository = jobRunRepository;
        this.enqueueService = enqueueService;
        this.clock = clock;
    }

    // ---------- due-schedule pass ----------

    public EnqueueDueResult enqueueDueSchedules(int limit) {
        return enqueueDueSchedules(now(), limit);
    }

    /**
     * Enqueue one job for every enabled schedule due at {@code now}, up to
     * {@code limit} schedules (clamped to 1..50).
     *
     * @throws opsqueue.jobs.store.JobStoreException on store failure
     */
    public EnqueueDueResult enqueueDueSchedules(Instant now, int limit) {
        Instant at = now.truncatedTo(ChronoUnit.MILLIS);
        List<JobSchedule> due = scheduleRepository.findDue(at, Math.max(1, Math.min(MAX_LIMIT, limit)));

        if (due.isEmpty()) {
            log.debug("No schedules due at {}", at);
            return new EnqueueDueResult(0, 0, List.of());
        }

        List<String> created = new ArrayList<>();
        for (JobSchedule schedule : due) {
            enqueueOne(schedule, at).ifPresent(created::add);
        }

        log.info("Due schedules: {} due, {} jobs enqueued", due.size(), created.size());
        return new EnqueueDueResult(due.size(), created.size(), created);
    }

    /**
     * @return id of the job created for this window, empty if none was created
     */
    private Optional<String> enqueueOne(JobSchedule schedule, Instant now) {
        Instant nextRunAt;
        try {
            nextRunAt = CadenceCalculator.computeNextRunAt(schedule.cadence(), now);
        } catch (IllegalArgumentException e) {
            // Still advanced, so the row cannot sit at the head of the due query forever.
            Instant retryAt = now.plus(INVALID_CADENCE_BACKOFF);
            log.error("Schedule {} has an invalid cadence, window skipped; next check at {}: {}", schedule.key(),
                    retryAt, e.getMessage());
            advance(schedule, retryAt, now, schedule.lastRunJobId());
            return Optional.empty();
        }

        Optional<JobType> jobType = JobType.fromWire(schedule.jobType());
        if (jobType.isEmpty()) {
            log.error("Schedule {} names unknown job type {}, window skipped", schedule.key(), schedule.jobType());
            advance(schedule, nextRunAt, now, schedule.lastRunJobId());
            return Optional.empty();
        }

        String dedupeKey = dedupeKey(schedule);

        // A job for this window may already have finished; its key is free again but the window is done.
        Optional<JobRun> existing = jobRunRepository.findLatestByDedupeKey(dedupeKey);
        if (existing.isPresent()) {
            log.debug("Schedule {} window {} already has job {}", schedule.key(), schedule.nextRunAt(),
                    existing.get().id());
            advance(schedule, nextRunAt, now, existing.get().id());
            return Optional.empty();
        }

        EnqueueResult result = enqueueService.enqueue(EnqueueRequest.builder(jobType.get())
                .payload(Json.readObject(schedule.payloadTemplate()))
                .priority(schedule.priority())
                .maxAttempts(schedule.maxAttempts())
                .timeoutSeconds(schedule.timeoutSeconds())
                .runAfter(now)
                .dedupeKey(dedupeKey)
                .source(SOURCE_TYPE, schedule.id())
                .build());

        advance(schedule, nextRunAt, now, result.id());

        if (result.created()) {
            log.info("Schedule {} enqueued job {} ({}), next run at {}", schedule.key(), result.id(),
                    schedule.jobType(), nextRunAt);
            return Optional.of(result.id());
        }
        return Optional.empty();
    }

    private void advance(JobSchedule schedule, Instant nextRunAt, Instant now, String lastRunJobId) {
        if (!scheduleRepository.advance(schedule.id(), schedule.nextRunAt(), nextRunAt, now, lastRunJobId)) {
            log.debug("Schedule {} already advanced by a concurrent pass", schedule.key());
        }
    }

    static String dedupeKey(JobSchedule schedule) {
        return "schedule:" + schedule.key() + ":" + schedule.nextRunAt().getEpochSecond();
    }

    // ---------- administration ----------

    public List<JobSchedule> list() {
        return scheduleRepository.findAll();
    }

    public Optional<JobSchedule> get(String id) {
        return scheduleRepository.findById(id);
    }

    /**
     * @throws IllegalArgumentException                           on an invalid key, cadence or limit field
     * @throws opsqueue.jobs.store.DuplicateScheduleKeyException if the key is taken
     */
    public JobSchedule create(ScheduleDefinition definition) {
        String key = definition.key();
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key is required");
        }
        Cadence cadence = definition.cadence();
        cadence.validate();

        int priority = definition.priority() != null ? definition.priority() : 50;
        int maxAttempts = definition.maxAttempts() != null ? definition.maxAttempts() : 3;
        validateLimits(maxAttempts, definition.timeoutSeconds());

        Instant now = now();
        boolean enabled = definition.enabledOrDefault();

        JobSchedule schedule = JobSchedule.builder()
                .id(UUID.randomUUID().toString())
                .key(key.trim())
                .title(definition.title())
                .description(definition.description())
                .jobType(definition.jobType())
                .enabled(enabled)
                .cadence(cadence)
                .payloadTemplate(Json.write(definition.payloadTemplate()))
                .priority(priority)
                .maxAttempts(maxAttempts)
                .timeoutSeconds(definition.timeoutSeconds())
                .nextRunAt(enabled ? CadenceCalculator.computeNextRunAt(cadence, now) : null)
                .createdAt(now)
                .updatedAt(now)
                .build();

        scheduleRepository.insert(schedule);
        log.info("Created schedule {} ({}, {}), next run at {}", schedule.key(), schedule.jobType(),
                schedule.cadenceType().wire(), schedule.nextRunAt());
        return schedule;
    }

    /**
     * Apply a partial update. Changing the cadence or re-enabling recomputes
     * next_run_at from now; disabling leaves it as it was.
     *
     * @return the updated schedule, empty if it does not exist
     */
    public Optional<JobSchedule> update(String id, SchedulePatch patch) {
        Optional<JobSchedule> found = scheduleRepository.findById(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        JobSchedule current = found.get();
        JobSchedule.Builder next = current.toBuilder();

        if (patch.title() != null) {
            next.title(patch.title());
        }
        if (patch.description() != null) {
            next.description(patch.description());
        }
        if (patch.payloadTemplate() != null) {
            next.payloadTemplate(Json.write(patch.payloadTemplate()));
        }
        if (patch.priority() != null) {
            next.priority(patch.priority());
        }
        if (patch.maxAttempts() != null) {
            next.maxAttempts(patch.maxAttempts());
        }
        if (patch.clearTimeout()) {
            next.timeoutSeconds(null);
        } else if (patch.timeoutSeconds() != null) {
            next.timeoutSeconds(patch.timeoutSeconds());
        }
        validateLimits(patch.maxAttempts() != null ? patch.maxAttempts() : current.maxAttempts(),
                patch.timeoutSeconds());

        Cadence cadence = current.cadence();
        if (patch.changesCadence()) {
            cadence = new Cadence(
                    patch.cadenceType() != null ? patch.cadenceType() : current.cadenceType(),
                    patch.intervalMinutes() != null ? patch.intervalMinutes() : current.intervalMinutes(),
                    patch.dayOfWeek() != null ? patch.dayOfWeek() : current.dayOfWeek(),
                    patch.dayOfMonth() != null ? patch.dayOfMonth() : current.dayOfMonth(),
                    patch.hour() != null ? patch.hour() : current.hour(),
                    patch.minute() != null ? patch.minute() : current.minute(),
                    patch.timezone() != null ? Cadence.zoneOf(patch.timezone()) : Cadence.zoneOf(current.timezone()));
            cadence.validate();
            next.cadence(cadence);
        }

        boolean enabled = patch.enabled() != null ? patch.enabled() : current.enabled();
        next.enabled(enabled);

        Instant now = now();
        boolean reEnabled = enabled && !current.enabled();
        if (enabled && (patch.changesCadence() || reEnabled || current.nextRunAt() == null)) {
            next.nextRunAt(CadenceCalculator.computeNextRunAt(cadence, now));
        }
        next.updatedAt(now);

        JobSchedule updated = next.build();
        if (!scheduleRepository.update(updated)) {
            return Optional.empty();
        }
        log.info("Updated schedule {} (enabled={}, nextRunAt={})", updated.key(), updated.enabled(),
                updated.nextRunAt());
        return Optional.of(updated);
    }

    private static void validateLimits(int maxAttempts, Integer timeoutSeconds) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (timeoutSeconds != null && timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be at least 1");
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
