package opsqueue.jobs.service;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.handler.JobResult;
import opsqueue.jobs.model.EnqueueRequest;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunLog;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.model.RunResult;
import opsqueue.jobs.scheduler.StaleLockRecovery;
import opsqueue.jobs.store.Database;
import opsqueue.jobs.store.JdbcJobLogRepository;
import opsqueue.jobs.store.JdbcJobRunRepository;
import opsqueue.jobs.support.MutableClock;
import opsqueue.jobs.support.ScriptedHandlers;
import opsqueue.jobs.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {

    private static final Duration BASE = Duration.ofSeconds(30);

    private static Database db;
    private static JdbcJobRunRepository repo;

    private MutableClock clock;
    private JobAuditLog auditLog;
    private EnqueueService enqueueService;
    private ScriptedHandlers handlers;
    private JobRunner runner;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-runner");
        repo = new JdbcJobRunRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        TestDatabases.clean(db);
        clock = MutableClock.at("2026-03-02T09:00:00Z");
        auditLog = new JobAuditLog(new JdbcJobLogRepository(db), clock);
        enqueueService = new EnqueueService(repo, auditLog, QueueConfig.defaults(), clock);
        handlers = new ScriptedHandlers();
    }

    @AfterEach
    void closeRunner() {
        if (runner != null) {
            runner.close();
            runner = null;
        }
    }

    private JobRunner runner() {
        return runner(repo, QueueConfig.defaults());
    }

    private JobRunner runner(JdbcJobRunRepository repository, QueueConfig config) {
        runner = new JobRunner(repository, handlers.registry(), new BackoffPolicy(BASE, Duration.ofHours(1), () -> 0.0),
                auditLog, config, clock);
        return runner;
    }

    private String enqueue(JobType type, int priority, Integer timeoutSeconds) {
        return enqueueService.enqueue(EnqueueRequest.builder(type)
                .priority(priority)
                .timeoutSeconds(timeoutSeconds)
                .build()).id();
    }

    private String enqueue(JobType type, int maxAttempts) {
        return enqueueService.enqueue(EnqueueRequest.builder(type).maxAttempts(maxAttempts).build()).id();
    }

    private static List<String> messages(List<JobRunLog> logs) {
        return logs.stream().map(JobRunLog::message).toList();
    }

    @Test
    void successfulJobIsMarkedSucceeded() {
        handlers.on(JobType.SCORE_COMPUTE, ctx -> JobResult.success(Map.of("score", 42)));
        String id = enqueue(JobType.SCORE_COMPUTE, 3);

        RunResult result = runner().runOnce(10, "runner-a");

        assertEquals(1, result.claimed());
        assertEquals(1, result.succeeded());
        assertEquals("runner-a", result.runnerId());

        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.SUCCEEDED, run.status());
        assertEquals(1, run.attempts());
        assertNotNull(run.finishedAt());
        assertNull(run.lockOwner());
        assertTrue(run.resultJson().contains("42"));
        assertEquals(List.of("Job enqueued", "Job claimed", "Job succeeded"), messages(auditLog.entries(id)));
    }

    @Test
    void emptyResultStoresNoResultJson() {
        String id = enqueue(JobType.RUN_REMINDER_RULES, 3);

        runner().runOnce(10);

        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.SUCCEEDED, run.status());
        assertNull(run.resultJson());
    }

    @Test
    void handlerSeesPayloadAndAttempt() {
        AtomicInteger seenAttempt = new AtomicInteger();
        handlers.on(JobType.SCORE_COMPUTE, ctx -> {
            seenAttempt.set(ctx.attempt());
            assertEquals("lead-7", ctx.payload().get("entityId"));
            assertFalse(ctx.isLastAttempt());
            return JobResult.success();
        });
        enqueueService.enqueue(EnqueueRequest.builder(JobType.SCORE_COMPUTE)
                .payload(Map.of("entityId", "lead-7"))
                .build());

        RunResult result = runner().runOnce(10);

        assertEquals(1, result.succeeded());
        assertEquals(1, seenAttempt.get());
    }

    @Test
    void nothingToClaimReturnsEmptyResult() {
        RunResult result = runner().runOnce(10, "idle");

        assertEquals(0, result.claimed());
        assertEquals("idle", result.runnerId());
    }

    @Test
    void futureJobsAreNotClaimed() {
        enqueueService.enqueue(EnqueueRequest.builder(JobType.SCORE_COMPUTE)
                .runAfter(clock.instant().plus(Duration.ofMinutes(5)))
                .build());

        assertEquals(0, runner().runOnce(10).claimed());

        clock.advance(Duration.ofMinutes(5));
        assertEquals(1, runner.runOnce(10).succeeded());
    }

    @Test
    void higherPriorityRunsFirst() {
        String low = enqueueService.enqueue(EnqueueRequest.builder(JobType.SCORE_COMPUTE).priority(1).build()).id();
        String high = enqueueService.enqueue(EnqueueRequest.builder(JobType.SCORE_COMPUTE).priority(90).build()).id();

        runner().runOnce(1);

        assertEquals(List.of(high), handlers.executedJobIds());
        assertEquals(JobRunStatus.QUEUED, repo.findById(low).orElseThrow().status());
    }

    @Test
    void limitIsClamped() {
        assertEquals(1, JobRunner.clampLimit(0));
        assertEquals(1, JobRunner.clampLimit(-5));
        assertEquals(7, JobRunner.clampLimit(7));
        assertEquals(50, JobRunner.clampLimit(500));
    }

    @Test
    void failureSchedulesRetryWithBackoff() {
        handlers.failing(JobType.SCORE_COMPUTE, "upstream unavailable");
        String id = enqueue(JobType.SCORE_COMPUTE, 3);
        Instant failedAt = clock.instant();

        RunResult result = runner().runOnce(10);

        assertEquals(1, result.retried());
        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.QUEUED, run.status());
        assertEquals(1, run.attempts());
        assertEquals(failedAt.plus(BASE), run.runAfter());
        assertEquals("upstream unavailable", run.errorMessage());
        assertEquals("IllegalStateException", run.errorCode());
        assertNull(run.lockOwner());
        assertTrue(messages(auditLog.entries(id)).contains("Retry scheduled"));

        // Not runnable until the backoff has passed
        assertEquals(0, runner.runOnce(10).claimed());
        clock.advance(BASE);
        assertEquals(1, runner.runOnce(10).retried());

        JobRun second = repo.findById(id).orElseThrow();
        assertEquals(2, second.attempts());
        assertEquals(clock.instant().plus(BASE.multipliedBy(2)), second.runAfter());
    }

    @Test
    void exhaustedRetriesDeadLetter() {
        handlers.failing(JobType.SCORE_COMPUTE, "boom");
        String id = enqueueService.enqueue(EnqueueRequest.builder(JobType.SCORE_COMPUTE)
                .maxAttempts(2)
                .dedupeKey("score:lead:1")
                .build()).id();

        runner().runOnce(10);
        clock.advance(Duration.ofMinutes(1));
        RunResult result = runner.runOnce(10);

        assertEquals(1, result.deadLettered());
        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.DEAD_LETTER, run.status());
        assertEquals(2, run.attempts());
        assertNotNull(run.deadLetteredAt());
        assertNotNull(run.finishedAt());
        assertEquals("boom", run.errorMessage());
        assertTrue(messages(auditLog.entries(id)).contains("Job dead-lettered (max attempts)"));
        assertEquals(2, handlers.calls(JobType.SCORE_COMPUTE));

        // The key is free again
        assertTrue(repo.findActiveByDedupeKey("score:lead:1").isEmpty());
    }

    @Test
    void singleAttemptJobDeadLettersImmediately() {
        handlers.failing(JobType.CAPTURE_FORECAST_SNAPSHOT, "no data");
        String id = enqueue(JobType.CAPTURE_FORECAST_SNAPSHOT, 1);

        RunResult result = runner().runOnce(10);

        assertEquals(0, result.retried());
        assertEquals(1, result.deadLettered());
        assertEquals(JobRunStatus.DEAD_LETTER, repo.findById(id).orElseThrow().status());
    }

    @Test
    void slowHandlerTimesOut() {
        handlers.on(JobType.GENERATE_AUTOMATION_SUGGESTIONS, ctx -> {
            Thread.sleep(10_000);
            return JobResult.success();
        });
        String id = enqueueService.enqueue(EnqueueRequest.builder(JobType.GENERATE_AUTOMATION_SUGGESTIONS)
                .timeoutSeconds(1)
                .maxAttempts(1)
                .build()).id();

        RunResult result = runner().runOnce(10);

        assertEquals(1, result.deadLettered());
        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.DEAD_LETTER, run.status());
        assertEquals(JobTimeoutException.ERROR_CODE, run.errorCode());
    }

    @Test
    void unknownJobTypeFailsWithoutHandler() {
        Instant now = clock.instant();
        repo.insert(JobRun.builder()
                .id("legacy-1")
                .jobType("legacy.unknown")
                .payload("{}")
                .status(JobRunStatus.QUEUED)
                .maxAttempts(1)
                .runAfter(now)
                .createdAt(now)
                .updatedAt(now)
                .build());

        RunResult result = runner().runOnce(10);

        assertEquals(1, result.deadLettered());
        JobRun run = repo.findById("legacy-1").orElseThrow();
        assertEquals(JobRunStatus.DEAD_LETTER, run.status());
        assertEquals(JobRunner.UNKNOWN_JOB_TYPE, run.errorCode());
        assertTrue(run.errorMessage().contains("legacy.unknown"));
        assertTrue(handlers.executedJobIds().isEmpty());
    }

    @Test
    void cancelRequestedWhileRunningIsHonoured() {
        handlers.on(JobType.NOTIFICATIONS_DISPATCH_PENDING, ctx -> {
            repo.requestCancel(ctx.jobId(), clock.instant());
            return ctx.isCancelRequested() ? JobResult.canceled() : JobResult.success();
        });
        String id = enqueue(JobType.NOTIFICATIONS_DISPATCH_PENDING, 3);

        RunResult result = runner().runOnce(10);

        assertEquals(1, result.canceled());
        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.CANCELED, run.status());
        assertNotNull(run.canceledAt());
        assertNotNull(run.cancelRequestedAt());
    }

    @Test
    void lostLeaseLeavesRowAsRecovered() {
        handlers.on(JobType.SCORE_COMPUTE, ctx -> {
            // Another process decided the lease was stale while we ran
            repo.recoverToQueued(ctx.jobId(), ctx.attempt(), "stale", "STALE_LOCK", clock.instant());
            return JobResult.success();
        });
        String id = enqueue(JobType.SCORE_COMPUTE, 3);

        RunResult result = runner().runOnce(10);

        assertEquals(1, result.claimed());
        assertEquals(0, result.succeeded());
        assertEquals(1, result.failed());
        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.QUEUED, run.status());
        assertEquals("STALE_LOCK", run.errorCode());
    }

    @Test
    void heartbeatFailsOnceLeaseIsLost() {
        AtomicInteger renewals = new AtomicInteger();
        handlers.on(JobType.SCORE_COMPUTE, ctx -> {
            if (ctx.heartbeat()) {
                renewals.incrementAndGet();
            }
            repo.recoverToQueued(ctx.jobId(), ctx.attempt(), "stale", "STALE_LOCK", clock.instant());
            if (ctx.heartbeat()) {
                renewals.incrementAndGet();
            }
            return JobResult.success();
        });
        enqueue(JobType.SCORE_COMPUTE, 3);

        runner().runOnce(10);

        assertEquals(1, renewals.get());
    }

    @Test
    void oneFailingJobDoesNotStopTheBatch() {
        handlers.failing(JobType.RETRY_FAILED_DELIVERIES, "smtp down");
        enqueue(JobType.RETRY_FAILED_DELIVERIES, 3);
        enqueue(JobType.SCORE_COMPUTE, 3);
        enqueue(JobType.RUN_REMINDER_RULES, 3);

        RunResult result = runner().runOnce(10);

        assertEquals(3, result.claimed());
        assertEquals(2, result.succeeded());
        assertEquals(1, result.retried());
    }

    @Test
    void unserializableResultIsRetriedAndBatchContinues() {
        handlers.on(JobType.SCORE_COMPUTE, ctx -> JobResult.success(Map.of("x", new Opaque())));
        String first = enqueue(JobType.SCORE_COMPUTE, 10, null);
        String second = enqueue(JobType.RUN_REMINDER_RULES, 0, null);

        RunResult result = assertDoesNotThrow(() -> runner().runOnce(10));

        assertEquals(2, result.claimed());
        assertEquals(1, result.retried());
        assertEquals(1, result.succeeded());

        JobRun failed = repo.findById(first).orElseThrow();
        assertEquals(JobRunStatus.QUEUED, failed.status());
        assertEquals(JobRunner.RESULT_NOT_SERIALIZABLE, failed.errorCode());
        assertNull(failed.lockOwner());
        assertEquals(JobRunStatus.SUCCEEDED, repo.findById(second).orElseThrow().status());
    }

    @Test
    void handlerIgnoringInterruptDoesNotStarveLaterJobs() {
        AtomicBoolean release = new AtomicBoolean(false);
        handlers.on(JobType.SCORE_COMPUTE, ctx -> {
            while (!release.get()) {
                try {
                    Thread.sleep(20);
                } catch (InterruptedException ignored) {
                    // keeps running after being canceled
                }
            }
            return JobResult.success();
        });
        String stuck = enqueue(JobType.SCORE_COMPUTE, 10, 1);
        String next = enqueue(JobType.RUN_REMINDER_RULES, 0, 1);

        try {
            RunResult result = runner(repo, QueueConfig.defaults().withWorkerThreads(1)).runOnce(10);

            assertEquals(1, result.retried());
            assertEquals(1, result.succeeded());
            assertEquals(JobTimeoutException.ERROR_CODE, repo.findById(stuck).orElseThrow().errorCode());

            JobRun ran = repo.findById(next).orElseThrow();
            assertEquals(JobRunStatus.SUCCEEDED, ran.status());
            assertEquals(1, ran.attempts());
            assertEquals(1, handlers.calls(JobType.RUN_REMINDER_RULES));
        } finally {
            release.set(true);
        }
    }

    @Test
    void jobThatNeverGetsAWorkerKeepsItsAttempt() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        handlers.on(JobType.SCORE_COMPUTE, ctx -> {
            entered.countDown();
            release.await(30, TimeUnit.SECONDS);
            return JobResult.success();
        });
        JobRunner shared = runner(repo, QueueConfig.defaults().withWorkerThreads(1));
        String busy = enqueue(JobType.SCORE_COMPUTE, 0, 30);

        ExecutorService background = Executors.newSingleThreadExecutor();
        try {
            Future<RunResult> first = background.submit(() -> shared.runOnce(10, "runner-a"));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            String waiting = enqueue(JobType.RUN_REMINDER_RULES, 0, 1);
            RunResult second = shared.runOnce(10, "runner-b");

            assertEquals(1, second.claimed());
            assertEquals(1, second.failed());
            JobRun released = repo.findById(waiting).orElseThrow();
            assertEquals(JobRunStatus.QUEUED, released.status());
            assertEquals(0, released.attempts());
            assertNull(released.lockOwner());
            assertEquals(0, handlers.calls(JobType.RUN_REMINDER_RULES));
            assertTrue(messages(auditLog.entries(waiting)).contains("Job released (no free worker)"));

            release.countDown();
            assertEquals(1, first.get(10, TimeUnit.SECONDS).succeeded());
            assertEquals(JobRunStatus.SUCCEEDED, repo.findById(busy).orElseThrow().status());

            // Released job runs normally once a worker is free
            assertEquals(1, shared.runOnce(10, "runner-b").succeeded());
            assertEquals(1, repo.findById(waiting).orElseThrow().attempts());
        } finally {
            release.countDown();
            background.shutdownNow();
        }
    }

    @Test
    void leaseLostBeforeDispatchSkipsHandler() {
        AtomicBoolean stolen = new AtomicBoolean(false);
        JdbcJobRunRepository racing = new JdbcJobRunRepository(db) {
            @Override
            public boolean heartbeat(String id, String lockOwner, int attempts, Instant now) {
                // Recovery takes the row between the ownership check and the renewal
                if (stolen.compareAndSet(false, true)) {
                    recoverToQueued(id, attempts, "stale", StaleLockRecovery.ERROR_CODE, now);
                }
                return super.heartbeat(id, lockOwner, attempts, now);
            }
        };
        String id = enqueue(JobType.SCORE_COMPUTE, 3);

        RunResult result = runner(racing, QueueConfig.defaults()).runOnce(10);

        assertEquals(1, result.claimed());
        assertEquals(1, result.failed());
        assertEquals(0, result.succeeded());
        assertEquals(0, handlers.calls(JobType.SCORE_COMPUTE));
        JobRun run = repo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.QUEUED, run.status());
        assertEquals(StaleLockRecovery.ERROR_CODE, run.errorCode());
    }

    /** No properties, so Jackson refuses to serialize it */
    private static final class Opaque {
    }
}
