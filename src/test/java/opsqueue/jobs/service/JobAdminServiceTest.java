package opsqueue.jobs.service;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.model.CancelResult;
import opsqueue.jobs.model.Cadence;
import opsqueue.jobs.model.EnqueueRequest;
import opsqueue.jobs.model.JobDetails;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunLog;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.model.QueueSummary;
import opsqueue.jobs.model.RequeueResult;
import opsqueue.jobs.model.ScheduleDefinition;
import opsqueue.jobs.store.Database;
import opsqueue.jobs.store.JdbcJobLogRepository;
import opsqueue.jobs.store.JdbcJobRunRepository;
import opsqueue.jobs.store.JdbcJobScheduleRepository;
import opsqueue.jobs.support.MutableClock;
import opsqueue.jobs.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobAdminServiceTest {

    private static Database db;
    private static JdbcJobRunRepository runRepo;
    private static JdbcJobScheduleRepository scheduleRepo;

    private MutableClock clock;
    private EnqueueService enqueueService;
    private ScheduleService scheduleService;
    private JobAdminService admin;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-admin");
        runRepo = new JdbcJobRunRepository(db);
        scheduleRepo = new JdbcJobScheduleRepository(db);
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
        QueueConfig config = QueueConfig.defaults();
        JobAuditLog auditLog = new JobAuditLog(new JdbcJobLogRepository(db), clock);
        enqueueService = new EnqueueService(runRepo, auditLog, config, clock);
        scheduleService = new ScheduleService(scheduleRepo, runRepo, enqueueService, clock);
        admin = new JobAdminService(runRepo, scheduleRepo, auditLog, config, clock);
    }

    private String enqueue(String dedupeKey) {
        return enqueueService.enqueue(EnqueueRequest.builder(JobType.SCORE_COMPUTE)
                .maxAttempts(2)
                .dedupeKey(dedupeKey)
                .build()).id();
    }

    /** Claim and fail a job until its retry budget is spent. */
    private void deadLetter(String id) {
        while (true) {
            JobRun claimed = runRepo.tryClaim(id, "runner", clock.instant()).orElseThrow();
            if (claimed.canRetry()) {
                assertTrue(runRepo.scheduleRetry(id, "runner", claimed.attempts(), clock.instant(), "boom", "E",
                        clock.instant()));
            } else {
                assertTrue(runRepo.markDeadLetter(id, "runner", claimed.attempts(), "boom", "E", clock.instant()));
                return;
            }
        }
    }

    @Test
    void findIncludesAuditTrail() {
        String id = enqueue(null);

        JobDetails details = admin.find(id).orElseThrow();

        assertEquals(id, details.job().id());
        assertEquals(1, details.logs().size());
        assertTrue(admin.find("missing").isEmpty());
    }

    @Test
    void listFiltersByStatusAndType() {
        String a = enqueue(null);
        enqueueService.enqueue(EnqueueRequest.of(JobType.RUN_REMINDER_RULES));
        admin.cancel(a);

        assertEquals(2, admin.list(null, null, 50).size());
        assertEquals(1, admin.list(JobRunStatus.CANCELED, null, 50).size());
        assertEquals(1, admin.list(null, "run_reminder_rules", 50).size());
        assertEquals(1, admin.list(null, null, 1).size());
    }

    @Test
    void requeueDeadLetterRaisesBudgetAndResetsState() {
        String id = enqueue("score:lead:1");
        deadLetter(id);

        RequeueResult result = admin.requeue(id);

        assertEquals(RequeueResult.REQUEUED, result);
        JobRun run = runRepo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.QUEUED, run.status());
        assertEquals(2, run.attempts());
        assertEquals(3, run.maxAttempts());
        assertEquals(clock.instant(), run.runAfter());
        assertNull(run.errorMessage());
        assertNull(run.deadLetteredAt());
        assertNull(run.finishedAt());
        // The requeued row holds its dedupe key again
        assertEquals(id, runRepo.findActiveByDedupeKey("score:lead:1").orElseThrow().id());

        List<JobRunLog> logs = admin.find(id).orElseThrow().logs();
        assertEquals("Job requeued", logs.get(logs.size() - 1).message());
    }

    @Test
    void requeueCanceledKeepsBudget() {
        String id = enqueue(null);
        admin.cancel(id);

        assertEquals(RequeueResult.REQUEUED, admin.requeue(id));

        JobRun run = runRepo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.QUEUED, run.status());
        assertEquals(2, run.maxAttempts());
        assertNull(run.canceledAt());
        assertNull(run.cancelRequestedAt());
    }

    @Test
    void requeueRejectsActiveAndSucceededJobs() {
        String queued = enqueue(null);
        String succeeded = enqueue(null);
        JobRun claimed = runRepo.tryClaim(succeeded, "runner", clock.instant()).orElseThrow();
        runRepo.markSucceeded(succeeded, "runner", claimed.attempts(), null, clock.instant());

        assertEquals(RequeueResult.NOT_REQUEUEABLE, admin.requeue(queued));
        assertEquals(RequeueResult.NOT_REQUEUEABLE, admin.requeue(succeeded));
        assertEquals(RequeueResult.NOT_FOUND, admin.requeue("missing"));
    }

    @Test
    void requeueConflictsWithNewerActiveRow() {
        String old = enqueue("score:lead:1");
        deadLetter(old);
        String newer = enqueue("score:lead:1");
        assertNotEquals(old, newer);

        assertEquals(RequeueResult.DEDUPE_CONFLICT, admin.requeue(old));
        assertEquals(JobRunStatus.DEAD_LETTER, runRepo.findById(old).orElseThrow().status());
    }

    @Test
    void cancelQueuedJob() {
        String id = enqueue("score:lead:1");

        assertEquals(CancelResult.CANCELED, admin.cancel(id));

        JobRun run = runRepo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.CANCELED, run.status());
        assertNotNull(run.canceledAt());
        assertNotNull(run.finishedAt());
        assertTrue(runRepo.findActiveByDedupeKey("score:lead:1").isEmpty());
    }

    @Test
    void cancelRunningJobOnlyRequestsIt() {
        String id = enqueue(null);
        runRepo.tryClaim(id, "runner", clock.instant()).orElseThrow();

        assertEquals(CancelResult.CANCEL_REQUESTED, admin.cancel(id));

        JobRun run = runRepo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.RUNNING, run.status());
        assertTrue(run.isCancelRequested());
    }

    @Test
    void cancelFinishedOrMissingJob() {
        String id = enqueue(null);
        admin.cancel(id);

        assertEquals(CancelResult.ALREADY_TERMINAL, admin.cancel(id));
        assertEquals(CancelResult.NOT_FOUND, admin.cancel("missing"));
    }

    @Test
    void summaryCountsQueueState() {
        enqueue(null);
        String running = enqueue(null);
        String stale = enqueue(null);
        String done = enqueue(null);
        String dead = enqueue(null);

        Instant start = clock.instant();
        runRepo.tryClaim(stale, "old-runner", start).orElseThrow();
        clock.advance(Duration.ofMinutes(20));
        runRepo.tryClaim(running, "runner", clock.instant()).orElseThrow();
        JobRun claimed = runRepo.tryClaim(done, "runner", clock.instant()).orElseThrow();
        runRepo.markSucceeded(done, "runner", claimed.attempts(), null, clock.instant());
        deadLetter(dead);

        scheduleService.create(ScheduleDefinition.of("due-soon", JobType.RUN_REMINDER_RULES, Cadence.interval(5)));
        clock.advance(Duration.ofMinutes(5));

        QueueSummary summary = admin.summary();

        assertEquals(1, summary.queued());
        assertEquals(2, summary.running());
        assertEquals(0, summary.failed());
        assertEquals(1, summary.deadLetter());
        assertEquals(1, summary.succeeded24h());
        assertEquals(1, summary.staleRunning());
        assertEquals(1, summary.dueSchedules());
    }
}
