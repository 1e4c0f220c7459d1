package opsqueue.jobs.service;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.model.Cadence;
import opsqueue.jobs.model.EnqueueRequest;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.model.ScheduleDefinition;
import opsqueue.jobs.model.TickRequest;
import opsqueue.jobs.model.TickResult;
import opsqueue.jobs.scheduler.StaleLockRecovery;
import opsqueue.jobs.store.Database;
import opsqueue.jobs.store.JdbcJobLogRepository;
import opsqueue.jobs.store.JdbcJobRunRepository;
import opsqueue.jobs.store.JdbcJobScheduleRepository;
import opsqueue.jobs.support.MutableClock;
import opsqueue.jobs.support.ScriptedHandlers;
import opsqueue.jobs.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TickOrchestratorTest {

    private static Database db;
    private static JdbcJobRunRepository runRepo;

    private MutableClock clock;
    private ScriptedHandlers handlers;
    private EnqueueService enqueueService;
    private ScheduleService scheduleService;
    private JobRunner runner;
    private TickOrchestrator orchestrator;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-tick");
        runRepo = new JdbcJobRunRepository(db);
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
        handlers = new ScriptedHandlers();
        QueueConfig config = QueueConfig.defaults();
        JobAuditLog auditLog = new JobAuditLog(new JdbcJobLogRepository(db), clock);
        enqueueService = new EnqueueService(runRepo, auditLog, config, clock);
        scheduleService = new ScheduleService(new JdbcJobScheduleRepository(db), runRepo, enqueueService, clock);
        runner = new JobRunner(runRepo, handlers.registry(), BackoffPolicy.defaults(), auditLog, config, clock);
        orchestrator = new TickOrchestrator(new StaleLockRecovery(runRepo, auditLog, config, clock),
                scheduleService, runner);
    }

    @AfterEach
    void close() {
        runner.close();
    }

    @Test
    void dueScheduleIsEnqueuedAndRunInTheSameTick() {
        scheduleService.create(ScheduleDefinition.of("reminders", JobType.RUN_REMINDER_RULES, Cadence.interval(15)));
        clock.advance(Duration.ofMinutes(15));

        TickResult result = orchestrator.tick();

        assertEquals(0, result.recovered().count());
        assertEquals(1, result.scheduled().jobsEnqueued());
        assertEquals(1, result.run().claimed());
        assertEquals(1, result.run().succeeded());
        assertEquals(1, handlers.calls(JobType.RUN_REMINDER_RULES));

        String jobId = result.scheduled().jobIds().get(0);
        assertEquals(JobRunStatus.SUCCEEDED, runRepo.findById(jobId).orElseThrow().status());
    }

    @Test
    void recoveredJobIsRunInTheSameTick() {
        String id = enqueueService.enqueue(EnqueueRequest.of(JobType.SCORE_COMPUTE)).id();
        runRepo.tryClaim(id, "crashed", clock.instant()).orElseThrow();
        clock.advance(Duration.ofMinutes(30));

        TickResult result = orchestrator.tick();

        assertEquals(1, result.recovered().requeued());
        assertEquals(1, result.run().succeeded());
        JobRun run = runRepo.findById(id).orElseThrow();
        assertEquals(JobRunStatus.SUCCEEDED, run.status());
        assertEquals(2, run.attempts());
    }

    @Test
    void skippedStepsAreNull() {
        enqueueService.enqueue(EnqueueRequest.of(JobType.SCORE_COMPUTE));

        TickResult result = orchestrator.tick(new TickRequest(false, true, false, 5));

        assertNull(result.recovered());
        assertNotNull(result.scheduled());
        assertNull(result.run());
        assertEquals(0, handlers.calls(JobType.SCORE_COMPUTE));
    }

    @Test
    void limitBoundsTheRunStep() {
        for (int i = 0; i < 5; i++) {
            enqueueService.enqueue(EnqueueRequest.of(JobType.SCORE_COMPUTE));
        }

        TickResult result = orchestrator.tick(new TickRequest(true, false, false, 2));

        assertEquals(2, result.run().claimed());
        assertEquals(3, runRepo.find(JobRunStatus.QUEUED, null, 50).size());
    }

    @Test
    void emptyTickReportsNothing() {
        TickResult result = orchestrator.tick();

        assertEquals(0, result.recovered().count());
        assertEquals(0, result.scheduled().dueSchedules());
        assertEquals(0, result.run().claimed());
        assertNotNull(result.run().runnerId());
    }

    @Test
    void tickRequestDefaults() {
        TickRequest empty = new TickRequest(null, null, null, null);

        assertTrue(empty.shouldRun());
        assertTrue(empty.shouldEnqueueSchedules());
        assertTrue(empty.shouldRecoverStale());
        assertEquals(TickRequest.DEFAULT_LIMIT, empty.limitOrDefault());
    }
}
