package opsqueue.jobs.store;

import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRunRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private static Database db;
    private static JdbcJobRunRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-job-runs");
        repo = new JdbcJobRunRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        TestDatabases.clean(db);
    }

    private static JobRun.Builder queued(String id) {
        return JobRun.builder()
                .id(id)
                .jobType(JobType.SCORE_COMPUTE)
                .payload("{\"entityId\":\"lead-1\"}")
                .status(JobRunStatus.QUEUED)
                .maxAttempts(3)
                .runAfter(T0)
                .createdAt(T0)
                .updatedAt(T0);
    }

    @Test
    void insertAndFindById() {
        repo.insert(queued("run-1").priority(7).dedupeKey("score:lead-1").sourceType("manual").sourceId("op-1").build());

        Optional<JobRun> found = repo.findById("run-1");
        assertTrue(found.isPresent());
        assertEquals("score.compute", found.get().jobType());
        assertEquals(JobRunStatus.QUEUED, found.get().status());
        assertEquals(7, found.get().priority());
        assertEquals(0, found.get().attempts());
        assertEquals(T0, found.get().runAfter());
        assertEquals("score:lead-1", found.get().dedupeKey());
        assertEquals("manual", found.get().sourceType());
        assertEquals("{\"entityId\":\"lead-1\"}", found.get().payload());
    }

    @Test
    void secondActiveRowWithSameDedupeKeyIsRejected() {
        repo.insert(queued("run-1").dedupeKey("k").build());

        DedupeConflictException e = assertThrows(DedupeConflictException.class,
                () -> repo.insert(queued("run-2").dedupeKey("k").build()));
        assertEquals("k", e.dedupeKey());
        assertTrue(repo.findById("run-2").isEmpty());
    }

    @Test
    void terminalRowReleasesDedupeKey() {
        repo.insert(queued("run-1").dedupeKey("k").build());
        JobRun claimed = repo.tryClaim("run-1", "runner-a", T0).orElseThrow();
        assertTrue(repo.markSucceeded("run-1", "runner-a", claimed.attempts(), null, T0));

        assertTrue(repo.findActiveByDedupeKey("k").isEmpty());
        repo.insert(queued("run-2").dedupeKey("k").createdAt(T0.plusSeconds(1)).build());

        assertEquals("run-2", repo.findActiveByDedupeKey("k").orElseThrow().id());
        assertEquals("run-2", repo.findLatestByDedupeKey("k").orElseThrow().id());
    }

    @Test
    void findRunnableOrdersByPriorityThenAge() {
        repo.insert(queued("low-old").priority(0).createdAt(T0).build());
        repo.insert(queued("high-new").priority(10).createdAt(T0.plusSeconds(5)).build());
        repo.insert(queued("low-new").priority(0).createdAt(T0.plusSeconds(10)).build());
        repo.insert(queued("future").priority(99).runAfter(T0.plusSeconds(3600)).build());

        List<JobRun> runnable = repo.findRunnable(T0.plusSeconds(60), 10);

        assertEquals(List.of("high-new", "low-old", "low-new"), runnable.stream().map(JobRun::id).toList());
    }

    @Test
    void claimIsExclusive() {
        repo.insert(queued("run-1").build());

        Optional<JobRun> first = repo.tryClaim("run-1", "runner-a", T0);
        Optional<JobRun> second = repo.tryClaim("run-1", "runner-b", T0);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(JobRunStatus.RUNNING, first.get().status());
        assertEquals("runner-a", first.get().lockOwner());
        assertEquals(1, first.get().attempts());
        assertEquals(T0, first.get().lockedAt());
        assertEquals(T0, first.get().startedAt());
    }

    @Test
    void claimRespectsRunAfter() {
        repo.insert(queued("later").runAfter(T0.plusSeconds(30)).build());

        assertTrue(repo.tryClaim("later", "runner-a", T0).isEmpty());
        assertTrue(repo.tryClaim("later", "runner-a", T0.plusSeconds(30)).isPresent());
    }

    @Test
    void resolveIsFencedOnOwnerAndAttempt() {
        repo.insert(queued("run-1").build());
        JobRun claimed = repo.tryClaim("run-1", "runner-a", T0).orElseThrow();

        assertFalse(repo.markSucceeded("run-1", "runner-b", claimed.attempts(), null, T0));
        assertFalse(repo.markSucceeded("run-1", "runner-a", claimed.attempts() + 1, null, T0));
        assertTrue(repo.markSucceeded("run-1", "runner-a", claimed.attempts(), "{\"n\":1}", T0));
        assertFalse(repo.markDeadLetter("run-1", "runner-a", claimed.attempts(), "late", "X", T0));

        JobRun done = repo.findById("run-1").orElseThrow();
        assertEquals(JobRunStatus.SUCCEEDED, done.status());
        assertNull(done.lockOwner());
        assertNull(done.lockedAt());
        assertEquals("{\"n\":1}", done.resultJson());
    }

    @Test
    void scheduleRetryKeepsDedupeKeyActive() {
        repo.insert(queued("run-1").dedupeKey("k").build());
        JobRun claimed = repo.tryClaim("run-1", "runner-a", T0).orElseThrow();

        assertTrue(repo.scheduleRetry("run-1", "runner-a", claimed.attempts(), T0.plusSeconds(30), "boom",
                "IllegalStateException", T0));

        JobRun retried = repo.findById("run-1").orElseThrow();
        assertEquals(JobRunStatus.QUEUED, retried.status());
        assertEquals(T0.plusSeconds(30), retried.runAfter());
        assertEquals("boom", retried.errorMessage());
        assertEquals("IllegalStateException", retried.errorCode());
        assertNull(retried.lockOwner());
        assertEquals("run-1", repo.findActiveByDedupeKey("k").orElseThrow().id());
    }

    @Test
    void errorMessageIsTruncated() {
        repo.insert(queued("run-1").build());
        JobRun claimed = repo.tryClaim("run-1", "runner-a", T0).orElseThrow();

        String longMessage = "x".repeat(5000);
        assertTrue(repo.markDeadLetter("run-1", "runner-a", claimed.attempts(), longMessage, "E", T0));

        assertEquals(JdbcJobRunRepository.ERROR_MESSAGE_MAX, repo.findById("run-1").orElseThrow().errorMessage()
                .length());
    }

    @Test
    void findStaleRunningUsesLockTimestamp() {
        repo.insert(queued("old").build());
        repo.insert(queued("fresh").build());
        repo.tryClaim("old", "runner-a", T0);
        repo.tryClaim("fresh", "runner-a", T0.plus(Duration.ofMinutes(20)));

        List<JobRun> stale = repo.findStaleRunning(T0.plus(Duration.ofMinutes(10)), 10);

        assertEquals(List.of("old"), stale.stream().map(JobRun::id).toList());
        assertEquals(1, repo.countStaleRunning(T0.plus(Duration.ofMinutes(10))));
    }

    @Test
    void heartbeatMovesLockForward() {
        repo.insert(queued("run-1").build());
        JobRun claimed = repo.tryClaim("run-1", "runner-a", T0).orElseThrow();

        assertTrue(repo.heartbeat("run-1", "runner-a", claimed.attempts(), T0.plus(Duration.ofMinutes(30))));
        assertFalse(repo.heartbeat("run-1", "runner-b", claimed.attempts(), T0.plus(Duration.ofMinutes(31))));

        assertTrue(repo.findStaleRunning(T0.plus(Duration.ofMinutes(20)), 10).isEmpty());
    }

    @Test
    void recoveryIsFencedOnAttempts() {
        repo.insert(queued("run-1").build());
        JobRun claimed = repo.tryClaim("run-1", "runner-a", T0).orElseThrow();

        assertFalse(repo.recoverToQueued("run-1", claimed.attempts() - 1, "stale", "STALE_LOCK", T0));
        assertTrue(repo.recoverToQueued("run-1", claimed.attempts(), "stale", "STALE_LOCK", T0));

        JobRun recovered = repo.findById("run-1").orElseThrow();
        assertEquals(JobRunStatus.QUEUED, recovered.status());
        assertEquals("STALE_LOCK", recovered.errorCode());
        assertNull(recovered.lockOwner());
    }

    @Test
    void cancelQueuedAndRequestCancel() {
        repo.insert(queued("queued-1").build());
        repo.insert(queued("running-1").build());
        repo.tryClaim("running-1", "runner-a", T0);

        assertTrue(repo.cancelQueued("queued-1", T0));
        assertFalse(repo.cancelQueued("running-1", T0));
        assertTrue(repo.requestCancel("running-1", T0));
        assertFalse(repo.requestCancel("queued-1", T0));

        assertEquals(JobRunStatus.CANCELED, repo.findById("queued-1").orElseThrow().status());
        JobRun running = repo.findById("running-1").orElseThrow();
        assertEquals(JobRunStatus.RUNNING, running.status());
        assertTrue(running.isCancelRequested());
    }

    @Test
    void requeueResetsDeadLetteredRow() {
        repo.insert(queued("run-1").maxAttempts(1).dedupeKey("k").build());
        JobRun claimed = repo.tryClaim("run-1", "runner-a", T0).orElseThrow();
        repo.markDeadLetter("run-1", "runner-a", claimed.attempts(), "boom", "E", T0);

        assertFalse(repo.requeue("run-1", JobRunStatus.FAILED, 2, T0));
        assertTrue(repo.requeue("run-1", JobRunStatus.DEAD_LETTER, 2, T0.plusSeconds(5)));

        JobRun requeued = repo.findById("run-1").orElseThrow();
        assertEquals(JobRunStatus.QUEUED, requeued.status());
        assertEquals(1, requeued.attempts());
        assertEquals(2, requeued.maxAttempts());
        assertEquals(T0.plusSeconds(5), requeued.runAfter());
        assertNull(requeued.errorMessage());
        assertNull(requeued.errorCode());
        assertNull(requeued.deadLetteredAt());
        assertNull(requeued.finishedAt());
        assertEquals("run-1", repo.findActiveByDedupeKey("k").orElseThrow().id());
    }

    @Test
    void requeueConflictsWithNewerActiveRow() {
        repo.insert(queued("old").maxAttempts(1).dedupeKey("k").build());
        JobRun claimed = repo.tryClaim("old", "runner-a", T0).orElseThrow();
        repo.markDeadLetter("old", "runner-a", claimed.attempts(), "boom", "E", T0);
        repo.insert(queued("new").dedupeKey("k").build());

        assertThrows(DedupeConflictException.class, () -> repo.requeue("old", JobRunStatus.DEAD_LETTER, 2, T0));
        assertEquals(JobRunStatus.DEAD_LETTER, repo.findById("old").orElseThrow().status());
    }

    @Test
    void findFiltersAndCounts() {
        repo.insert(queued("a").build());
        repo.insert(queued("b").jobType(JobType.RUN_REMINDER_RULES).createdAt(T0.plusSeconds(1)).build());
        repo.insert(queued("c").createdAt(T0.plusSeconds(2)).build());
        repo.tryClaim("c", "runner-a", T0);

        assertEquals(List.of("c", "b", "a"), repo.find(null, null, 10).stream().map(JobRun::id).toList());
        assertEquals(List.of("b"), repo.find(JobRunStatus.QUEUED, "run_reminder_rules", 10).stream()
                .map(JobRun::id).toList());
        assertEquals(2, repo.find(null, null, 2).size());

        Map<JobRunStatus, Integer> counts = repo.countByStatus();
        assertEquals(2, counts.get(JobRunStatus.QUEUED));
        assertEquals(1, counts.get(JobRunStatus.RUNNING));
        assertEquals(0, counts.get(JobRunStatus.DEAD_LETTER));
    }
}
