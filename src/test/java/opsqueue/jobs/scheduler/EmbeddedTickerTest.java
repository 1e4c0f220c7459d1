package opsqueue.jobs.scheduler;

import opsqueue.jobs.config.Dependencies;
import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.model.EnqueueRequest;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.support.ScriptedHandlers;
import opsqueue.jobs.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddedTickerTest {

    private Dependencies deps;

    @AfterEach
    void tearDown() {
        if (deps != null)
            deps.close();
    }

    private Dependencies wire(QueueConfig config) {
        config.withDatabaseUrl(TestDatabases.url("test-ticker-" + System.nanoTime()));
        deps = Dependencies.create(config, new ScriptedHandlers().registry());
        return deps;
    }

    @Test
    void disabledWithoutInterval() {
        QueueConfig config = QueueConfig.defaults().withTickInterval(Duration.ZERO);
        EmbeddedTicker ticker = new EmbeddedTicker(wire(config).tickOrchestrator(), config);

        assertFalse(ticker.start());
        assertFalse(ticker.isRunning());
        ticker.stop();
    }

    @Test
    void runsQueuedJobsOnItsOwn() throws Exception {
        QueueConfig config = QueueConfig.defaults().withTickInterval(Duration.ofMillis(50));
        Dependencies d = wire(config);
        String id = d.enqueueService().enqueue(EnqueueRequest.of(JobType.CAPTURE_METRICS_SNAPSHOT)).id();

        assertTrue(d.startTicker());

        long deadline = System.currentTimeMillis() + 5_000;
        JobRunStatus status = JobRunStatus.QUEUED;
        while (System.currentTimeMillis() < deadline) {
            status = d.jobRunRepository().findById(id).orElseThrow().status();
            if (status == JobRunStatus.SUCCEEDED) {
                break;
            }
            Thread.sleep(25);
        }
        assertEquals(JobRunStatus.SUCCEEDED, status);
    }

    @Test
    void failedTickDoesNotEscape() {
        QueueConfig config = QueueConfig.defaults().withTickInterval(Duration.ofSeconds(60));
        Dependencies d = wire(config);
        EmbeddedTicker ticker = new EmbeddedTicker(d.tickOrchestrator(), config);

        // Every repository call fails once the pool is gone
        d.database().close();

        assertDoesNotThrow(ticker::tickSafely);
        ticker.close();
    }
}
