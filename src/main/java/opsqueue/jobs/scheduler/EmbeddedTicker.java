package opsqueue.jobs.scheduler;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.model.TickRequest;
import opsqueue.jobs.model.TickResult;
import opsqueue.jobs.service.TickOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process trigger that fires a full tick at a fixed delay.
 *
 * Only for deployments without an external cron; off unless a tick interval
 * is configured. Uses a single thread, so ticks from this process never
 * overlap each other. Ticks from other triggers may, which is safe.
 */
public class EmbeddedTicker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedTicker.class);

    private final ScheduledExecutorService executor;
    private final TickOrchestrator orchestrator;
    private final QueueConfig config;

    private volatile boolean running = false;

    public EmbeddedTicker(TickOrchestrator orchestrator, QueueConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "opsqueue-ticker");
            t.setDaemon(true);
            return t;
        });
        this.orchestrator = orchestrator;
        this.config = config;
    }

    /**
     * Start ticking if an interval is configured.
     *
     * @return whether the ticker was started
     */
    public boolean start() {
        if (running) {
            log.warn("Ticker already running");
            return true;
        }
        if (!config.embeddedTickerEnabled()) {
            log.info("Embedded ticker disabled (no tick interval configured)");
            return false;
        }

        running = true;

        Duration interval = config.tickInterval();
        executor.scheduleWithFixedDelay(
                this::tickSafely,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Embedded ticker scheduled every {}ms (limit {})", interval.toMillis(), config.tickLimit());
        return true;
    }

    /**
     * Stop the ticker, letting a tick in progress finish.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Ticker forcefully stopped");
            } else {
                log.info("Ticker stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    void tickSafely() {
        try {
            TickResult result = orchestrator.tick(new TickRequest(true, true, true, config.tickLimit()));
            if (result.run() != null && result.run().claimed() > 0) {
                log.debug("Embedded tick ran {} jobs", result.run().claimed());
            }
        } catch (Exception e) {
            // An exception escaping here would cancel the periodic task.
            log.error("Embedded tick failed", e);
        }
    }
}
