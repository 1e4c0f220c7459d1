package opsqueue;

import opsqueue.jobs.config.Dependencies;
import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.handler.JobHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Service entry point.
 *
 * Starts the HTTP trigger surface and, when OPSQUEUE_TICK_INTERVAL_SECONDS is
 * set, the embedded ticker.
 *
 * <p>
 * Job handlers are discovered from the classpath and this artifact contains
 * none: deploy it together with handler jars that list their classes in
 * {@code META-INF/services/opsqueue.jobs.handler.JobHandler}, covering every
 * job type. Startup fails otherwise, naming the types without a handler.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        QueueConfig config = QueueConfig.fromEnv();
        JobHandlerRegistry handlers = JobHandlerRegistry.load();

        Dependencies deps = Dependencies.create(config, handlers);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping...");
            deps.close();
            shutdown.countDown();
        }, "opsqueue-shutdown"));

        try {
            deps.startServer();
            deps.startTicker();
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            deps.close();
            throw e;
        }

        log.info("opsqueue started on port {}", config.serverPort());
        shutdown.await();
    }
}
