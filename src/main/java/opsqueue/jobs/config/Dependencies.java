package opsqueue.jobs.config;

import opsqueue.jobs.api.internal.v1.TickController;
import opsqueue.jobs.api.v1.HealthController;
import opsqueue.jobs.api.v1.JobController;
import opsqueue.jobs.api.v1.ScheduleController;
import opsqueue.jobs.handler.JobHandlerRegistry;
import opsqueue.jobs.repository.JobLogRepository;
import opsqueue.jobs.repository.JobRunRepository;
import opsqueue.jobs.repository.JobScheduleRepository;
import opsqueue.jobs.scheduler.EmbeddedTicker;
import opsqueue.jobs.scheduler.StaleLockRecovery;
import opsqueue.jobs.server.QueueHttpServer;
import opsqueue.jobs.server.RouterHandler;
import opsqueue.jobs.service.BackoffPolicy;
import opsqueue.jobs.service.EnqueueService;
import opsqueue.jobs.service.JobAdminService;
import opsqueue.jobs.service.JobAuditLog;
import opsqueue.jobs.service.JobRunner;
import opsqueue.jobs.service.ScheduleService;
import opsqueue.jobs.service.TickOrchestrator;
import opsqueue.jobs.store.Database;
import opsqueue.jobs.store.JdbcJobLogRepository;
import opsqueue.jobs.store.JdbcJobRunRepository;
import opsqueue.jobs.store.JdbcJobScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(QueueConfig.fromEnv(), JobHandlerRegistry.load());
 * deps.startServer(); // HTTP trigger surface
 * deps.startTicker(); // only if a tick interval is configured
 * deps.tickOrchestrator().tick();
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QueueConfig config;
    private final Clock clock;
    private final Database database;
    private final JobRunRepository jobRunRepository;
    private final JobScheduleRepository scheduleRepository;
    private final JobLogRepository logRepository;

    private final JobAuditLog auditLog;
    private final EnqueueService enqueueService;
    private final JobRunner jobRunner;
    private final StaleLockRecovery staleLockRecovery;
    private final ScheduleService scheduleService;
    private final TickOrchestrator tickOrchestrator;
    private final JobAdminService adminService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final ScheduleController scheduleController;
    private final TickController tickController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private QueueHttpServer server;
    private EmbeddedTicker ticker;

    private Dependencies(QueueConfig config, JobHandlerRegistry handlers, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRunRepository = new JdbcJobRunRepository(database);
        this.scheduleRepository = new JdbcJobScheduleRepository(database);
        this.logRepository = new JdbcJobLogRepository(database);

        // Services
        this.auditLog = new JobAuditLog(logRepository, clock);
        this.enqueueService = new EnqueueService(jobRunRepository, auditLog, config, clock);
        this.jobRunner = new JobRunner(jobRunRepository, handlers, BackoffPolicy.defaults(), auditLog, config,
                clock);
        this.staleLockRecovery = new StaleLockRecovery(jobRunRepository, auditLog, config, clock);
        this.scheduleService = new ScheduleService(scheduleRepository, jobRunRepository, enqueueService, clock);
        this.tickOrchestrator = new TickOrchestrator(staleLockRecovery, scheduleService, jobRunner);
        this.adminService = new JobAdminService(jobRunRepository, scheduleRepository, auditLog, config, clock);

        // Controllers (public API)
        this.healthController = new HealthController(database, jobRunRepository);
        this.jobController = new JobController(enqueueService, adminService);
        this.scheduleController = new ScheduleController(scheduleService);

        // Controllers (internal API)
        this.tickController = new TickController(tickOrchestrator, jobRunner, staleLockRecovery, scheduleService);

        log.info("Dependencies initialized successfully ({} job types handled)", handlers.types().size());
    }

    /**
     * Create dependencies with the given config and handlers, on the system UTC clock.
     */
    public static Dependencies create(QueueConfig config, JobHandlerRegistry handlers) {
        return create(config, handlers, Clock.systemUTC());
    }

    public static Dependencies create(QueueConfig config, JobHandlerRegistry handlers, Clock clock) {
        return new Dependencies(config, handlers, clock);
    }

    // Getters
    public QueueConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public JobRunRepository jobRunRepository() {
        return jobRunRepository;
    }

    public JobScheduleRepository scheduleRepository() {
        return scheduleRepository;
    }

    public JobAuditLog auditLog() {
        return auditLog;
    }

    public EnqueueService enqueueService() {
        return enqueueService;
    }

    public JobRunner jobRunner() {
        return jobRunner;
    }

    public StaleLockRecovery staleLockRecovery() {
        return staleLockRecovery;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    public TickOrchestrator tickOrchestrator() {
        return tickOrchestrator;
    }

    public JobAdminService adminService() {
        return adminService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(jobController)
                    .registerController(scheduleController)
                    .registerController(tickController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the HTTP server on the configured host and port.
     */
    public QueueHttpServer startServer() {
        if (server == null) {
            server = new QueueHttpServer(routerHandler());
        }
        server.start(config.serverHost(), config.serverPort());
        return server;
    }

    /**
     * Start the embedded ticker if a tick interval is configured.
     */
    public boolean startTicker() {
        if (ticker == null) {
            ticker = new EmbeddedTicker(tickOrchestrator, config);
        }
        return ticker.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop triggers first so no new work starts
        if (ticker != null) {
            try {
                ticker.stop();
            } catch (Exception e) {
                log.warn("Error stopping ticker: {}", e.getMessage());
            }
        }
        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        jobRunner.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
