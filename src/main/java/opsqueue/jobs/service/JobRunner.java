package opsqueue.jobs.service;

import opsqueue.jobs.config.QueueConfig;
import opsqueue.jobs.handler.JobContext;
import opsqueue.jobs.handler.JobHandler;
import opsqueue.jobs.handler.JobHandlerRegistry;
import opsqueue.jobs.handler.JobResult;
import opsqueue.jobs.model.JobRun;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.JobType;
import opsqueue.jobs.model.RunResult;
import opsqueue.jobs.repository.JobRunRepository;
import opsqueue.jobs.store.JobStoreException;
import opsqueue.jobs.util.Json;
import opsqueue.jobs.util.RunnerIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claims runnable jobs and executes them.
 *
 * <p>
 * A pass claims up to {@code limit} queued rows, one conditional update per
 * row, then runs each claimed row's handler on a worker thread under the
 * row's timeout. Every outcome is written back with an update fenced on the
 * lease (status running, same owner, same attempt); if that update matches
 * nothing, the lease was lost and the row is left as the other process set it.
 *
 * <p>
 * Failures of a single job are recorded on the row and never abort the pass.
 * Only store errors while claiming propagate to the caller.
 */
public class JobRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;
    public static final String UNKNOWN_JOB_TYPE = "UNKNOWN_JOB_TYPE";
    public static final String RESULT_NOT_SERIALIZABLE = "RESULT_NOT_SERIALIZABLE";

    /** How long a timed-out handler gets to honor the interrupt before its pool is retired */
    private static final long CANCEL_GRACE_MILLIS = 1_000;

    private static final int MAX_CLAIM_PASSES = 3;

    private final JobRunRepository jobRunRepository;
    private final JobHandlerRegistry handlers;
    private final BackoffPolicy backoff;
    private final JobAuditLog auditLog;
    private final QueueConfig config;
    private final Clock clock;
    private final AtomicInteger threadIndex = new AtomicInteger();
    private volatile ExecutorService workers;

    public JobRunner(JobRunRepository jobRunRepository, JobHandlerRegistry handlers, BackoffPolicy backoff,
            JobAuditLog auditLog, QueueConfig config, Clock clock) {
        this.jobRunRepository = jobRunRepository;
        this.handlers = handlers;
        this.backoff = backoff;
        this.auditLog = auditLog;
        this.config = config;
        this.clock = clock;
        this.workers = newWorkerPool();
    }

    private ExecutorService newWorkerPool() {
        return Executors.newFixedThreadPool(Math.max(1, config.workerThreads()), r -> {
            Thread t = new Thread(r, "opsqueue-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run one pass with a freshly generated runner id.
     */
    public RunResult runOnce(int limit) {
        return runOnce(limit, RunnerIds.generate());
    }

    /**
     * Claim and execute up to {@code limit} jobs (clamped to 1..50).
     *
     * @throws JobStoreException if the claim step fails
     */
    public RunResult runOnce(int limit, String runnerId) {
        int batch = clampLimit(limit);
        List<JobRun> claimed = claim(batch, runnerId);

        if (claimed.isEmpty()) {
            log.debug("Runner {}: nothing to claim", runnerId);
            return RunResult.empty(runnerId);
        }

        Tally tally = new Tally();
        for (int i = 0; i < claimed.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Runner {} interrupted; {} claimed jobs left for stale-lock recovery",
                        runnerId, claimed.size() - i);
                break;
            }
            process(claimed.get(i), runnerId, tally);
        }

        RunResult result = new RunResult(claimed.size(), tally.succeeded, tally.retried, tally.failed,
                tally.deadLettered, tally.canceled, runnerId);
        log.info("Runner {}: claimed={} succeeded={} retried={} deadLettered={} canceled={} unresolved={}",
                runnerId, result.claimed(), result.succeeded(), result.retried(), result.deadLettered(),
                result.canceled(), result.failed());
        return result;
    }

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    /**
     * Claim step: select candidates, then compete for each with a conditional update.
     * Rows taken by a concurrent runner are skipped and the select is repeated.
     */
    private List<JobRun> claim(int batch, String runnerId) {
        List<JobRun> claimed = new ArrayList<>();
        Set<String> attempted = new HashSet<>();

        for (int pass = 0; pass < MAX_CLAIM_PASSES && claimed.size() < batch; pass++) {
            Instant now = now();
            List<JobRun> candidates = jobRunRepository.findRunnable(now, batch - claimed.size());
            if (candidates.isEmpty()) {
                break;
            }

            int lost = 0;
            for (JobRun candidate : candidates) {
                if (claimed.size() >= batch || !attempted.add(candidate.id())) {
                    continue;
                }
                Optional<JobRun> won = jobRunRepository.tryClaim(candidate.id(), runnerId, now);
                if (won.isPresent()) {
                    claimed.add(won.get());
                    auditLog.info(candidate.id(), "Job claimed",
                            Map.of("runnerId", runnerId, "attempt", won.get().attempts()));
                } else {
                    lost++;
                }
            }

            if (lost == 0) {
                break;
            }
            log.debug("Runner {} lost {} claims to other runners, reselecting", runnerId, lost);
        }

        if (!claimed.isEmpty()) {
            log.debug("Runner {} claimed {} jobs", runnerId, claimed.size());
        }
        return claimed;
    }

    private void process(JobRun run, String runnerId, Tally tally) {
        MDC.put("job_id", run.id());
        MDC.put("job_type", run.jobType());
        MDC.put("runner_id", runnerId);
        try {
            Optional<JobRun> current = jobRunRepository.findById(run.id());
            if (current.isEmpty() || !ownedBy(current.get(), runnerId, run.attempts())) {
                log.warn("Lease on job {} lost before dispatch", run.id());
                tally.failed++;
                return;
            }
            if (current.get().isCancelRequested()) {
                resolveCanceled(run, runnerId, tally);
                return;
            }
            // Claimed rows wait for earlier ones in the batch; renew before starting.
            if (!jobRunRepository.heartbeat(run.id(), runnerId, run.attempts(), now())) {
                log.warn("Lease on job {} lost before dispatch", run.id());
                tally.failed++;
                return;
            }

            JobResult result;
            try {
                result = execute(run, runnerId);
            } catch (WorkerUnavailableException e) {
                releaseUnstarted(run, runnerId, tally);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Runner interrupted while job {} was executing", run.id());
                resolveFailure(run, runnerId, "Runner interrupted", "INTERRUPTED", e, tally);
                return;
            } catch (Exception e) {
                resolveFailure(run, runnerId, messageOf(e), errorCodeOf(e), e, tally);
                return;
            }

            if (result.isCanceled()) {
                resolveCanceled(run, runnerId, tally);
            } else {
                resolveSucceeded(run, runnerId, result, tally);
            }
        } catch (JobStoreException e) {
            log.error("Store error while resolving job {}", run.id(), e);
            tally.failed++;
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing job {}; left for stale-lock recovery", run.id(), e);
            tally.failed++;
        } finally {
            MDC.remove("job_id");
            MDC.remove("job_type");
            MDC.remove("runner_id");
        }
    }

    /**
     * Run the handler on a worker thread and wait at most the job's timeout,
     * counted from the moment the handler starts.
     *
     * @throws WorkerUnavailableException if no worker picked the job up within the timeout
     */
    private JobResult execute(JobRun run, String runnerId) throws Exception {
        Optional<JobType> type = run.type();
        if (type.isEmpty()) {
            throw new UnknownJobTypeException(run.jobType());
        }
        JobHandler handler = handlers.find(type.get())
                .orElseThrow(() -> new UnknownJobTypeException(run.jobType()));

        Map<String, Object> payload = Json.readObject(run.payload());
        JobContext context = new JobContext(
                run.id(),
                type.get(),
                payload,
                run.attempts(),
                run.maxAttempts(),
                () -> jobRunRepository.findById(run.id()).map(JobRun::isCancelRequested).orElse(false),
                () -> jobRunRepository.heartbeat(run.id(), runnerId, run.attempts(), now()));

        Duration timeout = run.timeoutSeconds() != null
                ? Duration.ofSeconds(run.timeoutSeconds())
                : config.defaultJobTimeout();

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        log.debug("Dispatching job {} attempt {}/{} (timeout {}s)", run.id(), run.attempts(), run.maxAttempts(),
                timeout.toSeconds());

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        ExecutorService pool = workers;
        Future<JobResult> future = pool.submit(() -> {
            started.countDown();
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                JobResult result = handler.execute(context);
                return result != null ? result : JobResult.success();
            } finally {
                MDC.clear();
                finished.countDown();
            }
        });

        try {
            if (!started.await(timeout.toMillis(), TimeUnit.MILLISECONDS) && future.cancel(false)) {
                throw new WorkerUnavailableException();
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (!finished.await(CANCEL_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                retireWorkers(pool, run.id());
            }
            throw new JobTimeoutException(run.id(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw new IllegalStateException("Handler raised " + cause, cause);
        }
    }

    /**
     * Swap in a fresh pool when a handler ignores the interrupt, so the thread
     * it keeps cannot hold back later jobs.
     */
    private synchronized void retireWorkers(ExecutorService stuck, String jobId) {
        if (workers != stuck) {
            return;
        }
        log.warn("Handler of job {} ignored the interrupt; replacing the worker pool", jobId);
        workers = newWorkerPool();
        stuck.shutdown();
    }

    private void releaseUnstarted(JobRun run, String runnerId, Tally tally) {
        if (jobRunRepository.releaseClaim(run.id(), runnerId, run.attempts(), now())) {
            tally.failed++;
            log.warn("No worker free for job {}; returned to the queue without using an attempt", run.id());
            auditLog.warn(run.id(), "Job released (no free worker)", Map.of("attempt", run.attempts()));
        } else {
            leaseLost(run, "released", tally);
        }
    }

    private void resolveSucceeded(JobRun run, String runnerId, JobResult result, Tally tally) {
        Instant now = now();
        String resultJson;
        try {
            resultJson = result.data().isEmpty() ? null : Json.write(result.data());
        } catch (IllegalArgumentException e) {
            resolveFailure(run, runnerId, messageOf(e), RESULT_NOT_SERIALIZABLE, e, tally);
            return;
        }
        if (jobRunRepository.markSucceeded(run.id(), runnerId, run.attempts(), resultJson, now)) {
            tally.succeeded++;
            log.info("Job {} ({}) succeeded on attempt {}", run.id(), run.jobType(), run.attempts());
            auditLog.info(run.id(), "Job succeeded", Map.of("attempt", run.attempts()));
        } else {
            leaseLost(run, "succeeded", tally);
        }
    }

    private void resolveCanceled(JobRun run, String runnerId, Tally tally) {
        if (jobRunRepository.markCanceled(run.id(), runnerId, run.attempts(), now())) {
            tally.canceled++;
            log.info("Job {} ({}) canceled on request", run.id(), run.jobType());
            auditLog.info(run.id(), "Job canceled", Map.of("attempt", run.attempts()));
        } else {
            leaseLost(run, "canceled", tally);
        }
    }

    private void resolveFailure(JobRun run, String runnerId, String errorMessage, String errorCode, Exception error,
            Tally tally) {
        Instant now = now();
        if (run.canRetry()) {
            Duration delay = backoff.delay(run.attempts());
            Instant runAfter = now.plus(delay);
            if (jobRunRepository.scheduleRetry(run.id(), runnerId, run.attempts(), runAfter, errorMessage,
                    errorCode, now)) {
                tally.retried++;
                log.warn("Job {} ({}) failed on attempt {}/{}, retrying in {}s: {}", run.id(), run.jobType(),
                        run.attempts(), run.maxAttempts(), delay.toSeconds(), errorMessage, error);
                auditLog.warn(run.id(), "Retry scheduled", Map.of(
                        "attempt", run.attempts(),
                        "errorCode", errorCode,
                        "error", errorMessage,
                        "runAfter", runAfter.toString()));
            } else {
                leaseLost(run, "retried", tally);
            }
        } else {
            if (jobRunRepository.markDeadLetter(run.id(), runnerId, run.attempts(), errorMessage, errorCode, now)) {
                tally.deadLettered++;
                log.error("Job {} ({}) dead-lettered after {} attempts: {}", run.id(), run.jobType(),
                        run.attempts(), errorMessage, error);
                auditLog.error(run.id(), "Job dead-lettered (max attempts)", Map.of(
                        "attempts", run.attempts(),
                        "errorCode", errorCode,
                        "error", errorMessage));
            } else {
                leaseLost(run, "dead-lettered", tally);
            }
        }
    }

    private void leaseLost(JobRun run, String outcome, Tally tally) {
        tally.failed++;
        log.warn("Job {} could not be marked {}: lease lost", run.id(), outcome);
    }

    private static boolean ownedBy(JobRun current, String runnerId, int attempts) {
        return current.status() == JobRunStatus.RUNNING
                && runnerId.equals(current.lockOwner())
                && current.attempts() == attempts;
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    private static String errorCodeOf(Throwable e) {
        if (e instanceof JobTimeoutException) {
            return JobTimeoutException.ERROR_CODE;
        }
        if (e instanceof UnknownJobTypeException) {
            return UNKNOWN_JOB_TYPE;
        }
        return e.getClass().getSimpleName();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public void close() {
        ExecutorService pool = workers;
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Job workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Tally {
        int succeeded;
        int retried;
        int failed;
        int deadLettered;
        int canceled;
    }

    /** The job waited its whole timeout for a worker thread and never started */
    static final class WorkerUnavailableException extends Exception {
    }

    /** Stored job type has no enum constant or no handler in this build */
    static final class UnknownJobTypeException extends Exception {
        UnknownJobTypeException(String jobType) {
            super("No handler registered for job type: " + jobType);
        }
    }
}
