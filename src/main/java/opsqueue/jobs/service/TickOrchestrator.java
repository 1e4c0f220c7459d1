package opsqueue.jobs.service;

import opsqueue.jobs.model.EnqueueDueResult;
import opsqueue.jobs.model.RecoveryResult;
import opsqueue.jobs.model.RunResult;
import opsqueue.jobs.model.TickRequest;
import opsqueue.jobs.model.TickResult;
import opsqueue.jobs.scheduler.StaleLockRecovery;
import opsqueue.jobs.util.RunnerIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One maintenance step: recover stale locks, enqueue due schedules, run a batch.
 *
 * <p>
 * The order matters. Recovered rows and freshly scheduled jobs are claimable
 * by the runner in the same tick. Every step is idempotent, so ticks may be
 * fired by cron, HTTP and the embedded ticker at once.
 */
public class TickOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TickOrchestrator.class);

    private final StaleLockRecovery recovery;
    private final ScheduleService scheduleService;
    private final JobRunner runner;

    public TickOrchestrator(StaleLockRecovery recovery, ScheduleService scheduleService, JobRunner runner) {
        this.recovery = recovery;
        this.scheduleService = scheduleService;
        this.runner = runner;
    }

    public TickResult tick() {
        return tick(TickRequest.all());
    }

    /**
     * Run the requested steps in order. Skipped steps are null in the result.
     *
     * @throws opsqueue.jobs.store.JobStoreException if a step cannot reach the store
     */
    public TickResult tick(TickRequest request) {
        int limit = request.limitOrDefault();

        RecoveryResult recovered = null;
        if (request.shouldRecoverStale()) {
            recovered = recovery.recoverStale();
        }

        EnqueueDueResult scheduled = null;
        if (request.shouldEnqueueSchedules()) {
            scheduled = scheduleService.enqueueDueSchedules(limit);
        }

        RunResult run = null;
        if (request.shouldRun()) {
            run = runner.runOnce(limit, RunnerIds.generate());
        }

        log.debug("Tick done: recovered={} scheduled={} run={}", recovered, scheduled, run);
        return new TickResult(recovered, scheduled, run);
    }
}
