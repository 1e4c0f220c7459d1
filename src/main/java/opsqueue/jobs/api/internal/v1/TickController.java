package opsqueue.jobs.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import opsqueue.jobs.api.Controller;
import opsqueue.jobs.api.internal.v1.dto.EnqueueDueRequest;
import opsqueue.jobs.api.internal.v1.dto.RecoverRequest;
import opsqueue.jobs.api.internal.v1.dto.RunRequest;
import opsqueue.jobs.api.internal.v1.dto.TickRequestBody;
import opsqueue.jobs.model.EnqueueDueResult;
import opsqueue.jobs.model.RecoveryResult;
import opsqueue.jobs.model.RunResult;
import opsqueue.jobs.model.TickResult;
import opsqueue.jobs.scheduler.StaleLockRecovery;
import opsqueue.jobs.service.JobRunner;
import opsqueue.jobs.service.ScheduleService;
import opsqueue.jobs.service.TickOrchestrator;
import opsqueue.jobs.util.RunnerIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Trigger endpoints for cron jobs and operators (internal API).
 *
 * POST /internal/v1/jobs/tick - Recovery, due schedules and a runner pass
 * POST /internal/v1/jobs/run - One runner pass
 * POST /internal/v1/jobs/recover-stale - Stale-lock recovery only
 * POST /internal/v1/schedules/enqueue-due - Due-schedule pass only
 *
 * All bodies are optional. Responses carry counts only; per-job errors stay
 * on the job rows.
 */
public class TickController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TickController.class);

    private static final String TICK_PATH = "/internal/v1/jobs/tick";
    private static final String RUN_PATH = "/internal/v1/jobs/run";
    private static final String RECOVER_PATH = "/internal/v1/jobs/recover-stale";
    private static final String ENQUEUE_DUE_PATH = "/internal/v1/schedules/enqueue-due";

    private final TickOrchestrator orchestrator;
    private final JobRunner runner;
    private final StaleLockRecovery recovery;
    private final ScheduleService scheduleService;

    public TickController(TickOrchestrator orchestrator, JobRunner runner, StaleLockRecovery recovery,
            ScheduleService scheduleService) {
        this.orchestrator = orchestrator;
        this.runner = runner;
        this.recovery = recovery;
        this.scheduleService = scheduleService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return TICK_PATH.equals(path)
                || RUN_PATH.equals(path)
                || RECOVER_PATH.equals(path)
                || ENQUEUE_DUE_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return switch (path) {
                case TICK_PATH -> handleTick(req);
                case RUN_PATH -> handleRun(req);
                case RECOVER_PATH -> handleRecover(req);
                case ENQUEUE_DUE_PATH -> handleEnqueueDue(req);
                default -> ControllerResponse.notFound("unknown trigger endpoint");
            };
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    private ControllerResponse handleTick(FullHttpRequest req) {
        TickRequestBody body = Controller.readBody(req, TickRequestBody.class, TickRequestBody.EMPTY);
        body.validate();

        TickResult result = orchestrator.tick(body.toTickRequest());
        log.debug("Tick via HTTP: {}", result);
        return ControllerResponse.ok(Map.of("ok", true, "result", result));
    }

    private ControllerResponse handleRun(FullHttpRequest req) {
        RunRequest body = Controller.readBody(req, RunRequest.class, RunRequest.EMPTY);
        body.validate();

        String runnerId = body.runnerId() != null ? body.runnerId() : RunnerIds.generate();
        RunResult result = runner.runOnce(body.limitOrDefault(JobRunner.DEFAULT_LIMIT), runnerId);
        return ControllerResponse.ok(Map.of("ok", true, "result", result));
    }

    private ControllerResponse handleRecover(FullHttpRequest req) {
        RecoverRequest body = Controller.readBody(req, RecoverRequest.class, RecoverRequest.EMPTY);
        body.validate();

        RecoveryResult result = body.staleAfterMinutes() != null
                ? recovery.recoverStale(body.staleAfterMinutes())
                : recovery.recoverStale();
        return ControllerResponse.ok(Map.of("ok", true, "result", result));
    }

    private ControllerResponse handleEnqueueDue(FullHttpRequest req) {
        EnqueueDueRequest body = Controller.readBody(req, EnqueueDueRequest.class, EnqueueDueRequest.EMPTY);
        body.validate();

        EnqueueDueResult result = scheduleService.enqueueDueSchedules(
                body.limit() != null ? body.limit() : ScheduleService.DEFAULT_LIMIT);
        return ControllerResponse.ok(Map.of("ok", true, "result", result));
    }
}
