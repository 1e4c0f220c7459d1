package opsqueue.jobs.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import opsqueue.jobs.api.Controller;
import opsqueue.jobs.api.v1.dto.EnqueueJobRequest;
import opsqueue.jobs.api.v1.dto.JobRunResponse;
import opsqueue.jobs.model.CancelResult;
import opsqueue.jobs.model.EnqueueResult;
import opsqueue.jobs.model.JobDetails;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.model.RequeueResult;
import opsqueue.jobs.service.EnqueueService;
import opsqueue.jobs.service.JobAdminService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job runs (public API).
 *
 * GET /api/v1/jobs?status=&jobType=&limit= - List jobs, newest first
 * GET /api/v1/jobs/summary - Queue counters
 * GET /api/v1/jobs/{id} - Job with its audit log
 * POST /api/v1/jobs - Enqueue (201 created, 200 de-duplicated)
 * POST /api/v1/jobs/{id}/retry - Requeue a dead-lettered, failed or canceled job
 * POST /api/v1/jobs/{id}/cancel - Cancel a queued job or request cancel of a running one
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern SUMMARY_PATTERN = Pattern.compile("^/api/v1/jobs/summary$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern RETRY_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/retry$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");

    private final EnqueueService enqueueService;
    private final JobAdminService adminService;

    public JobController(EnqueueService enqueueService, JobAdminService adminService) {
        this.enqueueService = enqueueService;
        this.adminService = adminService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches()
                    || RETRY_PATTERN.matcher(path).matches()
                    || CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches()
                    || JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean post = req.method().equals(HttpMethod.POST);

            if (JOBS_PATTERN.matcher(path).matches()) {
                return post ? handleEnqueue(req) : handleList(req);
            }

            if (!post && SUMMARY_PATTERN.matcher(path).matches()) {
                return ControllerResponse.ok(adminService.summary());
            }

            Matcher retryMatcher = RETRY_PATTERN.matcher(path);
            if (post && retryMatcher.matches()) {
                return handleRetry(retryMatcher.group(1));
            }

            Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
            if (post && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (!post && jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleEnqueue(FullHttpRequest req) {
        EnqueueJobRequest request = Controller.readBody(req, EnqueueJobRequest.class, null);
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        request.validate();

        EnqueueResult result = enqueueService.enqueue(request.toEnqueueRequest());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", result.id());
        response.put("status", result.status().wire());
        response.put("created", result.created());

        return ControllerResponse.json(result.created() ? HttpResponseStatus.CREATED : HttpResponseStatus.OK,
                response);
    }

    /**
     * GET /api/v1/jobs
     */
    private ControllerResponse handleList(FullHttpRequest req) {
        String status = Controller.queryParam(req, "status");
        String jobType = Controller.queryParam(req, "jobType");
        String limit = Controller.queryParam(req, "limit");

        int parsedLimit = JobAdminService.DEFAULT_LIST_LIMIT;
        if (limit != null) {
            try {
                parsedLimit = Integer.parseInt(limit);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number");
            }
        }

        List<JobRunResponse> jobs = adminService
                .list(status != null ? JobRunStatus.fromWire(status) : null, jobType, parsedLimit)
                .stream()
                .map(JobRunResponse::from)
                .toList();

        return ControllerResponse.ok(Map.of("jobs", jobs, "count", jobs.size()));
    }

    /**
     * GET /api/v1/jobs/{id}
     */
    private ControllerResponse handleGetJob(String id) {
        Optional<JobDetails> details = adminService.find(id);
        if (details.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.ok(JobRunResponse.from(details.get().job(), details.get().logs()));
    }

    /**
     * POST /api/v1/jobs/{id}/retry
     */
    private ControllerResponse handleRetry(String id) {
        RequeueResult result = adminService.requeue(id);
        return switch (result) {
            case REQUEUED -> ControllerResponse.ok(Map.of("id", id, "status", JobRunStatus.QUEUED.wire()));
            case NOT_FOUND -> ControllerResponse.notFound("job not found");
            case NOT_REQUEUEABLE -> ControllerResponse.conflict("job is not in a requeueable status");
            case DEDUPE_CONFLICT -> {
                log.debug("Retry of {} refused: dedupe key held by another active job", id);
                yield ControllerResponse.conflict("another active job holds this job's dedupe key");
            }
        };
    }

    /**
     * POST /api/v1/jobs/{id}/cancel
     */
    private ControllerResponse handleCancel(String id) {
        CancelResult result = adminService.cancel(id);
        return switch (result) {
            case CANCELED, CANCEL_REQUESTED -> ControllerResponse.ok(Map.of("id", id, "result", result.name()));
            case NOT_FOUND -> ControllerResponse.notFound("job not found");
            case ALREADY_TERMINAL -> ControllerResponse.conflict("job already finished");
        };
    }
}
