package opsqueue.jobs.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import opsqueue.jobs.api.Controller;
import opsqueue.jobs.api.v1.dto.CreateScheduleRequest;
import opsqueue.jobs.api.v1.dto.JobScheduleResponse;
import opsqueue.jobs.api.v1.dto.UpdateScheduleRequest;
import opsqueue.jobs.model.JobSchedule;
import opsqueue.jobs.service.ScheduleService;
import opsqueue.jobs.store.DuplicateScheduleKeyException;
import opsqueue.jobs.util.Json;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for recurring job definitions (public API).
 *
 * GET /api/v1/job-schedules - List schedules
 * POST /api/v1/job-schedules - Create a schedule
 * GET /api/v1/job-schedules/{id} - Get a schedule
 * PATCH /api/v1/job-schedules/{id} - Partial update
 */
public class ScheduleController implements Controller {

    private static final Pattern SCHEDULES_PATTERN = Pattern.compile("^/api/v1/job-schedules$");
    private static final Pattern SCHEDULE_BY_ID_PATTERN = Pattern.compile("^/api/v1/job-schedules/([^/]+)$");

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (SCHEDULES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (SCHEDULE_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PATCH);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (SCHEDULES_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST) ? handleCreate(req) : handleList();
            }

            Matcher byId = SCHEDULE_BY_ID_PATTERN.matcher(path);
            if (byId.matches()) {
                String id = byId.group(1);
                return req.method().equals(HttpMethod.PATCH) ? handleUpdate(req, id) : handleGet(id);
            }

            return ControllerResponse.notFound("unknown schedule endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (DuplicateScheduleKeyException e) {
            return ControllerResponse.conflict(e.getMessage());
        }
    }

    private ControllerResponse handleList() {
        List<JobScheduleResponse> schedules = scheduleService.list().stream()
                .map(JobScheduleResponse::from)
                .toList();
        return ControllerResponse.ok(Map.of("schedules", schedules, "count", schedules.size()));
    }

    private ControllerResponse handleGet(String id) {
        Optional<JobSchedule> schedule = scheduleService.get(id);
        if (schedule.isEmpty()) {
            return ControllerResponse.notFound("schedule not found");
        }
        return ControllerResponse.ok(JobScheduleResponse.from(schedule.get()));
    }

    private ControllerResponse handleCreate(FullHttpRequest req) {
        CreateScheduleRequest request = Controller.readBody(req, CreateScheduleRequest.class, null);
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        request.validate();

        JobSchedule created = scheduleService.create(request.toDefinition());
        return ControllerResponse.json(HttpResponseStatus.CREATED, JobScheduleResponse.from(created));
    }

    private ControllerResponse handleUpdate(FullHttpRequest req, String id) {
        JsonNode body = Controller.readBody(req, JsonNode.class, null);
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("request body is required");
        }
        UpdateScheduleRequest request;
        try {
            request = Json.mapper().treeToValue(body, UpdateScheduleRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON body: " + e.getOriginalMessage(), e);
        }
        // An explicit null resets the timeout to the runner default; an absent field leaves it alone.
        boolean clearTimeout = body.has("timeoutSeconds") && body.get("timeoutSeconds").isNull();

        Optional<JobSchedule> updated = scheduleService.update(id, request.toPatch(clearTimeout));
        if (updated.isEmpty()) {
            return ControllerResponse.notFound("schedule not found");
        }
        return ControllerResponse.ok(JobScheduleResponse.from(updated.get()));
    }
}
