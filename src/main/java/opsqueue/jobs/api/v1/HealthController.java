package opsqueue.jobs.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import opsqueue.jobs.api.Controller;
import opsqueue.jobs.api.v1.dto.HealthResponse;
import opsqueue.jobs.model.JobRunStatus;
import opsqueue.jobs.repository.JobRunRepository;
import opsqueue.jobs.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobRunRepository jobRunRepository;

    public HealthController(Database database, JobRunRepository jobRunRepository) {
        this.database = database;
        this.jobRunRepository = jobRunRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        HealthResponse.unhealthy("connection failed"));
            }

            Map<JobRunStatus, Integer> counts = jobRunRepository.countByStatus();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    counts.getOrDefault(JobRunStatus.QUEUED, 0),
                    counts.getOrDefault(JobRunStatus.RUNNING, 0));

            return ControllerResponse.ok(response);

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
