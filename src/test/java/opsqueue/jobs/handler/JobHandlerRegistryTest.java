package opsqueue.jobs.handler;

import opsqueue.jobs.model.JobType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobHandlerRegistryTest {

    private static JobHandler handlerFor(JobType type) {
        return new JobHandler() {
            @Override
            public JobType handlesType() {
                return type;
            }

            @Override
            public JobResult execute(JobContext context) {
                return JobResult.success();
            }
        };
    }

    private static JobHandlerRegistry.Builder allBut(JobType skipped) {
        JobHandlerRegistry.Builder builder = JobHandlerRegistry.builder();
        for (JobType type : JobType.values()) {
            if (type != skipped) {
                builder.register(handlerFor(type));
            }
        }
        return builder;
    }

    @Test
    void buildsWhenEveryTypeHasAHandler() {
        JobHandlerRegistry registry = allBut(null).build();

        assertEquals(EnumSet.allOf(JobType.class), registry.types());
        for (JobType type : JobType.values()) {
            assertEquals(type, registry.get(type).handlesType());
            assertTrue(registry.find(type).isPresent());
        }
    }

    @Test
    void missingHandlerFailsBuildNamingTheType() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> allBut(JobType.RETRY_FAILED_DELIVERIES).build());

        assertTrue(e.getMessage().contains("retry_failed_deliveries"));
    }

    @Test
    void duplicateHandlerIsRejected() {
        JobHandlerRegistry.Builder builder = JobHandlerRegistry.builder().register(handlerFor(JobType.SCORE_COMPUTE));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> builder.register(handlerFor(JobType.SCORE_COMPUTE)));
        assertTrue(e.getMessage().contains("score.compute"));
    }

    @Test
    void handlerWithoutTypeIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> JobHandlerRegistry.builder().register(handlerFor(null)));
    }

    @Test
    void loadWithoutRegisteredHandlersFails() {
        // No service file on the test classpath
        IllegalStateException e = assertThrows(IllegalStateException.class, JobHandlerRegistry::load);

        assertTrue(e.getMessage().contains("score.compute"), e.getMessage());
        assertTrue(e.getMessage().contains("0 handlers found via META-INF/services/opsqueue.jobs.handler.JobHandler"),
                e.getMessage());
    }

    @Test
    void contextReportsLastAttempt() {
        JobContext first = new JobContext("job-1", JobType.SCORE_COMPUTE, Map.of(), 1, 3,
                () -> false, () -> true);
        JobContext last = new JobContext("job-1", JobType.SCORE_COMPUTE, Map.of(), 3, 3,
                () -> true, () -> false);

        assertFalse(first.isLastAttempt());
        assertFalse(first.isCancelRequested());
        assertTrue(first.heartbeat());
        assertTrue(last.isLastAttempt());
        assertTrue(last.isCancelRequested());
        assertFalse(last.heartbeat());
    }
}
