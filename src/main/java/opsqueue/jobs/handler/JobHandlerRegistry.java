package opsqueue.jobs.handler;

import opsqueue.jobs.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Immutable mapping from every {@link JobType} to its handler.
 *
 * <p>
 * A registry can only be built when each job type has exactly one handler,
 * so a missing handler is a startup error rather than a failed job.
 */
public final class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<JobType, JobHandler> handlers;

    private JobHandlerRegistry(Map<JobType, JobHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
    }

    public static final String SERVICE_FILE = "META-INF/services/" + JobHandler.class.getName();

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Discover handlers on the classpath via {@link ServiceLoader}. Handler
     * jars list their implementations in
     * {@code META-INF/services/opsqueue.jobs.handler.JobHandler}; this
     * repository ships none, so a deployment must add one for every job type.
     *
     * @throws IllegalStateException if a type is left unmapped or mapped twice
     */
    public static JobHandlerRegistry load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JobHandlerRegistry load(ClassLoader classLoader) {
        Builder builder = builder();
        int discovered = 0;
        for (JobHandler handler : ServiceLoader.load(JobHandler.class, classLoader)) {
            builder.register(handler);
            discovered++;
        }
        try {
            return builder.build();
        } catch (IllegalStateException e) {
            throw new IllegalStateException(e.getMessage() + " (" + discovered + " handlers found via "
                    + SERVICE_FILE + ")", e);
        }
    }

    public Optional<JobHandler> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public JobHandler get(JobType type) {
        JobHandler handler = handlers.get(type);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for job type " + type.wire());
        }
        return handler;
    }

    public Set<JobType> types() {
        return handlers.keySet();
    }

    public static final class Builder {
        private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

        private Builder() {
        }

        /**
         * @throws IllegalStateException if the handler's type already has a handler
         */
        public Builder register(JobHandler handler) {
            JobType type = handler.handlesType();
            if (type == null) {
                throw new IllegalStateException(handler.getClass().getName() + " declares no job type");
            }
            JobHandler existing = handlers.get(type);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handlers registered for job type " + type.wire() + ": "
                        + existing.getClass().getName() + " and " + handler.getClass().getName());
            }
            handlers.put(type, handler);
            log.debug("Registered handler {} for job type {}", handler.getClass().getSimpleName(), type.wire());
            return this;
        }

        /**
         * @throws IllegalStateException naming every job type without a handler
         */
        public JobHandlerRegistry build() {
            Set<JobType> missing = EnumSet.allOf(JobType.class);
            missing.removeAll(handlers.keySet());
            if (!missing.isEmpty()) {
                throw new IllegalStateException("No handler registered for job types: "
                        + missing.stream().map(JobType::wire).toList());
            }
            log.info("Job handler registry built with {} handlers", handlers.size());
            return new JobHandlerRegistry(handlers);
        }
    }
}
