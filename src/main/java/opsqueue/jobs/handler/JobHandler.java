package opsqueue.jobs.handler;

import opsqueue.jobs.model.JobType;

/**
 * Business logic for one job type.
 *
 * <p>
 * Implementations live outside the queue and are registered in a
 * {@link JobHandlerRegistry}, either explicitly or through
 * {@code META-INF/services/opsqueue.jobs.handler.JobHandler}.
 *
 * <p>
 * A handler may be invoked concurrently for different rows, so it must be
 * thread-safe. It runs on a worker thread under the job's timeout and is
 * interrupted when the deadline passes; long-running handlers should call
 * {@link JobContext#heartbeat()} and check {@link JobContext#isCancelRequested()}.
 */
public interface JobHandler {

    /**
     * The job type this handler processes.
     */
    JobType handlesType();

    /**
     * Execute one attempt of a job.
     *
     * @param context row id, payload and lease controls
     * @return the outcome; a thrown exception counts as a failed attempt and
     *         goes through the retry budget
     * @throws Exception any error during execution
     */
    JobResult execute(JobContext context) throws Exception;
}
