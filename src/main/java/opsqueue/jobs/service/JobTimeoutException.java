package opsqueue.jobs.service;

import java.time.Duration;

/**
 * A handler ran past its job's deadline and was interrupted.
 */
public class JobTimeoutException extends RuntimeException {

    public static final String ERROR_CODE = "JOB_TIMEOUT";

    public JobTimeoutException(String jobId, Duration timeout) {
        super("Job " + jobId + " timed out after " + timeout.toSeconds() + "s");
    }
}
