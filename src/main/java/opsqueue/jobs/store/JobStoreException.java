package opsqueue.jobs.store;

/**
 * Unchecked wrapper for a failed store operation.
 * The message names the operation; the cause carries the driver error.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
