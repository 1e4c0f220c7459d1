package opsqueue.jobs.store;

/**
 * Raised when a schedule is created with a key that is already taken.
 */
public class DuplicateScheduleKeyException extends JobStoreException {

    public DuplicateScheduleKeyException(String key, Throwable cause) {
        super("Schedule key already exists: " + key, cause);
    }
}
