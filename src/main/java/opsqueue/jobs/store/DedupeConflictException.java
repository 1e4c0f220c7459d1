package opsqueue.jobs.store;

/**
 * Raised when a write would give a dedupe key a second active row.
 */
public class DedupeConflictException extends JobStoreException {

    private final String dedupeKey;

    public DedupeConflictException(String dedupeKey, Throwable cause) {
        super("Active job already exists for dedupe key: " + dedupeKey, cause);
        this.dedupeKey = dedupeKey;
    }

    public String dedupeKey() {
        return dedupeKey;
    }
}
