package net.homeroute.exception;

/**
 * Signals that the persisted registry changed between read and write so callers
 * can reload and retry instead of overwriting a concurrent change.
 */
public class StaleRegistryException extends IllegalStateException {

    private final long expectedRevision;
    private final long storedRevision;

    public StaleRegistryException(long expectedRevision, long storedRevision) {
        super("Registry was modified concurrently (expected revision " + expectedRevision
            + ", stored revision " + storedRevision + "); reload and retry");
        this.expectedRevision = expectedRevision;
        this.storedRevision = storedRevision;
    }

    public long getExpectedRevision() {
        return expectedRevision;
    }

    public long getStoredRevision() {
        return storedRevision;
    }
}
