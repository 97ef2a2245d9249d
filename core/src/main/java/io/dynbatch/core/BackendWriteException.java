package io.dynbatch.core;

/**
 * A bulk-write call failed as a whole (network, throttling, validation, ...).
 * <p>
 * The writer does not retry these. The batch that was in flight has already
 * left the buffer and its delivery status is unknown to the caller.
 */
public class BackendWriteException extends RuntimeException {

    private final String table;
    private final int batchSize;

    public BackendWriteException(String table, int batchSize, String message) {
        super(message);
        this.table = table;
        this.batchSize = batchSize;
    }

    public BackendWriteException(String table, int batchSize, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.batchSize = batchSize;
    }

    public String table() {
        return table;
    }

    /** Number of requests in the batch whose delivery is now unknown. */
    public int batchSize() {
        return batchSize;
    }
}
