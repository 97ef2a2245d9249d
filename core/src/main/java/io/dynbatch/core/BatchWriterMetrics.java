package io.dynbatch.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for one {@link BatchWriter}.
 *
 * JVM-local and thread-safe via AtomicLong; nothing is exported.
 *
 * Tracked:
 *  - accepted:        put/delete calls that reached the buffer.
 *  - collapsed:       buffered requests dropped because a newer one had the same key.
 *  - batchesSent:     bulk-write calls that returned normally.
 *  - requestsSent:    requests carried by those calls.
 *  - requeued:        requests the backend handed back as unprocessed.
 *  - backendFailures: bulk-write calls that threw.
 */
public final class BatchWriterMetrics {

    private final AtomicLong accepted        = new AtomicLong();
    private final AtomicLong collapsed       = new AtomicLong();
    private final AtomicLong batchesSent     = new AtomicLong();
    private final AtomicLong requestsSent    = new AtomicLong();
    private final AtomicLong requeued        = new AtomicLong();
    private final AtomicLong backendFailures = new AtomicLong();

    void recordAccepted(boolean collapsedOlder) {
        accepted.incrementAndGet();
        if (collapsedOlder) {
            collapsed.incrementAndGet();
        }
    }

    void recordBatch(int sent, int unprocessed) {
        batchesSent.incrementAndGet();
        requestsSent.addAndGet(sent);
        requeued.addAndGet(unprocessed);
    }

    void recordFailure() {
        backendFailures.incrementAndGet();
    }

    public long accepted()        { return accepted.get(); }
    public long collapsed()       { return collapsed.get(); }
    public long batchesSent()     { return batchesSent.get(); }
    public long requestsSent()    { return requestsSent.get(); }
    public long requeued()        { return requeued.get(); }
    public long backendFailures() { return backendFailures.get(); }

    @Override
    public String toString() {
        return "BatchWriterMetrics{" +
                "accepted=" + accepted.get() +
                ", collapsed=" + collapsed.get() +
                ", batchesSent=" + batchesSent.get() +
                ", requestsSent=" + requestsSent.get() +
                ", requeued=" + requeued.get() +
                ", backendFailures=" + backendFailures.get() +
                '}';
    }
}
