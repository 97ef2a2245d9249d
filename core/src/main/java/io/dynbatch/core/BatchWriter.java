// file: core/src/main/java/io/dynbatch/core/BatchWriter.java
package io.dynbatch.core;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers puts and deletes for a single table and ships them in bulk.
 * <p>
 * Responsibilities:
 *  - Buffering: every put/delete is appended to an in-memory FIFO. With
 *    dedup keys configured, an older buffered request for the same key is
 *    dropped first, so the newest request wins.
 *  - Flushing: once the buffer holds {@code flushAmount} requests, the first
 *    {@code flushAmount} are sent in one bulk-write call. Requests the backend
 *    returns as unprocessed go to the END of the buffer (no dedup, no
 *    reprioritisation) and ride along with a later flush.
 *  - Draining: {@link #close()} flushes until the buffer is empty, sleeping
 *    {@code exitBackoff} between iterations while unprocessed requests keep
 *    coming back.
 * <p>
 * Failure semantics:
 *  - A backend failure propagates to whichever call triggered the flush
 *    (put, delete or close). The batch has already left the buffer and is
 *    NOT restored: its delivery status is unknown.
 *  - Only the backend's "unprocessed items" are retried, never hard failures.
 * <p>
 * Typical use:
 * <pre>{@code
 * try (var writer = table.batchWriter(options)) {
 *     writer.put(Map.of("pk", "user#1", "name", "ada"));
 *     writer.delete(Map.of("pk", "user#2"));
 * } // drains here, on normal and exceptional exit
 * }</pre>
 * If the drain itself fails, the remaining requests are lost; on an
 * exceptional exit the drain error is attached as a suppressed exception.
 * <p>
 * Thread-safety: buffer mutations (dedup scan + append, batch removal,
 * requeue) are atomic under an internal monitor. The backend call runs
 * outside it, so requests added by other threads while a batch is in flight
 * are queued ahead of that batch's unprocessed requests. {@link #close()}
 * also waits for batches other threads still have in flight, so their
 * unprocessed requests are drained before it returns. No background
 * threads are started; all work happens on the calling thread.
 */
public final class BatchWriter implements AutoCloseable {
    private static final Logger log = Logger.getLogger(BatchWriter.class.getName());

    private final String table;
    private final BatchWriteBackend backend;
    private final BatchWriterOptions options;
    private final DedupKeyExtractor dedup; // null when dedup is disabled
    private final BatchWriterMetrics metrics = new BatchWriterMetrics();

    private final Object lock = new Object();
    private final Deque<WriteRequest> buffer = new ArrayDeque<>();
    private int inFlight; // batches taken from the buffer whose send has not finished
    private boolean closed;

    public BatchWriter(String table, BatchWriteBackend backend) {
        this(table, backend, BatchWriterOptions.defaults());
    }

    public BatchWriter(String table, BatchWriteBackend backend, BatchWriterOptions options) {
        this.table = Objects.requireNonNull(table, "table");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.options = Objects.requireNonNull(options, "options");
        if (table.isBlank()) throw new IllegalArgumentException("table must not be blank");
        this.dedup = options.dedupEnabled() ? new DedupKeyExtractor(options.dedupKeys()) : null;
    }

    public String table() {
        return table;
    }

    public BatchWriterOptions options() {
        return options;
    }

    public BatchWriterMetrics metrics() {
        return metrics;
    }

    /** Queue a full item for writing. May trigger a flush. */
    public void put(Map<String, ?> item) {
        add(WriteRequest.put(item));
    }

    public void put(AttributeMap item) {
        add(new WriteRequest.Put(item));
    }

    /** Queue a delete of the item identified by {@code key}. May trigger a flush. */
    public void delete(Map<String, ?> key) {
        add(WriteRequest.delete(key));
    }

    public void delete(AttributeMap key) {
        add(new WriteRequest.Delete(key));
    }

    /** Snapshot of the buffer, oldest first. */
    public List<WriteRequest> bufferedRequests() {
        synchronized (lock) {
            return List.copyOf(buffer);
        }
    }

    public int bufferedCount() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    /**
     * Drain the buffer: flush until it is empty.
     * <p>
     * Always runs, even if an earlier flush already emptied the buffer (in
     * which case no backend call is made). Batches sent concurrently by other
     * threads are waited for, and whatever they hand back as unprocessed is
     * drained too. Loops forever if the backend never stops returning
     * unprocessed requests.
     *
     * @throws BackendWriteException     if a flush fails; remaining requests stay undelivered
     * @throws DrainInterruptedException if interrupted during the exit backoff or
     *                                   while waiting for an in-flight batch
     */
    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
        }

        Duration backoff = options.exitBackoff();
        int batches = 0;
        List<WriteRequest> batch;
        while ((batch = nextDrainBatch()) != null) {
            send(batch);
            batches++;
            int remaining = bufferedCount();
            if (remaining > 0 && !backoff.isZero()) {
                try {
                    TimeUnit.NANOSECONDS.sleep(backoff.toNanos());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DrainInterruptedException(remaining, e);
                }
            }
        }

        if (batches > 0) {
            log.log(Level.INFO, "Drained table {0} in {1} batch(es); {2}",
                    new Object[]{table, batches, metrics});
        }
    }

    /**
     * Next batch to send while draining, or null once the buffer is empty
     * and no other thread has a batch in flight.
     */
    private List<WriteRequest> nextDrainBatch() {
        synchronized (lock) {
            while (buffer.isEmpty() && inFlight > 0) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DrainInterruptedException(buffer.size(), e);
                }
            }
            return buffer.isEmpty() ? null : takeBatch();
        }
    }

    // ---------- buffering ----------

    private void add(WriteRequest request) {
        // Extract before locking so a bad key fails without touching the buffer.
        List<Object> key = dedup == null ? null : dedup.extract(request);

        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("BatchWriter for table " + table + " is closed");
            }
            boolean collapsed = key != null && removeDuplicate(key);
            buffer.addLast(request);
            metrics.recordAccepted(collapsed);
        }
        flushIfNeeded();
    }

    /**
     * Remove the first buffered request whose key tuple equals {@code key}.
     * Caller holds the lock.
     */
    private boolean removeDuplicate(List<Object> key) {
        WriteRequest first = null;
        int matches = 0;
        for (WriteRequest existing : buffer) {
            // Requeued requests may lack a dedup attribute; they never match.
            if (key.equals(dedup.extractIfPresent(existing))) {
                if (first == null) {
                    first = existing;
                }
                matches++;
            }
        }
        if (first == null) {
            return false;
        }
        if (matches > 1) {
            // Only reachable when requeued unprocessed requests raced with new writes.
            log.log(Level.WARNING,
                    "Table {0}: {1} buffered requests share dedup key {2}; replacing the oldest only",
                    new Object[]{table, matches, key});
        }
        buffer.removeFirstOccurrence(first);
        WriteRequest skipped = first;
        log.fine(() -> "With dedup enabled, skipping request: " + skipped);
        return true;
    }

    // ---------- flushing ----------

    private void flushIfNeeded() {
        List<WriteRequest> batch;
        synchronized (lock) {
            if (buffer.size() < options.flushAmount()) {
                return;
            }
            batch = takeBatch();
        }
        send(batch);
    }

    /** Caller holds the lock. The matching {@link #send} releases the in-flight slot. */
    private List<WriteRequest> takeBatch() {
        inFlight++;
        int n = Math.min(options.flushAmount(), buffer.size());
        List<WriteRequest> batch = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            batch.add(buffer.pollFirst());
        }
        return batch;
    }

    private void send(List<WriteRequest> batch) {
        List<WriteRequest> unprocessed;
        int buffered;
        try {
            BatchWriteResult result;
            try {
                result = backend.batchWrite(table, List.copyOf(batch));
            } catch (RuntimeException e) {
                metrics.recordFailure();
                log.log(Level.WARNING,
                        "Batch write to " + table + " failed; " + batch.size() + " requests have unknown delivery status",
                        e);
                throw e;
            }

            unprocessed = result == null ? List.of() : result.unprocessedFor(table);
            warnOnUnkeyedRequeues(unprocessed);
            synchronized (lock) {
                buffer.addAll(unprocessed);
                buffered = buffer.size();
            }
        } finally {
            // Requeue (if any) happens first, so a waiting close() sees it.
            synchronized (lock) {
                inFlight--;
                lock.notifyAll();
            }
        }
        metrics.recordBatch(batch.size(), unprocessed.size());

        log.log(Level.FINE, "Batch write sent {0}, unprocessed: {1}, buffer {2}",
                new Object[]{batch.size(), unprocessed.size(), buffered});
    }

    /** Unprocessed requests are requeued as returned, even when they lack a dedup attribute. */
    private void warnOnUnkeyedRequeues(List<WriteRequest> unprocessed) {
        if (dedup == null) {
            return;
        }
        long unkeyed = unprocessed.stream().filter(r -> dedup.extractIfPresent(r) == null).count();
        if (unkeyed > 0) {
            log.log(Level.WARNING,
                    "Table {0}: backend returned {1} unprocessed request(s) missing dedup attributes {2}; "
                            + "they are requeued but never deduplicated",
                    new Object[]{table, unkeyed, options.dedupKeys()});
        }
    }
}
