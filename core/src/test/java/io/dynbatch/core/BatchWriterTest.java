package io.dynbatch.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Buffering, threshold flush, unprocessed requeue and failure propagation.
 */
class BatchWriterTest {

    private static final String TABLE = "users";

    private static BatchWriterOptions flushEvery(int n) {
        return BatchWriterOptions.defaults().withFlushAmount(n);
    }

    private static Map<String, Object> row(int pk, String v) {
        return Map.of("pk", pk, "v", v);
    }

    @Test
    void fewer_puts_than_flush_amount_never_call_the_backend() {
        var backend = new RecordingBackend();
        var writer = new BatchWriter(TABLE, backend, flushEvery(5));

        for (int i = 0; i < 4; i++) {
            writer.put(row(i, "x"));
        }

        assertEquals(0, backend.callCount());
        assertEquals(4, writer.bufferedCount());
    }

    @Test
    void third_put_with_flush_amount_two_sends_first_two_in_call_order() {
        var backend = new RecordingBackend();
        var writer = new BatchWriter(TABLE, backend, flushEvery(2));

        writer.put(row(1, "a"));
        writer.put(row(2, "b"));
        writer.put(row(3, "c"));

        assertEquals(1, backend.callCount());
        var call = backend.calls().get(0);
        assertEquals(TABLE, call.table());
        assertEquals(List.of(WriteRequest.put(row(1, "a")), WriteRequest.put(row(2, "b"))), call.requests());
        assertEquals(List.of(WriteRequest.put(row(3, "c"))), writer.bufferedRequests());
    }

    @Test
    void default_options_flush_every_twenty_five_requests() {
        var backend = new RecordingBackend();
        var writer = new Table(TABLE, backend).batchWriter();

        for (int i = 0; i < 24; i++) {
            writer.put(row(i, "x"));
        }
        assertEquals(0, backend.callCount());

        writer.delete(Map.of("pk", 99));
        assertEquals(1, backend.callCount());
        assertEquals(25, backend.calls().get(0).requests().size());
        assertEquals(0, writer.bufferedCount());
    }

    @Test
    void unprocessed_requests_are_appended_to_the_buffer() {
        var first = WriteRequest.put(row(1, "a"));
        var second = WriteRequest.put(row(2, "b"));
        var backend = new RecordingBackend()
                .then(batch -> BatchWriteResult.unprocessed(TABLE, List.of(second)));
        var writer = new BatchWriter(TABLE, backend, flushEvery(2));

        writer.put(row(1, "a"));
        writer.put(row(2, "b"));

        assertEquals(List.of(first, second), backend.calls().get(0).requests());
        assertEquals(List.of(second), writer.bufferedRequests());
        assertEquals(1, writer.metrics().requeued());
    }

    @Test
    void unprocessed_for_other_tables_are_ignored() {
        var backend = new RecordingBackend()
                .then(batch -> BatchWriteResult.unprocessed("other", batch));
        var writer = new BatchWriter(TABLE, backend, flushEvery(1));

        writer.put(row(1, "a"));

        assertEquals(0, writer.bufferedCount());
    }

    @Test
    void null_result_counts_as_full_success() {
        var backend = new RecordingBackend().then(batch -> null);
        var writer = new BatchWriter(TABLE, backend, flushEvery(1));

        writer.put(row(1, "a"));

        assertEquals(0, writer.bufferedCount());
        assertEquals(1, writer.metrics().batchesSent());
    }

    @Test
    void requeued_requests_land_after_puts_made_while_the_batch_was_in_flight() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var backend = new RecordingBackend()
                .then(batch -> {
                    entered.countDown();
                    try {
                        assertTrue(release.await(5, TimeUnit.SECONDS));
                    } catch (InterruptedException e) {
                        throw new AssertionError(e);
                    }
                    return BatchWriteResult.unprocessed(TABLE, List.of(batch.get(0)));
                });
        var writer = new BatchWriter(TABLE, backend, flushEvery(2));

        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<?> flusher = exec.submit(() -> {
                writer.put(row(1, "a"));
                writer.put(row(2, "b")); // triggers the blocking flush
            });

            assertTrue(entered.await(5, TimeUnit.SECONDS));
            writer.put(row(3, "c")); // buffer is free while the backend call runs
            release.countDown();
            flusher.get(5, TimeUnit.SECONDS);
        } finally {
            exec.shutdownNow();
        }

        assertEquals(
                List.of(WriteRequest.put(row(3, "c")), WriteRequest.put(row(1, "a"))),
                writer.bufferedRequests()
        );
    }

    @Test
    void close_waits_for_a_batch_in_flight_on_another_thread_and_drains_what_it_declined() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var backend = new RecordingBackend()
                .then(batch -> {
                    entered.countDown();
                    try {
                        assertTrue(release.await(5, TimeUnit.SECONDS));
                    } catch (InterruptedException e) {
                        throw new AssertionError(e);
                    }
                    return BatchWriteResult.unprocessed(TABLE, batch);
                });
        var writer = new BatchWriter(TABLE, backend, flushEvery(1));

        ExecutorService exec = Executors.newFixedThreadPool(2);
        try {
            Future<?> flusher = exec.submit(() -> writer.put(row(1, "a")));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Future<?> closer = exec.submit(writer::close);
            Thread.sleep(100);
            assertFalse(closer.isDone(), "close must not return while a batch is in flight");

            release.countDown();
            flusher.get(5, TimeUnit.SECONDS);
            closer.get(5, TimeUnit.SECONDS);
        } finally {
            exec.shutdownNow();
        }

        assertEquals(0, writer.bufferedCount());
        assertEquals(2, backend.callCount());
        assertEquals(List.of(WriteRequest.put(row(1, "a"))), backend.calls().get(1).requests());
    }

    @Test
    void close_after_a_concurrent_failure_does_not_hang() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var backend = new RecordingBackend()
                .then(batch -> {
                    entered.countDown();
                    try {
                        assertTrue(release.await(5, TimeUnit.SECONDS));
                    } catch (InterruptedException e) {
                        throw new AssertionError(e);
                    }
                    throw new BackendWriteException(TABLE, batch.size(), "boom");
                });
        var writer = new BatchWriter(TABLE, backend, flushEvery(1));

        ExecutorService exec = Executors.newFixedThreadPool(2);
        try {
            Future<?> flusher = exec.submit(() -> writer.put(row(1, "a")));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<?> closer = exec.submit(writer::close);

            release.countDown();
            var ex = assertThrows(ExecutionException.class,
                    () -> flusher.get(5, TimeUnit.SECONDS));
            assertInstanceOf(BackendWriteException.class, ex.getCause());
            closer.get(5, TimeUnit.SECONDS);
        } finally {
            exec.shutdownNow();
        }

        assertEquals(1, backend.callCount());
        assertEquals(0, writer.bufferedCount());
    }

    @Test
    void requeued_requests_are_not_deduplicated() {
        var writerRef = new AtomicReference<BatchWriter>();
        // A newer write for pk=1 slips in while the older one is in flight and gets declined.
        var backend = new RecordingBackend()
                .then(batch -> {
                    writerRef.get().put(row(1, "newer"));
                    return BatchWriteResult.unprocessed(TABLE, batch);
                });
        var writer = new BatchWriter(TABLE, backend, flushEvery(2).withDedupKeys("pk"));
        writerRef.set(writer);

        writer.put(row(1, "older"));
        writer.put(row(2, "b"));

        assertEquals(
                List.of(
                        WriteRequest.put(row(1, "newer")),
                        WriteRequest.put(row(1, "older")),
                        WriteRequest.put(row(2, "b"))
                ),
                writer.bufferedRequests()
        );
    }

    @Test
    void later_put_replaces_only_the_first_of_several_duplicates() {
        var writerRef = new AtomicReference<BatchWriter>();
        var backend = new RecordingBackend()
                .then(batch -> {
                    writerRef.get().put(row(1, "newer"));
                    return BatchWriteResult.unprocessed(TABLE, batch);
                });
        var writer = new BatchWriter(TABLE, backend, flushEvery(2).withDedupKeys("pk"));
        writerRef.set(writer);
        writer.put(row(1, "older"));
        writer.put(row(2, "b")); // buffer: [newer, older, b]

        writer.put(row(1, "newest")); // drops "newer", then flushes the first two

        assertEquals(2, backend.callCount());
        assertEquals(
                List.of(WriteRequest.put(row(1, "older")), WriteRequest.put(row(2, "b"))),
                backend.calls().get(1).requests()
        );
        assertEquals(List.of(WriteRequest.put(row(1, "newest"))), writer.bufferedRequests());
        assertEquals(1, writer.metrics().collapsed());
    }

    @Test
    void backend_failure_propagates_from_put_and_the_batch_is_not_restored() {
        var backend = new RecordingBackend().then(RecordingBackend.fail(TABLE, "throttled"));
        var writer = new BatchWriter(TABLE, backend, flushEvery(2));

        writer.put(row(1, "a"));
        var ex = assertThrows(BackendWriteException.class, () -> writer.put(row(2, "b")));

        assertEquals("throttled", ex.getMessage());
        assertEquals(2, ex.batchSize());
        assertEquals(0, writer.bufferedCount());
        assertEquals(1, writer.metrics().backendFailures());
        assertEquals(0, writer.metrics().batchesSent());
    }

    @Test
    void non_backend_runtime_exceptions_also_propagate_unchanged() {
        var boom = new IllegalStateException("client not started");
        var backend = new RecordingBackend().then(batch -> {
            throw boom;
        });
        var writer = new BatchWriter(TABLE, backend, flushEvery(1));

        var ex = assertThrows(IllegalStateException.class, () -> writer.delete(Map.of("pk", 1)));
        assertSame(boom, ex);
    }

    @Test
    void writer_keeps_working_after_a_failed_flush() {
        var backend = new RecordingBackend().then(RecordingBackend.fail(TABLE, "down"));
        var writer = new BatchWriter(TABLE, backend, flushEvery(1));

        assertThrows(BackendWriteException.class, () -> writer.put(row(1, "a")));
        writer.put(row(2, "b"));

        assertEquals(2, backend.callCount());
        assertEquals(List.of(WriteRequest.put(row(2, "b"))), backend.calls().get(1).requests());
    }

    @Test
    void metrics_track_accepted_sent_and_requeued() {
        var backend = new RecordingBackend()
                .then(batch -> BatchWriteResult.unprocessed(TABLE, batch.subList(0, 1)));
        var writer = new BatchWriter(TABLE, backend, flushEvery(3));

        writer.put(row(1, "a"));
        writer.put(row(2, "b"));
        writer.delete(Map.of("pk", 3));

        var m = writer.metrics();
        assertEquals(3, m.accepted());
        assertEquals(1, m.batchesSent());
        assertEquals(3, m.requestsSent());
        assertEquals(1, m.requeued());
        assertEquals(0, m.collapsed());
    }

    @Test
    void constructor_rejects_missing_collaborators() {
        var backend = new RecordingBackend();
        assertThrows(NullPointerException.class, () -> new BatchWriter(null, backend));
        assertThrows(NullPointerException.class, () -> new BatchWriter(TABLE, null));
        assertThrows(NullPointerException.class, () -> new BatchWriter(TABLE, backend, null));
        assertThrows(IllegalArgumentException.class, () -> new BatchWriter(" ", backend));
    }
}
