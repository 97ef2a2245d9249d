package io.dynbatch.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Newest-wins collapsing of buffered requests that share a primary key.
 */
class BatchWriterDedupTest {

    private static final String TABLE = "events";

    @Test
    void second_put_for_same_key_replaces_the_first() {
        var writer = new BatchWriter(TABLE, new RecordingBackend(),
                BatchWriterOptions.defaults().withDedupKeys("K"));

        writer.put(Map.of("K", 1, "V", "a"));
        writer.put(Map.of("K", 1, "V", "b"));

        var buffered = writer.bufferedRequests();
        assertEquals(1, buffered.size());
        assertEquals("b", buffered.get(0).attributes().get("V"));
        assertEquals(1, writer.metrics().collapsed());
    }

    @Test
    void without_dedup_keys_both_requests_are_kept() {
        var writer = new BatchWriter(TABLE, new RecordingBackend());

        writer.put(Map.of("K", 1, "V", "a"));
        writer.put(Map.of("K", 1, "V", "b"));

        assertEquals(2, writer.bufferedCount());
        assertEquals(0, writer.metrics().collapsed());
    }

    @Test
    void put_and_delete_collapse_on_key_values_alone() {
        var writer = new BatchWriter(TABLE, new RecordingBackend(),
                BatchWriterOptions.defaults().withDedupKeys("K"));

        writer.put(Map.of("K", 7, "V", "a"));
        writer.delete(Map.of("K", 7));

        assertEquals(List.of(WriteRequest.delete(Map.of("K", 7))), writer.bufferedRequests());

        writer.put(Map.of("K", 7, "V", "c"));
        assertEquals(List.of(WriteRequest.put(Map.of("K", 7, "V", "c"))), writer.bufferedRequests());
    }

    @Test
    void replacement_moves_to_the_back_of_the_buffer() {
        var writer = new BatchWriter(TABLE, new RecordingBackend(),
                BatchWriterOptions.defaults().withDedupKeys("pk", "sk"));

        writer.put(Map.of("pk", "u1", "sk", 1, "v", "a"));
        writer.put(Map.of("pk", "u1", "sk", 2, "v", "b"));
        writer.put(Map.of("pk", "u2", "sk", 1, "v", "c"));
        writer.put(Map.of("pk", "u1", "sk", 1, "v", "d"));

        var values = writer.bufferedRequests().stream()
                .map(r -> r.attributes().get("v"))
                .toList();
        assertEquals(List.of("b", "c", "d"), values);
    }

    @Test
    void composite_key_requires_every_component_to_match() {
        var writer = new BatchWriter(TABLE, new RecordingBackend(),
                BatchWriterOptions.defaults().withDedupKeys("pk", "sk"));

        writer.put(Map.of("pk", "u1", "sk", 1));
        writer.put(Map.of("pk", "u1", "sk", 2));
        writer.put(Map.of("pk", "u2", "sk", 1));

        assertEquals(3, writer.bufferedCount());
    }

    @Test
    void attribute_order_in_the_row_does_not_matter() {
        var writer = new BatchWriter(TABLE, new RecordingBackend(),
                BatchWriterOptions.defaults().withDedupKeys("pk", "sk"));

        var first = new LinkedHashMap<String, Object>();
        first.put("pk", "u1");
        first.put("sk", 1);
        var second = new LinkedHashMap<String, Object>();
        second.put("sk", 1);
        second.put("v", "new");
        second.put("pk", "u1");

        writer.put(first);
        writer.put(second);

        assertEquals(List.of(WriteRequest.put(second)), writer.bufferedRequests());
    }

    @Test
    void null_key_values_compare_equal() {
        var writer = new BatchWriter(TABLE, new RecordingBackend(),
                BatchWriterOptions.defaults().withDedupKeys("pk"));

        var a = new LinkedHashMap<String, Object>();
        a.put("pk", null);
        a.put("v", 1);
        var b = new LinkedHashMap<String, Object>();
        b.put("pk", null);
        b.put("v", 2);

        writer.put(a);
        writer.put(b);

        assertEquals(List.of(WriteRequest.put(b)), writer.bufferedRequests());
    }

    @Test
    void missing_key_attribute_fails_fast_and_leaves_buffer_untouched() {
        var writer = new BatchWriter(TABLE, new RecordingBackend(),
                BatchWriterOptions.defaults().withDedupKeys("pk", "sk"));
        writer.put(Map.of("pk", "u1", "sk", 1));

        var ex = assertThrows(MissingKeyAttributeException.class,
                () -> writer.put(Map.of("pk", "u1", "v", "oops")));

        assertEquals("sk", ex.attribute());
        assertEquals(1, writer.bufferedCount());
        assertEquals(1, writer.metrics().accepted());
    }

    @Test
    void dedup_runs_before_the_threshold_check() {
        var backend = new RecordingBackend();
        var writer = new BatchWriter(TABLE, backend,
                BatchWriterOptions.defaults().withFlushAmount(2).withDedupKeys("pk"));

        writer.put(Map.of("pk", 1, "v", "a"));
        writer.put(Map.of("pk", 1, "v", "b"));

        assertEquals(0, backend.callCount());
        assertEquals(1, writer.bufferedCount());

        writer.put(Map.of("pk", 2, "v", "c"));
        assertEquals(1, backend.callCount());
        assertEquals(
                List.of(WriteRequest.put(Map.of("pk", 1, "v", "b")), WriteRequest.put(Map.of("pk", 2, "v", "c"))),
                backend.calls().get(0).requests()
        );
    }

    @Test
    void requeued_request_without_dedup_attributes_does_not_break_later_writes() {
        var unkeyed = WriteRequest.put(Map.of("v", "legacy"));
        var backend = new RecordingBackend()
                .then(batch -> BatchWriteResult.unprocessed(TABLE, List.of(unkeyed)));
        var writer = new BatchWriter(TABLE, backend,
                BatchWriterOptions.defaults().withFlushAmount(3).withDedupKeys("pk"));

        writer.put(Map.of("pk", 1, "v", "a"));
        writer.put(Map.of("pk", 2, "v", "a"));
        writer.put(Map.of("pk", 3, "v", "a"));
        assertEquals(List.of(unkeyed), writer.bufferedRequests());

        writer.put(Map.of("pk", 4, "v", "a"));
        writer.put(Map.of("pk", 4, "v", "b"));

        assertEquals(List.of(unkeyed, WriteRequest.put(Map.of("pk", 4, "v", "b"))), writer.bufferedRequests());
        assertEquals(1, writer.metrics().collapsed());
    }
}
