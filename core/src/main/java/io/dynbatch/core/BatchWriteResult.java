package io.dynbatch.core;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one bulk-write call.
 * <p>
 * The backend reports only what it did NOT apply: a table name mapped to
 * the requests it declined (e.g. because of throughput limits). An empty
 * map means every request in the batch was applied.
 */
public record BatchWriteResult(Map<String, List<WriteRequest>> unprocessed) {

    private static final BatchWriteResult COMPLETE = new BatchWriteResult(Map.of());

    public BatchWriteResult {
        if (unprocessed == null) {
            unprocessed = Map.of();
        } else {
            Map<String, List<WriteRequest>> copy = new HashMap<>();
            unprocessed.forEach((table, requests) ->
                    copy.put(table, requests == null ? List.of() : List.copyOf(requests)));
            unprocessed = Map.copyOf(copy);
        }
    }

    /** Every request was applied. */
    public static BatchWriteResult complete() {
        return COMPLETE;
    }

    public static BatchWriteResult unprocessed(String table, List<WriteRequest> requests) {
        return new BatchWriteResult(Map.of(table, requests));
    }

    /** Requests declined for the given table; empty when none. */
    public List<WriteRequest> unprocessedFor(String table) {
        return unprocessed.getOrDefault(table, List.of());
    }

    public boolean isComplete() {
        return unprocessed.values().stream().allMatch(List::isEmpty);
    }
}
