package io.dynbatch.bench;

import io.dynbatch.core.AttributeMap;
import io.dynbatch.core.BatchWriteBackend;
import io.dynbatch.core.BatchWriteResult;
import io.dynbatch.core.WriteRequest;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory table that applies at most {@code capacity} requests per call
 * and hands the rest back as unprocessed, like a throttled store.
 *
 * Rows are keyed by a single key attribute; puts overwrite, deletes remove.
 */
public final class CapacityLimitedBackend implements BatchWriteBackend {

    private final int capacity;
    private final String keyAttribute;
    private final Map<Object, AttributeMap> rows = new ConcurrentHashMap<>();
    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong declined = new AtomicLong();

    public CapacityLimitedBackend(int capacity, String keyAttribute) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.keyAttribute = keyAttribute;
    }

    @Override
    public synchronized BatchWriteResult batchWrite(String table, List<WriteRequest> requests) {
        calls.incrementAndGet();
        int accepted = Math.min(capacity, requests.size());
        for (WriteRequest r : requests.subList(0, accepted)) {
            Object key = r.attributes().get(keyAttribute);
            if (r instanceof WriteRequest.Put put) {
                rows.put(key, put.item());
            } else {
                rows.remove(key);
            }
        }
        if (accepted == requests.size()) {
            return BatchWriteResult.complete();
        }
        declined.addAndGet(requests.size() - accepted);
        return BatchWriteResult.unprocessed(table, requests.subList(accepted, requests.size()));
    }

    public long calls() {
        return calls.get();
    }

    public long declined() {
        return declined.get();
    }

    public Map<Object, AttributeMap> rows() {
        return Map.copyOf(rows);
    }
}
