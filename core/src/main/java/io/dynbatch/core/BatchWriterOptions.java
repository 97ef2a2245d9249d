// file: core/src/main/java/io/dynbatch/core/BatchWriterOptions.java
package io.dynbatch.core;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Tuning knobs for a {@link BatchWriter}.
 *
 * Supports:
 *  - flushAmount: max requests per bulk-write call; the buffer is flushed
 *                 once it holds this many (default 25)
 *  - dedupKeys:   primary key attribute names; when non-empty, a buffered
 *                 request with the same key values is replaced by the newer
 *                 one (default empty = no dedup)
 *  - exitBackoff: fixed pause between drain iterations on close while
 *                 unprocessed requests keep coming back (default zero)
 */
public record BatchWriterOptions(
        int flushAmount,
        List<String> dedupKeys,
        Duration exitBackoff
) {

    public static final int DEFAULT_FLUSH_AMOUNT = 25;

    private static final BatchWriterOptions DEFAULTS =
            new BatchWriterOptions(DEFAULT_FLUSH_AMOUNT, List.of(), Duration.ZERO);

    public BatchWriterOptions {
        if (flushAmount <= 0) {
            throw new IllegalArgumentException("flushAmount must be > 0, got: " + flushAmount);
        }
        dedupKeys = dedupKeys == null ? List.of() : List.copyOf(dedupKeys);
        var seen = new HashSet<String>();
        for (String k : dedupKeys) {
            if (k.isBlank()) throw new IllegalArgumentException("dedupKeys must not contain blank names");
            if (!seen.add(k)) throw new IllegalArgumentException("duplicate dedup key: " + k);
        }
        Objects.requireNonNull(exitBackoff, "exitBackoff");
        if (exitBackoff.isNegative()) {
            throw new IllegalArgumentException("exitBackoff must not be negative, got: " + exitBackoff);
        }
    }

    public static BatchWriterOptions defaults() {
        return DEFAULTS;
    }

    public boolean dedupEnabled() {
        return !dedupKeys.isEmpty();
    }

    public BatchWriterOptions withFlushAmount(int flushAmount) {
        return new BatchWriterOptions(flushAmount, dedupKeys, exitBackoff);
    }

    public BatchWriterOptions withDedupKeys(List<String> dedupKeys) {
        return new BatchWriterOptions(flushAmount, dedupKeys, exitBackoff);
    }

    public BatchWriterOptions withDedupKeys(String... dedupKeys) {
        return withDedupKeys(List.of(dedupKeys));
    }

    public BatchWriterOptions withExitBackoff(Duration exitBackoff) {
        return new BatchWriterOptions(flushAmount, dedupKeys, exitBackoff);
    }
}
