package io.dynbatch.core;

import java.util.Objects;

/**
 * Handle for one table on a backend; hands out batch writers scoped to it.
 */
public final class Table {

    private final String name;
    private final BatchWriteBackend backend;

    public Table(String name, BatchWriteBackend backend) {
        this.name = Objects.requireNonNull(name, "name");
        this.backend = Objects.requireNonNull(backend, "backend");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
    }

    public String name() {
        return name;
    }

    /** Writer with default options: flush every 25 requests, no dedup, no exit backoff. */
    public BatchWriter batchWriter() {
        return batchWriter(BatchWriterOptions.defaults());
    }

    public BatchWriter batchWriter(BatchWriterOptions options) {
        return new BatchWriter(name, backend, options);
    }
}
