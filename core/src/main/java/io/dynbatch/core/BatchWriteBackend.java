// file: core/src/main/java/io/dynbatch/core/BatchWriteBackend.java
package io.dynbatch.core;

import java.util.List;

/**
 * Bulk-write capability of a table storage service.
 * <p>
 * This abstracts over the transport:
 *  - HttpBatchWriteBackend posts the batch as JSON to a remote endpoint.
 *  - Tests and the bench plug in in-memory implementations.
 * <p>
 * Calls are synchronous. Timeouts and transport-level retries belong to the
 * implementation, not to the writer.
 */
@FunctionalInterface
public interface BatchWriteBackend {

    /**
     * Apply a batch of mutations to one table.
     *
     * @param table    target table name
     * @param requests at most {@code flushAmount} requests, all for {@code table}
     * @return the requests that were not applied (possibly none)
     * @throws BackendWriteException if the call itself failed; the delivery
     *         status of every request in the batch is then unknown
     */
    BatchWriteResult batchWrite(String table, List<WriteRequest> requests);
}
