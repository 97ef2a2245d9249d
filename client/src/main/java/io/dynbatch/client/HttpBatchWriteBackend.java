// file: client/src/main/java/io/dynbatch/client/HttpBatchWriteBackend.java
package io.dynbatch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.dynbatch.core.BackendWriteException;
import io.dynbatch.core.BatchWriteBackend;
import io.dynbatch.core.BatchWriteResult;
import io.dynbatch.core.WriteRequest;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP/JSON bulk-write backend.
 *
 * Talks to a storage endpoint:
 *
 *   POST /batch-write
 *   {"RequestItems": {"<table>": [ ... ]}}
 *
 * and expects 200 with:
 *
 *   {"UnprocessedItems": {"<table>": [ ... ]}}
 *
 * Any other status, an I/O error, an interrupt or an unreadable response
 * body becomes a {@link BackendWriteException}. This class never retries;
 * declined requests are reported back to the writer as unprocessed.
 */
public final class HttpBatchWriteBackend implements BatchWriteBackend {
    private static final Logger log = Logger.getLogger(HttpBatchWriteBackend.class.getName());

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final URI endpoint;
    private final HttpClient http;
    private final Duration requestTimeout;
    private final WriteRequestJson codec = new WriteRequestJson();

    public HttpBatchWriteBackend(URI baseUri) {
        this(
                baseUri,
                HttpClient.newBuilder().connectTimeout(DEFAULT_CONNECT_TIMEOUT).build(),
                DEFAULT_REQUEST_TIMEOUT
        );
    }

    public HttpBatchWriteBackend(URI baseUri, HttpClient http, Duration requestTimeout) {
        Objects.requireNonNull(baseUri, "baseUri");
        String base = baseUri.toString();
        base = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.endpoint = URI.create(base + "/batch-write");
        this.http = Objects.requireNonNull(http, "http");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public BatchWriteResult batchWrite(String table, List<WriteRequest> requests) {
        int n = requests.size();
        try {
            String body = codec.encodeBatch(table, requests);

            HttpRequest req = HttpRequest.newBuilder(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            long start = System.nanoTime();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            long tookMs = (System.nanoTime() - start) / 1_000_000L;

            if (resp.statusCode() != 200) {
                throw new BackendWriteException(table, n,
                        "POST " + endpoint + " returned HTTP " + resp.statusCode() + ": " + resp.body());
            }

            var unprocessed = codec.decodeUnprocessed(resp.body());
            log.log(Level.FINE, "POST {0} table={1} sent={2} unprocessed={3} ({4}ms)",
                    new Object[]{endpoint, table, n, unprocessed.getOrDefault(table, List.of()).size(), tookMs});
            return new BatchWriteResult(unprocessed);
        } catch (JsonProcessingException | IllegalArgumentException badJson) {
            throw new BackendWriteException(table, n,
                    "invalid bulk-write exchange with " + endpoint + ": " + badJson.getMessage(), badJson);
        } catch (IOException e) {
            throw new BackendWriteException(table, n,
                    "bulk-write of " + n + " requests to " + endpoint + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendWriteException(table, n,
                    "interrupted during bulk-write to " + endpoint, e);
        }
    }
}
