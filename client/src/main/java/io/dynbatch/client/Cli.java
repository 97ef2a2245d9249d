// file: client/src/main/java/io/dynbatch/client/Cli.java
package io.dynbatch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.dynbatch.core.BatchWriteBackend;
import io.dynbatch.core.BatchWriter;
import io.dynbatch.core.BatchWriterMetrics;
import io.dynbatch.core.BatchWriterOptions;
import io.dynbatch.core.MissingKeyAttributeException;
import io.dynbatch.core.WriteRequest;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Bulk loader: streams JSON-lines mutations into a table through a BatchWriter.
 *
 * Usage:
 *   dynbatch-cli [--base-url http://host:port] [--config writer.json] --table <name>
 *                [--flush-amount N] [--dedup-keys a,b] [--exit-backoff-ms M]
 *                load <file|->
 *
 * Each input line is one request:
 *   {"PutRequest": {"Item": {"pk": "u1", "name": "ada"}}}
 *   {"DeleteRequest": {"Key": {"pk": "u2"}}}
 *
 * Examples:
 *   dynbatch-cli --table users load users.jsonl
 *   cat changes.jsonl | dynbatch-cli --table users --dedup-keys pk load -
 */
public final class Cli {

    private final BatchWriteBackend backend;
    private final PrintStream out;
    private final WriteRequestJson codec = new WriteRequestJson();

    Cli(BatchWriteBackend backend, PrintStream out) {
        this.backend = backend;
        this.out = out;
    }

    public static void main(String[] args) {
        CliConfig cfg = null;
        try {
            cfg = CliConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            usageAndExit(e.getMessage());
        }

        try {
            Cli cli = new Cli(new HttpBatchWriteBackend(URI.create(cfg.baseUrl())), System.out);
            BatchWriterOptions options = cfg.writerOptions();
            if (cfg.readsStdin()) {
                var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                cli.load(cfg.table(), options, in);
            } else {
                try (var in = Files.newBufferedReader(Path.of(cfg.input()), StandardCharsets.UTF_8)) {
                    cli.load(cfg.table(), options, in);
                }
            }
        } catch (CliException | IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Feed every line of {@code in} to a writer for {@code table}.
     * <p>
     * The writer is drained even when a line is malformed, so everything read
     * before the bad line is still delivered.
     *
     * @return the writer's counters after the drain
     */
    BatchWriterMetrics load(String table, BatchWriterOptions options, BufferedReader in) throws IOException {
        BatchWriterMetrics metrics;
        int lineNo = 0;
        try (BatchWriter writer = new BatchWriter(table, backend, options)) {
            metrics = writer.metrics();
            String line;
            while ((line = in.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                WriteRequest request = parse(line, lineNo);
                try {
                    if (request instanceof WriteRequest.Put put) {
                        writer.put(put.item());
                    } else if (request instanceof WriteRequest.Delete delete) {
                        writer.delete(delete.key());
                    }
                } catch (MissingKeyAttributeException e) {
                    throw new CliException("line " + lineNo + ": " + e.getMessage());
                }
            }
        }
        out.printf("loaded %d lines into %s: %s%n", lineNo, table, metrics);
        return metrics;
    }

    private WriteRequest parse(String line, int lineNo) {
        try {
            return codec.parseRequest(line);
        } catch (JsonProcessingException e) {
            throw new CliException("line " + lineNo + ": invalid JSON (" + e.getOriginalMessage() + ")");
        } catch (IllegalArgumentException e) {
            throw new CliException("line " + lineNo + ": " + e.getMessage());
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  dynbatch-cli [--base-url http://host:port] [--config writer.json] --table <name>
                               [--flush-amount N] [--dedup-keys a,b] [--exit-backoff-ms M]
                               load <file|->
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
