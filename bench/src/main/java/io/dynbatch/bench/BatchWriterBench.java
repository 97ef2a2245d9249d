// file: bench/src/main/java/io/dynbatch/bench/BatchWriterBench.java
package io.dynbatch.bench;

import io.dynbatch.client.HttpBatchWriteBackend;
import io.dynbatch.core.BatchWriteBackend;
import io.dynbatch.core.BatchWriter;
import io.dynbatch.core.BatchWriterMetrics;
import io.dynbatch.core.BatchWriterOptions;
import io.dynbatch.core.WriteRequest;

import java.io.PrintStream;
import java.net.URI;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Workload driver for a shared BatchWriter.
 *
 * Usage:
 *   java -jar bench.jar \
 *     --backend memory|http \
 *     --base-url http://localhost:8080 \
 *     --table bench \
 *     --threads 4 \
 *     --ops-per-thread 50000 \
 *     --keyspace 10000 \
 *     --zipf-skew 0.99 \
 *     --delete-ratio 0.1 \
 *     --payload-bytes 128 \
 *     --flush-amount 25 \
 *     --dedup true \
 *     --capacity 20 \
 *     --exit-backoff-ms 0
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout with per-call latency samples (a call that triggers a
 *     flush includes the bulk write):
 *       op,success,latency_ms
 */
public final class BatchWriterBench {
    private static final Logger log = Logger.getLogger(BatchWriterBench.class.getName());

    record Sample(String op, boolean ok, double latencyMs) {}

    record Summary(
            long ops,
            long failed,
            double seconds,
            BatchWriterMetrics metrics,
            double p50,
            double p95,
            double p99,
            List<Sample> samples
    ) {
        double throughput() {
            return seconds > 0 ? ops / seconds : Double.NaN;
        }
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        String backendKind = cfg.getOrDefault("backend", "memory");
        String table = cfg.getOrDefault("table", "bench");
        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int opsPerThread = Integer.parseInt(cfg.getOrDefault("ops-per-thread", "50000"));
        int keyspace = Integer.parseInt(cfg.getOrDefault("keyspace", "10000"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        double deleteRatio = Double.parseDouble(cfg.getOrDefault("delete-ratio", "0.1"));
        int payloadBytes = Integer.parseInt(cfg.getOrDefault("payload-bytes", "128"));

        BatchWriterOptions options = BatchWriterOptions.defaults()
                .withFlushAmount(Integer.parseInt(
                        cfg.getOrDefault("flush-amount", String.valueOf(BatchWriterOptions.DEFAULT_FLUSH_AMOUNT))))
                .withExitBackoff(Duration.ofMillis(Long.parseLong(cfg.getOrDefault("exit-backoff-ms", "0"))));
        if (Boolean.parseBoolean(cfg.getOrDefault("dedup", "true"))) {
            options = options.withDedupKeys(ZipfianRowGenerator.KEY_ATTRIBUTE);
        }

        BatchWriteBackend backend = switch (backendKind) {
            case "memory" -> new CapacityLimitedBackend(
                    Integer.parseInt(cfg.getOrDefault("capacity", "20")), ZipfianRowGenerator.KEY_ATTRIBUTE);
            case "http" -> new HttpBatchWriteBackend(URI.create(cfg.getOrDefault("base-url", "http://localhost:8080")));
            default -> throw new IllegalArgumentException("unknown backend: " + backendKind);
        };

        Summary summary = run(backend, table, options, threads, opsPerThread,
                keyspace, zipfSkew, deleteRatio, payloadBytes);
        print(summary, System.err, System.out);
        if (backend instanceof CapacityLimitedBackend mem) {
            System.err.printf("memory backend: calls=%d, declined=%d, rows=%d%n",
                    mem.calls(), mem.declined(), mem.rows().size());
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + a);
            }
            out.put(a.substring(2), args[++i]);
        }
        return out;
    }

    /**
     * Drive {@code threads} workers through one writer, then close it and
     * time the whole run including the drain.
     */
    static Summary run(
            BatchWriteBackend backend,
            String table,
            BatchWriterOptions options,
            int threads,
            int opsPerThread,
            int keyspace,
            double zipfSkew,
            double deleteRatio,
            int payloadBytes
    ) throws InterruptedException {
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();

        // Built up front so bad workload arguments fail the run instead of a worker.
        List<ZipfianRowGenerator> generators = new ArrayList<>(threads);
        for (int t = 0; t < threads; t++) {
            generators.add(new ZipfianRowGenerator(keyspace, zipfSkew, deleteRatio, payloadBytes, 42L + t));
        }

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        long start = System.nanoTime();
        BatchWriter writer = new BatchWriter(table, backend, options);
        try {
            List<Future<?>> workers = new ArrayList<>(threads);
            for (ZipfianRowGenerator rows : generators) {
                workers.add(exec.submit(() -> {
                    for (int i = 0; i < opsPerThread; i++) {
                        samples.add(submit(writer, rows.next()));
                    }
                }));
            }
            exec.shutdown();
            for (Future<?> worker : workers) {
                try {
                    worker.get(1, TimeUnit.HOURS);
                } catch (ExecutionException e) {
                    throw new IllegalStateException("bench worker failed", e.getCause());
                } catch (TimeoutException e) {
                    throw new IllegalStateException("bench workers did not finish within an hour", e);
                }
            }
        } finally {
            exec.shutdownNow();
            writer.close();
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);

        List<Double> latencies = new ArrayList<>(all.size());
        long failed = 0;
        for (Sample s : all) {
            if (s.ok()) {
                latencies.add(s.latencyMs());
            } else {
                failed++;
            }
        }
        Collections.sort(latencies);

        return new Summary(all.size(), failed, seconds, writer.metrics(),
                percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99), all);
    }

    private static Sample submit(BatchWriter writer, WriteRequest request) {
        String op = request instanceof WriteRequest.Put ? "PUT" : "DELETE";
        long start = System.nanoTime();
        boolean ok = false;
        try {
            if (request instanceof WriteRequest.Put put) {
                writer.put(put.item());
            } else if (request instanceof WriteRequest.Delete delete) {
                writer.delete(delete.key());
            }
            ok = true;
        } catch (RuntimeException e) {
            log.log(Level.FINE, "bench " + op + " failed", e);
        }
        return new Sample(op, ok, (System.nanoTime() - start) / 1_000_000.0);
    }

    static void print(Summary s, PrintStream summaryOut, PrintStream csvOut) {
        BatchWriterMetrics m = s.metrics();
        summaryOut.printf(
                "throughput=%.2f ops/s, ok=%d, err=%d, collapsed=%d, batches=%d, requeued=%d, "
                        + "p50=%.3fms, p95=%.3fms, p99=%.3fms%n",
                s.throughput(), s.ops() - s.failed(), s.failed(), m.collapsed(), m.batchesSent(), m.requeued(),
                s.p50(), s.p95(), s.p99()
        );

        csvOut.println("op,success,latency_ms");
        for (Sample sample : s.samples()) {
            csvOut.printf("%s,%s,%.3f%n", sample.op(), sample.ok() ? "1" : "0", sample.latencyMs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
