// file: client/src/main/java/io/dynbatch/client/CliConfig.java
package io.dynbatch.client;

import io.dynbatch.core.BatchWriterOptions;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Parsed command line of {@link Cli}.
 *
 * Supports:
 *  - baseUrl:           storage endpoint base URL
 *  - configPath:        optional JSON writer config (see BatchWriterConfigLoader)
 *  - table:             target table (required)
 *  - flushAmount:       overrides the config file when set
 *  - dedupKeys:         overrides the config file when set
 *  - exitBackoffMillis: overrides the config file when set
 *  - input:             file to load, or "-" for stdin
 */
public record CliConfig(
        String baseUrl,
        String configPath,
        String table,
        Integer flushAmount,
        List<String> dedupKeys,
        Long exitBackoffMillis,
        String input
) {

    public static final String DEFAULT_BASE_URL = "http://localhost:8080";

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --base-url,    -u <url>
     *   --config,      -c <path>
     *   --table,       -t <name>
     *   --flush-amount    <n>
     *   --dedup-keys      <a,b,...>
     *   --exit-backoff-ms <millis>
     * followed by the command: load <file|->
     *
     * @throws IllegalArgumentException on any usage error
     */
    public static CliConfig fromArgs(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String configPath = null;
        String table = null;
        Integer flushAmount = null;
        List<String> dedupKeys = null;
        Long exitBackoffMillis = null;
        String input = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--base-url", "-u" -> baseUrl = value(args, i++);
                case "--config", "-c" -> configPath = value(args, i++);
                case "--table", "-t" -> table = value(args, i++);
                case "--flush-amount" -> flushAmount = parseInt(args[i], value(args, i++));
                case "--dedup-keys" -> dedupKeys = Arrays.stream(value(args, i++).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
                case "--exit-backoff-ms" -> exitBackoffMillis = parseLong(args[i], value(args, i++));
                case "load" -> {
                    input = value(args, i++);
                    if (i + 1 < args.length) {
                        throw new IllegalArgumentException("unexpected argument after load: " + args[i + 1]);
                    }
                }
                default -> throw new IllegalArgumentException("unknown option or command: " + args[i]);
            }
        }

        if (input == null) {
            throw new IllegalArgumentException("missing command: load <file|->");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("--table is required");
        }
        return new CliConfig(baseUrl, configPath, table, flushAmount, dedupKeys, exitBackoffMillis, input);
    }

    /** Writer options: config file first (if any), then command-line overrides. */
    public BatchWriterOptions writerOptions() {
        BatchWriterOptions options = configPath == null
                ? BatchWriterOptions.defaults()
                : BatchWriterConfigLoader.fromJsonFile(Path.of(configPath));
        if (flushAmount != null) {
            options = options.withFlushAmount(flushAmount);
        }
        if (dedupKeys != null) {
            options = options.withDedupKeys(dedupKeys);
        }
        if (exitBackoffMillis != null) {
            options = options.withExitBackoff(Duration.ofMillis(exitBackoffMillis));
        }
        return options;
    }

    public boolean readsStdin() {
        return "-".equals(input);
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("missing value for " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String flag, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + flag + ": " + raw);
        }
    }

    private static long parseLong(String flag, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + flag + ": " + raw);
        }
    }
}
