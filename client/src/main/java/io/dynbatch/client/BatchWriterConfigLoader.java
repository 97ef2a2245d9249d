package io.dynbatch.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dynbatch.client.dto.BatchWriterJsonConfig;
import io.dynbatch.core.BatchWriterOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Loads {@link BatchWriterOptions} from a JSON file (see {@link BatchWriterJsonConfig}).
 */
public final class BatchWriterConfigLoader {

    private BatchWriterConfigLoader() {
        // utility
    }

    public static BatchWriterOptions fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            BatchWriterJsonConfig cfg = mapper.readValue(path.toFile(), BatchWriterJsonConfig.class);
            return toOptions(cfg);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load batch writer config from " + path, e);
        }
    }

    static BatchWriterOptions toOptions(BatchWriterJsonConfig cfg) {
        BatchWriterOptions options = BatchWriterOptions.defaults();
        if (cfg == null) {
            return options;
        }
        if (cfg.flushAmount != null) {
            options = options.withFlushAmount(cfg.flushAmount);
        }
        if (cfg.dedupKeys != null) {
            options = options.withDedupKeys(cfg.dedupKeys);
        }
        if (cfg.exitBackoffMillis != null) {
            options = options.withExitBackoff(Duration.ofMillis(cfg.exitBackoffMillis));
        }
        return options;
    }
}
