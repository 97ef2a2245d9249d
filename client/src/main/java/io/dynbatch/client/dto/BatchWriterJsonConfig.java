package io.dynbatch.client.dto;

import java.util.List;

/**
 * JSON shape of a batch writer config file.
 * Example:
 *   {
 *     "flushAmount": 25,
 *     "dedupKeys": ["pk", "sk"],
 *     "exitBackoffMillis": 250
 *   }
 * Absent fields fall back to the writer defaults.
 */
public class BatchWriterJsonConfig {
    public Integer flushAmount;
    public List<String> dedupKeys;
    public Long exitBackoffMillis;
}
