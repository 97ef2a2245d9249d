package io.dynbatch.bench;

import io.dynbatch.core.AttributeMap;
import io.dynbatch.core.WriteRequest;

import java.util.Random;

/**
 * Produces write requests whose partition keys follow a Zipf distribution
 * over {@code keyspace} ids, so a few hot keys repeat often enough to
 * exercise dedup.
 *
 * Rows look like {@code {"pk": "key-17", "seq": 412, "payload": "xxxx..."}};
 * deletes carry only {@code pk}. Not thread-safe: give each worker its own.
 */
public final class ZipfianRowGenerator {

    public static final String KEY_ATTRIBUTE = "pk";

    private final double[] cdf;
    private final Random rnd;
    private final double deleteRatio;
    private final String payload;
    private long seq;

    public ZipfianRowGenerator(int keyspace, double skew, double deleteRatio, int payloadBytes, long seed) {
        if (keyspace <= 0) throw new IllegalArgumentException("keyspace must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");
        if (deleteRatio < 0.0 || deleteRatio > 1.0) {
            throw new IllegalArgumentException("deleteRatio must be in [0, 1]");
        }
        if (payloadBytes < 0) throw new IllegalArgumentException("payloadBytes must be >= 0");

        this.rnd = new Random(seed);
        this.deleteRatio = deleteRatio;
        this.payload = "x".repeat(payloadBytes);

        // Unnormalized running sum of 1/rank^skew, scaled to [0, 1] in place.
        this.cdf = new double[keyspace];
        double total = 0.0;
        for (int rank = 1; rank <= keyspace; rank++) {
            total += Math.pow(rank, -skew);
            cdf[rank - 1] = total;
        }
        for (int i = 0; i < keyspace; i++) {
            cdf[i] /= total;
        }
        cdf[keyspace - 1] = 1.0;
    }

    /** Key id in [0, keyspace); id 0 is the hottest. */
    public int nextKeyId() {
        double u = rnd.nextDouble();
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cdf[mid] < u) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    public WriteRequest next() {
        String pk = "key-" + nextKeyId();
        if (rnd.nextDouble() < deleteRatio) {
            return new WriteRequest.Delete(AttributeMap.builder().put(KEY_ATTRIBUTE, pk).build());
        }
        return new WriteRequest.Put(AttributeMap.builder()
                .put(KEY_ATTRIBUTE, pk)
                .put("seq", seq++)
                .put("payload", payload)
                .build());
    }
}
