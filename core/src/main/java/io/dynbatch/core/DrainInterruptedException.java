package io.dynbatch.core;

/**
 * Thread was interrupted while backing off between drain iterations.
 * The interrupt flag is restored before this is thrown.
 */
public final class DrainInterruptedException extends RuntimeException {

    private final int remaining;

    public DrainInterruptedException(int remaining, InterruptedException cause) {
        super("interrupted while draining, " + remaining + " requests left buffered", cause);
        this.remaining = remaining;
    }

    public int remaining() {
        return remaining;
    }
}
