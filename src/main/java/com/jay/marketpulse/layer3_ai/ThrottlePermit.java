package com.jay.marketpulse.layer3_ai;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Release handle returned by {@link RequestThrottler#acquire()}.
 * Releasing more than once has no further effect.
 */
public final class ThrottlePermit implements AutoCloseable {

    private final long issuedAtNanos;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ThrottlePermit(long issuedAtNanos, Runnable onRelease) {
        this.issuedAtNanos = issuedAtNanos;
        this.onRelease = onRelease;
    }

    /** {@link System#nanoTime()} at which the call was allowed to start. */
    public long issuedAtNanos() {
        return issuedAtNanos;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }

    @Override
    public void close() {
        release();
    }
}
