package com.jay.marketpulse.layer3_ai;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy for calls to the text-generation service.
 * Attempts are counted from 1; {@code nextDelay(k)} is the pause before attempt {@code k + 2}.
 */
public class BackoffController {

    private final long baseMs;
    private final double growthFactor;
    private final long maxMs;
    private final int maxAttempts;
    private final double jitterRatio;
    private final DoubleSupplier random;
    private final Sleeper sleeper;

    public BackoffController(Duration base, double growthFactor, Duration maxDelay, int maxAttempts,
                             double jitterRatio) {
        this(base, growthFactor, maxDelay, maxAttempts, jitterRatio,
            () -> ThreadLocalRandom.current().nextDouble(), Sleeper.THREAD);
    }

    public BackoffController(Duration base, double growthFactor, Duration maxDelay, int maxAttempts,
                             double jitterRatio, DoubleSupplier random, Sleeper sleeper) {
        if (growthFactor < 1.0) throw new IllegalArgumentException("growthFactor must be >= 1");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.baseMs = base.toMillis();
        this.growthFactor = growthFactor;
        this.maxMs = maxDelay.toMillis();
        this.maxAttempts = maxAttempts;
        this.jitterRatio = Math.max(0, Math.min(1, jitterRatio));
        this.random = random;
        this.sleeper = sleeper;
    }

    /** {@code min(base * growth^attempt, max)}, jittered by up to ±jitterRatio and re-capped. */
    public Duration nextDelay(int attempt) {
        double delay = Math.min(baseMs * Math.pow(growthFactor, Math.max(0, attempt)), maxMs);
        if (jitterRatio > 0) {
            double offset = (random.getAsDouble() * 2 - 1) * jitterRatio;
            delay = Math.min(delay * (1 + offset), maxMs);
        }
        return Duration.ofMillis(Math.max(0, Math.round(delay)));
    }

    /** Honours a server retry hint when it asks for a longer pause than the schedule. */
    public Duration delayFor(int attempt, Duration retryAfter) {
        Duration scheduled = nextDelay(attempt);
        if (retryAfter == null || retryAfter.compareTo(scheduled) <= 0) return scheduled;
        return retryAfter.toMillis() > maxMs ? Duration.ofMillis(maxMs) : retryAfter;
    }

    public boolean shouldRetry(int attempt, ErrorKind kind) {
        return kind != null && kind.isRetryable() && attempt < maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public void pause(Duration delay) throws InterruptedException {
        sleeper.sleep(delay);
    }
}
