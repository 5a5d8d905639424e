package com.jay.marketpulse.layer3_ai;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide gate in front of the text-generation service.
 *
 * <p>A call may start only when at least {@code minInterval} has passed since the previous
 * call started and fewer than {@code maxConcurrent} calls are in flight. Waiters are served
 * in arrival order. A daily budget (0 = unlimited) refuses further calls until the date in
 * {@code zone} changes.
 */
@Slf4j
public class RequestThrottler {

    private final long minIntervalNanos;
    private final int maxConcurrent;
    private final int dailyLimit;
    private final Clock clock;
    private final ZoneId zone;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition changed = lock.newCondition();
    private final Deque<Object> waiters = new ArrayDeque<>();

    // guarded by lock
    private boolean issuedAny;
    private long lastIssuedAtNanos;
    private int inFlight;
    private int issuedToday;
    private LocalDate day;

    public RequestThrottler(Duration minInterval, int maxConcurrent, int dailyLimit, Clock clock, ZoneId zone) {
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be >= 1");
        this.minIntervalNanos = minInterval.toNanos();
        this.maxConcurrent = maxConcurrent;
        this.dailyLimit = Math.max(0, dailyLimit);
        this.clock = clock;
        this.zone = zone;
        this.day = LocalDate.now(clock.withZone(zone));
    }

    /**
     * Blocks until a call may start, then records it as issued.
     *
     * @throws DailyBudgetExhaustedException when today's budget is used up
     * @throws InterruptedException          if interrupted while waiting
     */
    public ThrottlePermit acquire() throws InterruptedException {
        Object ticket = new Object();
        lock.lock();
        try {
            checkBudget();
            waiters.addLast(ticket);
            try {
                while (true) {
                    if (waiters.peekFirst() == ticket && inFlight < maxConcurrent) {
                        checkBudget();
                        long now = System.nanoTime();
                        long waitNanos = issuedAny ? (lastIssuedAtNanos + minIntervalNanos) - now : 0;
                        if (waitNanos <= 0) {
                            issuedAny = true;
                            lastIssuedAtNanos = now;
                            inFlight++;
                            issuedToday++;
                            return new ThrottlePermit(now, this::release);
                        }
                        changed.awaitNanos(waitNanos);
                    } else {
                        changed.await();
                    }
                }
            } finally {
                waiters.remove(ticket);
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public ThrottleSnapshot snapshot() {
        lock.lock();
        try {
            rollDay();
            int remaining = dailyLimit == 0 ? Integer.MAX_VALUE : Math.max(0, dailyLimit - issuedToday);
            return new ThrottleSnapshot(day, issuedToday, dailyLimit, remaining, inFlight, maxConcurrent,
                waiters.size(), TimeUnit.NANOSECONDS.toMillis(minIntervalNanos));
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        lock.lock();
        try {
            inFlight--;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void checkBudget() {
        rollDay();
        if (dailyLimit > 0 && issuedToday >= dailyLimit) {
            log.warn("RequestThrottler: daily budget of {} used up for {}", dailyLimit, day);
            throw new DailyBudgetExhaustedException(dailyLimit, day);
        }
    }

    private void rollDay() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (!today.equals(day)) {
            log.info("RequestThrottler: new day {} (issued {} on {})", today, issuedToday, day);
            day = today;
            issuedToday = 0;
        }
    }
}
