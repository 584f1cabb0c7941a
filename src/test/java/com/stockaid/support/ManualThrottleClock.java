package com.stockaid.support;

import com.stockaid.throttle.ThrottleClock;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic throttle clock: sleeping advances time instead of blocking.
 */
public final class ManualThrottleClock implements ThrottleClock {

    private final AtomicLong now;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public ManualThrottleClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        now.addAndGet(duration.toNanos());
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta.toNanos());
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }

    public Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
