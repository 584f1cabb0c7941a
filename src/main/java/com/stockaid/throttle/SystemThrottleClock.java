package com.stockaid.throttle;

import java.time.Duration;

/**
 * Monotonic system clock backed by {@link System#nanoTime()} and {@link Thread#sleep(long)}.
 */
public final class SystemThrottleClock implements ThrottleClock {

    private static final SystemThrottleClock INSTANCE = new SystemThrottleClock();

    private SystemThrottleClock() {
    }

    public static SystemThrottleClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        Thread.sleep(duration.toMillis());
    }
}
