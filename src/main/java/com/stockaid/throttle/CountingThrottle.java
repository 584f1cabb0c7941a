package com.stockaid.throttle;

import com.stockaid.exception.ThrottleInterruptedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Crude throttle: lets {@code maxPerMinute} calls through, then stalls for a full minute.
 *
 * Bursty by nature. Intended for low-frequency providers (a handful of calls per minute).
 * The stall holds the lock, so every caller of the provider waits it out.
 */
@Slf4j
public final class CountingThrottle implements Throttle {

    static final Duration STALL = Duration.ofSeconds(60);

    private final ThrottleClock clock;
    private final int maxPerMinute;
    private final ReentrantLock lock = new ReentrantLock();

    private int count;

    public CountingThrottle(int maxPerMinute) {
        this(SystemThrottleClock.instance(), maxPerMinute);
    }

    public CountingThrottle(ThrottleClock clock, int maxPerMinute) {
        if (maxPerMinute <= 0) throw new IllegalArgumentException("maxPerMinute <= 0");
        this.clock = clock;
        this.maxPerMinute = maxPerMinute;
    }

    @Override
    public void acquire() {
        lock.lock();
        try {
            count++;
            if (count > maxPerMinute) {
                count = 0;
                log.debug("Counting throttle exhausted ({} calls), stalling for {}", maxPerMinute, STALL);
                clock.sleep(STALL);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThrottleInterruptedException(e);
        } finally {
            lock.unlock();
        }
    }

    public int getMaxPerMinute() {
        return maxPerMinute;
    }

    int currentCount() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }
}
