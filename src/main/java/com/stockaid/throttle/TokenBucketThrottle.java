package com.stockaid.throttle;

import com.stockaid.exception.ThrottleInterruptedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazy token bucket:
 * - capacity: max tokens, equal to the allowed calls per minute
 * - refill: capacity / 60 tokens per second, added only when {@link #acquire()} runs
 *
 * Every acquire withdraws exactly one token. When the bucket is empty the caller sleeps one
 * second and tries again, so rates under 60 calls per minute are paced poorly.
 *
 * Thread-safety: refill and withdrawal happen under the instance lock; sleeping does not.
 */
@Slf4j
public final class TokenBucketThrottle implements Throttle {

    static final Duration RETRY_INTERVAL = Duration.ofSeconds(1);

    private final ThrottleClock clock;
    private final int capacity;
    private final double refillPerNanos;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastNanos;

    public TokenBucketThrottle(int capacity) {
        this(SystemThrottleClock.instance(), capacity);
    }

    public TokenBucketThrottle(ThrottleClock clock, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillPerNanos = capacity / 60d / 1_000_000_000d;
        this.tokens = capacity;
        this.lastNanos = clock.nowNanos();
    }

    @Override
    public void acquire() {
        while (true) {
            lock.lock();
            try {
                refill();
                if (tokens >= 1) {
                    tokens -= 1;
                    return;
                }
            } finally {
                lock.unlock();
            }

            log.debug("Token bucket empty, sleeping {}", RETRY_INTERVAL);
            try {
                clock.sleep(RETRY_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ThrottleInterruptedException(e);
            }
        }
    }

    public int getCapacity() {
        return capacity;
    }

    double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        tokens = Math.min(capacity, tokens + elapsed * refillPerNanos);
        lastNanos = now;
    }
}
