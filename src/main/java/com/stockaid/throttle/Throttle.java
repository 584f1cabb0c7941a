package com.stockaid.throttle;

/**
 * Rate-limiting policy applied to every network call made to one provider.
 * Implementations are shared by all callers of that provider and must be thread-safe.
 */
public interface Throttle {

    /**
     * Block the calling thread until a request may proceed, then consume the permit.
     *
     * @throws com.stockaid.exception.ThrottleInterruptedException if interrupted while waiting
     */
    void acquire();
}
