package com.stockaid.throttle;

/**
 * Throttling policies selectable from configuration.
 */
public enum ThrottleType {

    /**
     * No rate limiting.
     */
    NONE,

    /**
     * {@link CountingThrottle}: burst, then a one minute stall.
     */
    COUNTING,

    /**
     * {@link TokenBucketThrottle}: smooth pacing, best at 60 calls per minute or more.
     */
    TOKEN_BUCKET
}
