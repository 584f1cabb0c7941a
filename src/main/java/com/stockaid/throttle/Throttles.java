package com.stockaid.throttle;

/**
 * Factory for throttles described by a {@link ThrottleType} and a rate.
 */
public final class Throttles {

    private Throttles() {
    }

    /**
     * @return the throttle, or {@code null} for {@link ThrottleType#NONE}
     */
    public static Throttle create(ThrottleType type, int callsPerMinute) {
        return create(type, callsPerMinute, SystemThrottleClock.instance());
    }

    public static Throttle create(ThrottleType type, int callsPerMinute, ThrottleClock clock) {
        if (type == null) {
            return null;
        }
        return switch (type) {
            case NONE -> null;
            case COUNTING -> new CountingThrottle(clock, callsPerMinute);
            case TOKEN_BUCKET -> new TokenBucketThrottle(clock, callsPerMinute);
        };
    }
}
