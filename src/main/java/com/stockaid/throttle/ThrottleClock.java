package com.stockaid.throttle;

import java.time.Duration;

/**
 * Time source and sleeper used by throttles.
 */
public interface ThrottleClock {

    long nowNanos();

    void sleep(Duration duration) throws InterruptedException;
}
