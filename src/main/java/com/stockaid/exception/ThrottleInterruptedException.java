package com.stockaid.exception;

/**
 * The calling thread was interrupted while waiting for a throttle permit.
 * The interrupt flag is restored before this is thrown.
 */
public class ThrottleInterruptedException extends ApiCacheException {

    public ThrottleInterruptedException(InterruptedException cause) {
        super("Interrupted while waiting for throttle permit", cause);
    }
}
