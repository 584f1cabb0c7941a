package com.stockaid.exception;

/**
 * Root of all errors raised by the API cache.
 * File-system problems are never reported through this hierarchy; caching degrades instead.
 */
public class ApiCacheException extends RuntimeException {

    public ApiCacheException(String message) {
        super(message);
    }

    public ApiCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
