package com.stockaid.exception;

/**
 * The single request attempt for a call failed at the network layer.
 * Never cached and never retried.
 */
public class TransportException extends ApiCacheException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
