package com.stockaid.exception;

/**
 * A provider or API was referenced or registered incorrectly.
 * This is a caller bug, raised synchronously.
 */
public class ApiConfigurationException extends ApiCacheException {

    public ApiConfigurationException(String message) {
        super(message);
    }
}
