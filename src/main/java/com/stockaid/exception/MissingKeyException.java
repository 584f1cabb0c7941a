package com.stockaid.exception;

import lombok.Getter;

/**
 * The key chain has no value for a key referenced by an API's key map.
 */
@Getter
public class MissingKeyException extends ApiCacheException {

    private final String keyName;

    public MissingKeyException(String keyName) {
        super("Required key '" + keyName + "' is missing");
        this.keyName = keyName;
    }
}
