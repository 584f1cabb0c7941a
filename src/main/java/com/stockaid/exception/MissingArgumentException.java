package com.stockaid.exception;

import lombok.Getter;

/**
 * A url, data or cache-field parameter declared by an API was not supplied by the caller.
 */
@Getter
public class MissingArgumentException extends ApiCacheException {

    private final String argument;

    public MissingArgumentException(String api, String argument) {
        super("Required argument '" + argument + "' is missing for API '" + api + "'");
        this.argument = argument;
    }
}
