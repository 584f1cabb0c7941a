package com.stockaid.codec;

import com.stockaid.model.Table;

import java.util.Optional;

/**
 * Converts a provider's raw response body into a {@link Table}.
 * Supplied when an API is registered.
 */
@FunctionalInterface
public interface ResponseDecoder {

    /**
     * Decode a response body.
     *
     * @param body raw response text
     * @return the table, or empty when the payload is empty or malformed. Never throws for bad input.
     */
    Optional<Table> decode(String body);
}
