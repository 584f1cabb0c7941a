package com.stockaid.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A fully shaped request, ready to send. May carry key chain secrets in its parameters or body,
 * so it must not be logged as a whole.
 */
@Value
@Builder
public class OutgoingRequest {

    String method;

    /**
     * Absolute url, path already encoded, without query string.
     */
    String url;

    @Singular
    Map<String, String> queryParams;

    /**
     * JSON body, or null to send none.
     */
    String body;

    @Override
    public String toString() {
        return method + " " + url;
    }
}
