package com.stockaid.transport;

import lombok.Value;

/**
 * Status and body text of a provider response.
 */
@Value
public class TransportResponse {

    int statusCode;
    String body;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
