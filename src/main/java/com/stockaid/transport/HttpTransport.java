package com.stockaid.transport;

/**
 * Sends a single request and waits for the response. Implementations never retry.
 */
public interface HttpTransport {

    /**
     * @return the response, whatever its status code
     * @throws com.stockaid.exception.TransportException if no response was received
     */
    TransportResponse execute(OutgoingRequest request);
}
