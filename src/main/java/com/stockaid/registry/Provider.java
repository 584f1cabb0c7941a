package com.stockaid.registry;

import com.stockaid.cache.CacheLocation;
import com.stockaid.model.Endpoint;
import com.stockaid.throttle.Throttle;
import lombok.Getter;

import java.util.Optional;

/**
 * A registered data provider: base url, throttling policy, cache directory and its APIs.
 * Everything but the API registry is fixed at registration.
 */
@Getter
public class Provider {

    private final String name;
    private final String baseUrl;
    private final Throttle throttle;
    private final CacheLocation cacheLocation;
    private final EndpointRegistry endpoints;

    public Provider(String name, String baseUrl, Throttle throttle, CacheLocation cacheLocation) {
        this.name = name;
        this.baseUrl = baseUrl == null ? "" : baseUrl;
        this.throttle = throttle;
        this.cacheLocation = cacheLocation;
        this.endpoints = new EndpointRegistry(name);
    }

    public Optional<Throttle> throttle() {
        return Optional.ofNullable(throttle);
    }

    /**
     * Wait for this provider's throttle, if it has one.
     */
    public void acquirePermit() {
        if (throttle != null) {
            throttle.acquire();
        }
    }

    public Endpoint getEndpoint(String api) {
        return endpoints.get(api);
    }
}
