package com.stockaid.registry;

import com.stockaid.exception.ApiNotFoundException;
import com.stockaid.model.Endpoint;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * APIs of one provider, by name. Append-only; registering a name again replaces the old entry.
 */
public class EndpointRegistry {

    private final String provider;
    private final Map<String, Endpoint> endpoints = new ConcurrentHashMap<>();

    EndpointRegistry(String provider) {
        this.provider = provider;
    }

    void register(Endpoint endpoint) {
        endpoints.put(endpoint.getName(), endpoint);
    }

    /**
     * @throws ApiNotFoundException if no API with that name is registered
     */
    public Endpoint get(String name) {
        Endpoint endpoint = name == null ? null : endpoints.get(name);
        if (endpoint == null) {
            throw ApiNotFoundException.api(provider, name);
        }
        return endpoint;
    }

    public boolean contains(String name) {
        return endpoints.containsKey(name);
    }

    public List<String> names() {
        return endpoints.keySet().stream().sorted().toList();
    }

    public Collection<Endpoint> all() {
        return List.copyOf(endpoints.values());
    }
}
