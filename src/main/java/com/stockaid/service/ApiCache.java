package com.stockaid.service;

import com.stockaid.codec.ResponseDecoder;
import com.stockaid.model.ApiResult;
import com.stockaid.model.Endpoint;
import com.stockaid.model.EndpointDefinition;
import com.stockaid.registry.Provider;
import com.stockaid.registry.ProviderRegistry;
import com.stockaid.throttle.Throttle;

import java.util.List;
import java.util.Map;

/**
 * Caching, throttled API client. One instance is created at startup and handed to every
 * module that registers providers or makes calls.
 */
public class ApiCache {

    private final ProviderRegistry registry;
    private final RequestDispatcher dispatcher;

    public ApiCache(ProviderRegistry registry, RequestDispatcher dispatcher) {
        this.registry = registry;
        this.dispatcher = dispatcher;
    }

    /**
     * @return true if responses are written to disk
     */
    public boolean canCache() {
        return registry.canCache();
    }

    /**
     * Register a provider of an API.
     *
     * @param name     unique name for this provider
     * @param baseUrl  common part of the url of all its API calls, may be empty
     * @param throttle rate-limiting policy for calls to this provider, or null for none
     */
    public Provider registerProvider(String name, String baseUrl, Throttle throttle) {
        return registry.registerProvider(name, baseUrl, throttle);
    }

    public Endpoint registerApi(String provider, EndpointDefinition definition) {
        return registry.registerApi(provider, definition);
    }

    /**
     * Register an API call of a provider, all attributes spelled out.
     *
     * @param provider    name of a registered provider
     * @param name        unique name for this API within the provider
     * @param url         part of the url after the base url, with {@code {param}} placeholders
     * @param cacheField  argument identifying a request in the cache, or null for a single shared entry
     * @param decoder     converts the response text into a table
     * @param method      HTTP method, usually GET or POST
     * @param urlParams   arguments substituted into the url
     * @param data        JSON body template with {@code ${param}} placeholders, or null
     * @param dataParams  arguments sent as parameters, or substituted into {@code data}
     * @param keyMap      outgoing field name to key chain name
     * @param cacheSecs   seconds a response stays fresh, 0 for no caching
     */
    public Endpoint registerApi(String provider, String name, String url, String cacheField,
                                ResponseDecoder decoder, String method, List<String> urlParams,
                                String data, List<String> dataParams, Map<String, String> keyMap,
                                long cacheSecs) {
        EndpointDefinition.EndpointDefinitionBuilder builder = EndpointDefinition.builder()
                .name(name)
                .url(url)
                .cacheField(cacheField)
                .decoder(decoder)
                .data(data)
                .cacheSeconds(cacheSecs);
        if (method != null) {
            builder.method(method);
        }
        if (urlParams != null) {
            builder.urlParams(urlParams);
        }
        if (dataParams != null) {
            builder.dataParams(dataParams);
        }
        if (keyMap != null) {
            builder.keyMap(keyMap);
        }
        return registry.registerApi(provider, builder.build());
    }

    public ApiResult call(String provider, String api, Map<String, ?> args) {
        return call(provider, api, args, false);
    }

    /**
     * Call a registered API.
     *
     * @param refresh true to ignore any cached response
     * @return the table, or {@link ApiResult#noData()} if the response could not be decoded
     */
    public ApiResult call(String provider, String api, Map<String, ?> args, boolean refresh) {
        return dispatcher.call(provider, api, args, refresh);
    }

    public List<String> providerNames() {
        return registry.providerNames();
    }

    public List<String> apiNames(String provider) {
        return registry.getProvider(provider).getEndpoints().names();
    }

    public Endpoint getEndpoint(String provider, String api) {
        return registry.getEndpoint(provider, api);
    }
}
