package com.stockaid.service;

import com.stockaid.cache.FileCacheStore;
import com.stockaid.model.ApiResult;
import com.stockaid.model.Endpoint;
import com.stockaid.model.Table;
import com.stockaid.registry.Provider;
import com.stockaid.registry.ProviderRegistry;
import com.stockaid.transport.HttpTransport;
import com.stockaid.transport.OutgoingRequest;
import com.stockaid.transport.TransportResponse;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one API call: cache lookup, throttle, request, decode, write-through.
 *
 * Flow:
 * 1. Resolve provider and API
 * 2. Serve a fresh cache entry unless a refresh is forced
 * 3. Wait for the provider's throttle
 * 4. Send exactly one request
 * 5. Decode; cache and return the table, or return no data without caching
 */
@Slf4j
public class RequestDispatcher {

    private final ProviderRegistry registry;
    private final FileCacheStore cacheStore;
    private final RequestFactory requestFactory;
    private final HttpTransport transport;

    public RequestDispatcher(
            ProviderRegistry registry,
            FileCacheStore cacheStore,
            RequestFactory requestFactory,
            HttpTransport transport) {
        this.registry = registry;
        this.cacheStore = cacheStore;
        this.requestFactory = requestFactory;
        this.transport = transport;
    }

    public ApiResult call(String providerName, String api, Map<String, ?> args, boolean refresh) {
        Provider provider = registry.getProvider(providerName);
        Endpoint endpoint = provider.getEndpoint(api);
        Map<String, ?> arguments = args == null ? Map.of() : args;

        Optional<Path> cacheFile = cacheFile(endpoint, arguments);

        if (!refresh && cacheFile.isPresent()) {
            Optional<Table> cached = cacheStore.readIfFresh(cacheFile.get(), endpoint.getCacheSeconds());
            if (cached.isPresent()) {
                log.debug("Cache HIT {}.{} -> {}", providerName, api, cacheFile.get().getFileName());
                return ApiResult.cached(cached.get());
            }
        }

        provider.acquirePermit();

        OutgoingRequest request = requestFactory.create(endpoint, arguments);
        log.info("Fetching {}.{}: {}", providerName, api, request);
        TransportResponse response = transport.execute(request);
        if (!response.isSuccessful()) {
            log.warn("{}.{} answered HTTP {}", providerName, api, response.getStatusCode());
        }

        Optional<Table> table = decode(endpoint, response.getBody());
        if (table.isEmpty()) {
            log.info("No data from {}.{}", providerName, api);
            return ApiResult.noData();
        }

        cacheFile.ifPresent(path -> cacheStore.write(path, table.get()));
        return ApiResult.fetched(table.get());
    }

    private Optional<Path> cacheFile(Endpoint endpoint, Map<String, ?> args) {
        Object fieldValue = null;
        if (endpoint.hasCacheField()) {
            fieldValue = RequestFactory.require(endpoint, args, endpoint.getCacheField());
        }
        return cacheStore.keyPath(endpoint, fieldValue);
    }

    private Optional<Table> decode(Endpoint endpoint, String body) {
        try {
            return endpoint.getDecoder().decode(body);
        } catch (RuntimeException e) {
            log.warn("Decoder for {}.{} failed, treating response as no data",
                    endpoint.getProvider(), endpoint.getName(), e);
            return Optional.empty();
        }
    }
}
