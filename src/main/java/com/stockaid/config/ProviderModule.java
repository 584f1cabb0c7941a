package com.stockaid.config;

import com.stockaid.service.ApiCache;

/**
 * Code-defined provider: registers itself and its APIs with the cache at startup.
 * Every bean of this type is applied once, after the providers declared in configuration.
 */
public interface ProviderModule {

    /**
     * Get provider name (e.g., "TDA", "index").
     */
    String getName();

    void register(ApiCache cache);
}
