package com.stockaid.model;

import com.stockaid.codec.ResponseDecoder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to register one API call of a provider.
 */
@Value
@Builder(toBuilder = true)
public class EndpointDefinition {

    /**
     * Unique name of the API within its provider.
     */
    @NonNull
    String name;

    /**
     * Part of the url after the provider's base url, with {@code {param}} placeholders.
     */
    @NonNull
    String url;

    /**
     * Argument whose value identifies a request in the cache. Null means every call shares one slot.
     */
    String cacheField;

    @NonNull
    ResponseDecoder decoder;

    @Builder.Default
    String method = "GET";

    /**
     * Arguments substituted into the url template.
     */
    @Singular
    List<String> urlParams;

    /**
     * Template for a JSON body. When set, data params are substituted into it instead of
     * being sent as request parameters.
     */
    String data;

    /**
     * Arguments sent as request parameters, or substituted into {@link #data}.
     */
    @Singular
    List<String> dataParams;

    /**
     * Outgoing field name to key chain name. Resolved at call time, never taken from arguments.
     */
    @Singular("key")
    Map<String, String> keyMap;

    /**
     * Seconds a cached response stays fresh. 0 disables caching.
     */
    @Builder.Default
    long cacheSeconds = 0;
}
