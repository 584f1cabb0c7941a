package com.stockaid.model;

import com.stockaid.cache.CacheLocation;
import com.stockaid.codec.ResponseDecoder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A registered API call. Immutable once registered.
 */
@Value
@Builder
public class Endpoint {

    String provider;
    String name;

    /**
     * Full url template: provider base url joined with the API's url.
     */
    String url;

    String method;
    String cacheField;
    ResponseDecoder decoder;
    List<String> urlParams;
    String data;
    List<String> dataParams;
    Map<String, String> keyMap;
    long cacheSeconds;

    /**
     * Directory holding this API's cache files, or disabled.
     */
    CacheLocation cacheLocation;

    public boolean hasCacheField() {
        return cacheField != null && !cacheField.isEmpty();
    }
}
