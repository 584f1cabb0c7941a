package com.stockaid.provider;

import com.stockaid.codec.WikiTableDecoder;
import com.stockaid.config.ProviderModule;
import com.stockaid.model.EndpointDefinition;
import com.stockaid.service.ApiCache;
import com.stockaid.throttle.CountingThrottle;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stock index constituents scraped from the Wikipedia list pages.
 * Cached for a week; at most 10 requests a minute.
 */
@Component
public class IndexProviderModule implements ProviderModule {

    public static final String NAME = "index";
    static final String BASE_URL = "https://en.wikipedia.org/";
    static final int CALLS_PER_MINUTE = 10;
    static final long CACHE_SECONDS = 604800;

    static final Map<String, String> INDEXES = new LinkedHashMap<>();

    static {
        INDEXES.put("sp500", "w/index.php?title=List_of_S%26P_500_companies&action=edit&section=1");
        INDEXES.put("OEX", "w/index.php?title=S%26P_100&action=edit&section=3");
        INDEXES.put("midcap", "w/index.php?title=List_of_S%26P_400_companies&action=edit&section=1");
        INDEXES.put("smallcap", "w/index.php?title=List_of_S%26P_600_companies&action=edit&section=1");
        INDEXES.put("nasdaq100", "w/index.php?title=Nasdaq-100&action=edit&section=13");
        INDEXES.put("DJIA", "w/index.php?title=Dow_Jones_Industrial_Average&action=edit&section=1");
    }

    private final WikiTableDecoder decoder = new WikiTableDecoder();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void register(ApiCache cache) {
        cache.registerProvider(NAME, BASE_URL, new CountingThrottle(CALLS_PER_MINUTE));
        INDEXES.forEach((api, url) -> cache.registerApi(NAME, EndpointDefinition.builder()
                .name(api)
                .url(url)
                .decoder(decoder)
                .cacheSeconds(CACHE_SECONDS)
                .build()));
    }
}
