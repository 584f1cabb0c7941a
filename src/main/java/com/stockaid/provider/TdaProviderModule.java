package com.stockaid.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockaid.config.ProviderModule;
import com.stockaid.model.EndpointDefinition;
import com.stockaid.service.ApiCache;
import com.stockaid.throttle.TokenBucketThrottle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * TD Ameritrade market data: quotes, price history and option chains.
 * Every call needs the {@code TDA} key in the key chain, sent as {@code apikey}.
 */
@Slf4j
@Component
public class TdaProviderModule implements ProviderModule {

    public static final String NAME = "TDA";
    static final String BASE_URL = "https://api.tdameritrade.com/v1/marketdata/";
    static final int CALLS_PER_MINUTE = 120;

    private final TdaResponseDecoders decoders;

    public TdaProviderModule(ObjectMapper objectMapper) {
        this.decoders = new TdaResponseDecoders(objectMapper);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void register(ApiCache cache) {
        cache.registerProvider(NAME, BASE_URL, new TokenBucketThrottle(CALLS_PER_MINUTE));

        cache.registerApi(NAME, EndpointDefinition.builder()
                .name("quote")
                .url("{symbol}/quotes")
                .cacheField("symbol")
                .decoder(decoders::quote)
                .urlParam("symbol")
                .key("apikey", NAME)
                .cacheSeconds(60)
                .build());

        cache.registerApi(NAME, EndpointDefinition.builder()
                .name("history")
                .url("{symbol}/pricehistory")
                .cacheField("symbol")
                .decoder(decoders::history)
                .urlParam("symbol")
                .dataParam("periodType")
                .dataParam("period")
                .dataParam("frequencyType")
                .key("apikey", NAME)
                .cacheSeconds(86400)
                .build());

        cache.registerApi(NAME, EndpointDefinition.builder()
                .name("chains")
                .url("chains")
                .cacheField("symbol")
                .decoder(decoders::chains)
                .dataParam("symbol")
                .dataParam("includeQuotes")
                .dataParam("range")
                .dataParam("fromDate")
                .dataParam("toDate")
                .dataParam("optionType")
                .key("apikey", NAME)
                .cacheSeconds(180)
                .build());

        log.debug("Registered {} APIs: {}", NAME, cache.apiNames(NAME));
    }
}
