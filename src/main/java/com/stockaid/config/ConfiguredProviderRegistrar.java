package com.stockaid.config;

import com.stockaid.model.EndpointDefinition;
import com.stockaid.service.ApiCache;
import com.stockaid.throttle.Throttle;
import com.stockaid.throttle.Throttles;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Registers the providers declared under {@code stockaid.providers}, then every {@link ProviderModule}.
 */
@Slf4j
public class ConfiguredProviderRegistrar {

    private final StockaidProperties properties;
    private final DecoderFactory decoderFactory;
    private final List<ProviderModule> modules;

    public ConfiguredProviderRegistrar(
            StockaidProperties properties,
            DecoderFactory decoderFactory,
            List<ProviderModule> modules) {
        this.properties = properties;
        this.decoderFactory = decoderFactory;
        this.modules = modules;
    }

    public void registerAll(ApiCache cache) {
        for (Map.Entry<String, StockaidProperties.ProviderConfig> entry : properties.getProviders().entrySet()) {
            StockaidProperties.ProviderConfig config = entry.getValue();
            if (!config.isEnabled()) {
                log.info("Provider '{}' is disabled, skipping", entry.getKey());
                continue;
            }
            register(cache, entry.getKey(), config);
        }

        for (ProviderModule module : modules) {
            log.debug("Applying provider module '{}'", module.getName());
            module.register(cache);
        }

        log.info("Registered {} providers: {}", cache.providerNames().size(), cache.providerNames());
    }

    private void register(ApiCache cache, String name, StockaidProperties.ProviderConfig config) {
        Throttle throttle = Throttles.create(
                config.getThrottle().getType(), config.getThrottle().getCallsPerMinute());
        cache.registerProvider(name, config.getBaseUrl(), throttle);

        for (Map.Entry<String, StockaidProperties.ApiConfig> api : config.getApis().entrySet()) {
            StockaidProperties.ApiConfig apiConfig = api.getValue();
            cache.registerApi(name, EndpointDefinition.builder()
                    .name(api.getKey())
                    .url(apiConfig.getUrl())
                    .cacheField(apiConfig.getCacheField())
                    .decoder(decoderFactory.create(apiConfig))
                    .method(apiConfig.getMethod())
                    .urlParams(apiConfig.getUrlParams())
                    .data(apiConfig.getData())
                    .dataParams(apiConfig.getDataParams())
                    .keyMap(apiConfig.getKeyMap())
                    .cacheSeconds(apiConfig.getCacheSeconds())
                    .build());
        }
    }
}
