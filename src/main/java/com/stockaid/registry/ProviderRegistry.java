package com.stockaid.registry;

import com.stockaid.cache.CacheLocation;
import com.stockaid.cache.FileCacheStore;
import com.stockaid.exception.ApiConfigurationException;
import com.stockaid.exception.ApiNotFoundException;
import com.stockaid.model.Endpoint;
import com.stockaid.model.EndpointDefinition;
import com.stockaid.throttle.Throttle;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registered providers by name, each with its own throttle and cache directory.
 */
@Slf4j
public class ProviderRegistry {

    private static final Pattern URL_PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    private final FileCacheStore cacheStore;
    private final CacheLocation rootLocation;
    private final Map<String, Provider> providers = new ConcurrentHashMap<>();

    /**
     * @param cacheRoot root cache directory, or null to disable caching for every provider
     */
    public ProviderRegistry(FileCacheStore cacheStore, Path cacheRoot) {
        this.cacheStore = cacheStore;
        this.rootLocation = cacheStore.root(cacheRoot);
        if (cacheRoot != null && !rootLocation.isEnabled()) {
            log.info("Cache directory {} is not writable, responses will not be cached", cacheRoot);
        }
    }

    public boolean canCache() {
        return rootLocation.isEnabled();
    }

    /**
     * Register a provider. Calls to it respect {@code throttle}, which may be null for no throttling.
     */
    public Provider registerProvider(String name, String baseUrl, Throttle throttle) {
        if (name == null || name.isBlank()) {
            throw new ApiConfigurationException("Provider name must not be empty");
        }
        CacheLocation location = cacheStore.subdirectory(rootLocation, name);
        Provider provider = new Provider(name, baseUrl, throttle, location);
        providers.put(name, provider);
        log.debug("Registered provider '{}' baseUrl={} throttle={} cache={}",
                name, provider.getBaseUrl(),
                throttle == null ? "none" : throttle.getClass().getSimpleName(), location);
        return provider;
    }

    /**
     * Register an API of a previously registered provider.
     *
     * @throws ApiConfigurationException if the provider is unknown or the definition is inconsistent
     */
    public Endpoint registerApi(String providerName, EndpointDefinition definition) {
        Provider provider = providerName == null ? null : providers.get(providerName);
        if (provider == null) {
            throw new ApiConfigurationException("Provider '" + providerName + "' not registered.");
        }
        validate(providerName, definition);

        Endpoint endpoint = Endpoint.builder()
                .provider(providerName)
                .name(definition.getName())
                .url(joinUrl(provider.getBaseUrl(), definition.getUrl()))
                .method(definition.getMethod() == null ? "GET" : definition.getMethod().toUpperCase(Locale.ROOT))
                .cacheField(definition.getCacheField())
                .decoder(definition.getDecoder())
                .urlParams(List.copyOf(definition.getUrlParams()))
                .data(definition.getData())
                .dataParams(List.copyOf(definition.getDataParams()))
                .keyMap(Map.copyOf(definition.getKeyMap()))
                .cacheSeconds(definition.getCacheSeconds())
                .cacheLocation(cacheStore.subdirectory(provider.getCacheLocation(), definition.getName()))
                .build();

        provider.getEndpoints().register(endpoint);
        log.debug("Registered API '{}.{}' url={} cacheSeconds={} cache={}",
                providerName, endpoint.getName(), endpoint.getUrl(), endpoint.getCacheSeconds(),
                endpoint.getCacheLocation());
        return endpoint;
    }

    /**
     * @throws ApiNotFoundException if no provider with that name is registered
     */
    public Provider getProvider(String name) {
        Provider provider = name == null ? null : providers.get(name);
        if (provider == null) {
            throw ApiNotFoundException.provider(name);
        }
        return provider;
    }

    public Endpoint getEndpoint(String provider, String api) {
        return getProvider(provider).getEndpoint(api);
    }

    public List<String> providerNames() {
        return providers.keySet().stream().sorted().toList();
    }

    private void validate(String providerName, EndpointDefinition definition) {
        String qualified = providerName + "." + definition.getName();
        if (definition.getName().isBlank()) {
            throw new ApiConfigurationException("API name must not be empty for provider '" + providerName + "'");
        }
        if (definition.getCacheSeconds() < 0) {
            throw new ApiConfigurationException("cacheSeconds must not be negative for API '" + qualified + "'");
        }

        Set<String> placeholders = placeholders(definition.getUrl());
        for (String param : definition.getUrlParams()) {
            if (!placeholders.contains(param)) {
                throw new ApiConfigurationException(
                        "URL param '" + param + "' does not appear in url '" + definition.getUrl()
                                + "' of API '" + qualified + "'");
            }
        }
        for (String placeholder : placeholders) {
            if (!definition.getUrlParams().contains(placeholder)) {
                log.warn("Placeholder '{{}}' in url of API '{}' is not a declared url param", placeholder, qualified);
            }
        }
    }

    static Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = URL_PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    static String joinUrl(String baseUrl, String url) {
        if (baseUrl == null || baseUrl.isEmpty()) {
            return url;
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = url.startsWith("/") ? url.substring(1) : url;
        return path.isEmpty() ? base : base + "/" + path;
    }
}
