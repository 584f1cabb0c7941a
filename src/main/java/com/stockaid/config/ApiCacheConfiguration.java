package com.stockaid.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.stockaid.cache.FileCacheStore;
import com.stockaid.codec.TableCsvCodec;
import com.stockaid.model.KeyChain;
import com.stockaid.registry.ProviderRegistry;
import com.stockaid.service.ApiCache;
import com.stockaid.service.RequestDispatcher;
import com.stockaid.service.RequestFactory;
import com.stockaid.transport.HttpTransport;
import com.stockaid.transport.WebClientHttpTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Wires the API cache: file store, registry, transport and dispatcher.
 */
@Slf4j
@Configuration
public class ApiCacheConfiguration {

    private final StockaidProperties properties;

    public ApiCacheConfiguration(StockaidProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Blank entries come from unset environment variables such as {@code ${TDA_API_KEY:}} and are left out,
     * so calls needing them fail with a missing key.
     */
    @Bean
    public KeyChain keyChain() {
        Map<String, String> keys = new HashMap<>();
        properties.getKeyChain().forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                keys.put(name, value);
            } else {
                log.debug("Key chain entry '{}' has no value", name);
            }
        });
        return KeyChain.of(keys);
    }

    @Bean
    public TableCsvCodec tableCsvCodec(CsvMapper csvMapper) {
        return new TableCsvCodec(csvMapper);
    }

    @Bean
    public DecoderFactory decoderFactory(ObjectMapper objectMapper, TableCsvCodec tableCsvCodec) {
        return new DecoderFactory(objectMapper, tableCsvCodec);
    }

    @Bean
    public FileCacheStore fileCacheStore(TableCsvCodec tableCsvCodec, Clock clock) {
        return new FileCacheStore(tableCsvCodec, clock, directoryPermissions());
    }

    @Bean
    public ProviderRegistry providerRegistry(FileCacheStore fileCacheStore) {
        StockaidProperties.CacheConfig cache = properties.getCache();
        Path root = null;
        if (cache.isEnabled() && cache.getPath() != null && !cache.getPath().isBlank()) {
            root = Path.of(cache.getPath());
        }
        ProviderRegistry registry = new ProviderRegistry(fileCacheStore, root);
        log.info("Initialized response cache: root={}, writable={}", root, registry.canCache());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpTransport httpTransport(WebClient webClient) {
        return new WebClientHttpTransport(webClient, properties.getHttp().getTimeout());
    }

    @Bean
    public RequestDispatcher requestDispatcher(
            ProviderRegistry providerRegistry,
            FileCacheStore fileCacheStore,
            KeyChain keyChain,
            HttpTransport httpTransport) {
        return new RequestDispatcher(providerRegistry, fileCacheStore, new RequestFactory(keyChain), httpTransport);
    }

    @Bean
    public ApiCache apiCache(
            ProviderRegistry providerRegistry,
            RequestDispatcher requestDispatcher,
            DecoderFactory decoderFactory,
            ObjectProvider<ProviderModule> modules) {
        ApiCache cache = new ApiCache(providerRegistry, requestDispatcher);
        new ConfiguredProviderRegistrar(properties, decoderFactory, modules.orderedStream().toList())
                .registerAll(cache);
        return cache;
    }

    private Set<PosixFilePermission> directoryPermissions() {
        String mode = properties.getCache().getDirectoryMode();
        if (mode == null || mode.isBlank()) {
            return null;
        }
        try {
            return PosixFilePermissions.fromString(mode.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid cache directory mode '{}'", mode);
            return null;
        }
    }
}
