package com.stockaid.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stockaid.cache.FileCacheStore;
import com.stockaid.codec.TableCsvCodec;
import com.stockaid.model.ApiResult;
import com.stockaid.model.Endpoint;
import com.stockaid.model.KeyChain;
import com.stockaid.model.Table;
import com.stockaid.registry.ProviderRegistry;
import com.stockaid.service.ApiCache;
import com.stockaid.service.RequestDispatcher;
import com.stockaid.service.RequestFactory;
import com.stockaid.support.RecordingTransport;
import com.stockaid.throttle.TokenBucketThrottle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TdaProviderModuleTest {

    @TempDir
    Path tempDir;

    private ProviderRegistry registry;
    private RecordingTransport transport;
    private ApiCache cache;
    private TdaResponseDecoders decoders;

    @BeforeEach
    void setUp() {
        FileCacheStore store = new FileCacheStore(new TableCsvCodec(), Clock.systemUTC());
        registry = new ProviderRegistry(store, tempDir);
        transport = RecordingTransport.answering("{\"ABC\":{\"symbol\":\"ABC\",\"lastPrice\":12.5}}");
        cache = new ApiCache(registry, new RequestDispatcher(registry, store,
                new RequestFactory(KeyChain.of(Map.of("TDA", "tda-key"))), transport));
        ObjectMapper objectMapper = new ObjectMapper();
        new TdaProviderModule(objectMapper).register(cache);
        decoders = new TdaResponseDecoders(objectMapper);
    }

    @Test
    void testRegistersQuoteHistoryAndChains() {
        assertEquals(List.of("chains", "history", "quote"), cache.apiNames("TDA"));
        TokenBucketThrottle throttle = (TokenBucketThrottle) registry.getProvider("TDA").getThrottle();
        assertEquals(120, throttle.getCapacity());

        Endpoint quote = cache.getEndpoint("TDA", "quote");
        assertEquals("https://api.tdameritrade.com/v1/marketdata/{symbol}/quotes", quote.getUrl());
        assertEquals(60, quote.getCacheSeconds());
        assertEquals(Map.of("apikey", "TDA"), quote.getKeyMap());

        Endpoint history = cache.getEndpoint("TDA", "history");
        assertEquals(86400, history.getCacheSeconds());
        assertEquals(List.of("periodType", "period", "frequencyType"), history.getDataParams());

        Endpoint chains = cache.getEndpoint("TDA", "chains");
        assertEquals("https://api.tdameritrade.com/v1/marketdata/chains", chains.getUrl());
        assertEquals(180, chains.getCacheSeconds());
        assertEquals("symbol", chains.getCacheField());
        assertEquals(List.of("symbol", "includeQuotes", "range", "fromDate", "toDate", "optionType"),
                chains.getDataParams());
    }

    @Test
    void testQuoteCallSendsKeyAndCaches() {
        ApiResult first = cache.call("TDA", "quote", Map.of("symbol", "ABC"));
        ApiResult second = cache.call("TDA", "quote", Map.of("symbol", "ABC"));

        assertEquals("https://api.tdameritrade.com/v1/marketdata/ABC/quotes", transport.lastRequest().getUrl());
        assertEquals(Map.of("apikey", "tda-key"), transport.lastRequest().getQueryParams());
        assertEquals(Table.builder("symbol", "lastPrice").row("ABC", "12.5").build(), first.getTable());
        assertTrue(second.isCacheHit());
        assertEquals(1, transport.requestCount());
    }

    @Test
    void testQuoteHasOneRowPerSymbol() {
        Table table = decoders.quote("{\"A\":{\"symbol\":\"A\",\"mark\":1},\"B\":{\"symbol\":\"B\",\"mark\":2}}")
                .orElseThrow();

        assertEquals(List.of("symbol", "mark"), table.getColumns());
        assertEquals(List.of("A", "B"), table.column("symbol"));
    }

    @Test
    void testHistoryIsSortedByDatetime() {
        String body = "{\"symbol\":\"ABC\",\"empty\":false,\"candles\":["
                + "{\"datetime\":300,\"close\":3},"
                + "{\"datetime\":100,\"close\":1},"
                + "{\"datetime\":200,\"close\":2}]}";

        Table table = decoders.history(body).orElseThrow();

        assertEquals(List.of("100", "200", "300"), table.column("datetime"));
        assertEquals(List.of("1", "2", "3"), table.column("close"));
    }

    @Test
    void testEmptyHistoryIsNoData() {
        assertEquals(Optional.empty(), decoders.history("{\"symbol\":\"ABC\",\"empty\":true,\"candles\":[]}"));
        assertEquals(Optional.empty(), decoders.history("not json"));
    }

    @Test
    void testChainsAreFlattenedPerContract() {
        String body = "{\"underlying\":{\"symbol\":\"ABC\",\"last\":101.5},"
                + "\"callExpDateMap\":{\"2024-06-21:30\":{\"100.0\":[{\"putCall\":\"CALL\",\"bid\":2.1}],"
                + "\"105.0\":[{\"putCall\":\"CALL\",\"bid\":0.4}]}},"
                + "\"putExpDateMap\":{\"2024-06-21:30\":{\"100.0\":[{\"putCall\":\"PUT\",\"bid\":1.2}]}}}";

        Table table = decoders.chains(body).orElseThrow();

        assertEquals(List.of("putCall", "bid", "expDate", "strike", "underlying", "underlyingLast"),
                table.getColumns());
        assertEquals(3, table.rowCount());
        assertEquals(List.of("CALL", "CALL", "PUT"), table.column("putCall"));
        assertEquals(List.of("100.0", "105.0", "100.0"), table.column("strike"));
        assertEquals("ABC", table.get(2, "underlying"));
        assertEquals("101.5", table.get(0, "underlyingLast"));
    }

    @Test
    void testChainsWithoutUnderlyingIsNoData() {
        assertEquals(Optional.empty(), decoders.chains("{\"status\":\"FAILED\"}"));
    }
}
