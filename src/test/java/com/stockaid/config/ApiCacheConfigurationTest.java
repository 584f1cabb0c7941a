package com.stockaid.config;

import com.stockaid.exception.MissingKeyException;
import com.stockaid.model.KeyChain;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ApiCacheConfigurationTest {

    @Test
    void testBlankKeyChainEntriesAreLeftOut() {
        StockaidProperties properties = new StockaidProperties();
        Map<String, String> keys = new HashMap<>();
        keys.put("TDA", "");
        keys.put("SPACES", "  ");
        keys.put("UNSET", null);
        keys.put("IEX", "pk_123");
        properties.setKeyChain(keys);

        KeyChain chain = new ApiCacheConfiguration(properties).keyChain();

        assertEquals(Set.of("IEX"), chain.names());
        assertEquals("pk_123", chain.resolve("IEX"));
        assertThrows(MissingKeyException.class, () -> chain.resolve("TDA"));
    }
}
