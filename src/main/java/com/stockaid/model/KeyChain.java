package com.stockaid.model;

import com.stockaid.exception.MissingKeyException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only secrets (typically API keys) supplied once at startup and substituted into
 * outgoing requests by name. Values never appear in cache paths or logs.
 */
public final class KeyChain {

    private static final KeyChain EMPTY = new KeyChain(Map.of());

    private final Map<String, String> keys;

    private KeyChain(Map<String, String> keys) {
        this.keys = keys;
    }

    /**
     * Null values are kept so that a declared-but-unset key is reported as missing at call time.
     */
    public static KeyChain of(Map<String, String> keys) {
        if (keys == null || keys.isEmpty()) {
            return EMPTY;
        }
        return new KeyChain(Collections.unmodifiableMap(new HashMap<>(keys)));
    }

    public static KeyChain empty() {
        return EMPTY;
    }

    /**
     * @throws MissingKeyException if the key is absent or null
     */
    public String resolve(String name) {
        String value = keys.get(name);
        if (value == null) {
            throw new MissingKeyException(name);
        }
        return value;
    }

    public boolean contains(String name) {
        return keys.get(name) != null;
    }

    public Set<String> names() {
        return keys.keySet();
    }

    @Override
    public String toString() {
        return "KeyChain" + keys.keySet();
    }
}
