package com.stockaid.config;

import com.stockaid.throttle.ThrottleType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for stockaid.
 */
@Data
@Component
@ConfigurationProperties(prefix = "stockaid")
public class StockaidProperties {

    private CacheConfig cache = new CacheConfig();
    private HttpConfig http = new HttpConfig();

    /**
     * Logical key name to secret, e.g. API keys. Usually fed from the environment.
     */
    private Map<String, String> keyChain = new HashMap<>();

    /**
     * Providers registered at startup, by name.
     */
    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    @Data
    public static class CacheConfig {
        private boolean enabled = true;

        /**
         * Root directory of the response cache. Unset disables caching.
         */
        private String path;

        /**
         * POSIX permissions for created cache directories.
         */
        private String directoryMode = "rwxrwxrwx";
    }

    @Data
    public static class HttpConfig {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxInMemorySize = 16 * 1024 * 1024;
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl = "";
        private ThrottleConfig throttle = new ThrottleConfig();
        private Map<String, ApiConfig> apis = new LinkedHashMap<>();
    }

    @Data
    public static class ThrottleConfig {
        private ThrottleType type = ThrottleType.NONE;
        private int callsPerMinute = 60;
    }

    @Data
    public static class ApiConfig {
        private String url = "";
        private String cacheField;
        private String method = "GET";
        private List<String> urlParams = new ArrayList<>();
        private String data;
        private List<String> dataParams = new ArrayList<>();
        private Map<String, String> keyMap = new LinkedHashMap<>();
        private long cacheSeconds = 0;

        /**
         * Built-in decoder name: {@code json-records} or {@code csv}.
         */
        private String decoder = DecoderNames.JSON_RECORDS;

        /**
         * For {@code json-records}: field holding the record array; unset means the root.
         */
        private String recordsField;
    }

    public static final class DecoderNames {
        public static final String JSON_RECORDS = "json-records";
        public static final String CSV = "csv";

        private DecoderNames() {
        }
    }
}
