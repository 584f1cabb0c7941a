package com.stockaid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for stockaid - caching, throttled gateway to remote data providers.
 */
@SpringBootApplication
public class StockaidApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockaidApplication.class, args);
    }
}
