package com.stockaid.exception;

/**
 * Lookup of an unknown provider or API.
 */
public class ApiNotFoundException extends ApiConfigurationException {

    public ApiNotFoundException(String message) {
        super(message);
    }

    public static ApiNotFoundException provider(String provider) {
        return new ApiNotFoundException("Provider '" + provider + "' not registered.");
    }

    public static ApiNotFoundException api(String provider, String api) {
        return new ApiNotFoundException("API '" + api + "' not registered for provider '" + provider + "'.");
    }
}
