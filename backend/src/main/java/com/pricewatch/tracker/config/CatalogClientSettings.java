package com.pricewatch.tracker.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public record CatalogClientSettings(
    String apiUrl,
    String apiKey,
    String region,
    String language,
    String userAgent,
    String mfeName,
    int maxAttempts,
    Duration retryBaseDelay,
    Duration retryJitterMax,
    Duration requestTimeout
) {
    public static CatalogClientSettings from(HarvesterProperties properties) {
        HarvesterProperties.Catalog catalog = properties.getCatalog();
        HarvesterProperties.Fetch fetch = properties.getFetch();
        return new CatalogClientSettings(
            catalog.getApiUrl(),
            catalog.getApiKey(),
            catalog.getRegion(),
            catalog.getLanguage(),
            catalog.getUserAgent(),
            catalog.getMfeName(),
            fetch.getMaxAttempts(),
            Duration.ofMillis(fetch.getRetryBaseDelayMs()),
            Duration.ofMillis(fetch.getRetryJitterMaxMs()),
            Duration.ofSeconds(properties.getRequestTimeoutSeconds())
        );
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Map<String, String> requestHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        headers.put("content-type", "application/json");
        headers.put("region", region);
        headers.put("language", language);
        if (hasApiKey()) {
            headers.put("x-apikey", apiKey);
        }
        return headers;
    }
}
