package com.pricewatch.tracker.harvest.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pricewatch.tracker.config.CatalogClientSettings;
import com.pricewatch.tracker.harvest.http.CatalogHttpClient;
import com.pricewatch.tracker.harvest.model.FetchMode;
import com.pricewatch.tracker.harvest.model.HttpFetchResult;
import com.pricewatch.tracker.harvest.model.ProductFetchResult;
import com.pricewatch.tracker.harvest.model.ProductSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PriceFetchClient {
    private static final Logger log = LoggerFactory.getLogger(PriceFetchClient.class);

    private final CatalogHttpClient httpClient;
    private final CatalogClientSettings settings;
    private final ObjectMapper objectMapper;
    private final ProductPayloadParser parser;
    private final BackoffSleeper sleeper;

    @Autowired
    public PriceFetchClient(CatalogHttpClient httpClient, CatalogClientSettings settings, ObjectMapper objectMapper) {
        this(httpClient, settings, objectMapper, BackoffSleeper.THREAD_SLEEP);
    }

    public PriceFetchClient(
        CatalogHttpClient httpClient,
        CatalogClientSettings settings,
        ObjectMapper objectMapper,
        BackoffSleeper sleeper
    ) {
        this.httpClient = httpClient;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.parser = new ProductPayloadParser(objectMapper);
        this.sleeper = sleeper;
    }

    public ProductFetchResult fetch(String identifier, FetchMode mode) {
        String payload;
        try {
            payload = buildPayload(identifier, mode);
        } catch (JsonProcessingException e) {
            log.error("Could not build request payload for {}", identifier, e);
            return ProductFetchResult.failed(identifier, mode, 0, "payload_error", e.getMessage());
        }

        int maxAttempts = settings.maxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            HttpFetchResult response = httpClient.postJson(settings.apiUrl(), payload, settings.requestHeaders());
            if (response.isSuccessful()) {
                return toResult(identifier, mode, response, attempt + 1);
            }
            if ("interrupted".equals(response.errorCode())) {
                return ProductFetchResult.failed(identifier, mode, attempt + 1, "interrupted", response.errorMessage());
            }

            String error = response.isRateLimited() ? "rate_limited (429)" : response.describe();
            if (attempt >= maxAttempts - 1) {
                log.error("API request failed for {} after {} attempts: {}", identifier, maxAttempts, error);
                return ProductFetchResult.failed(
                    identifier,
                    mode,
                    attempt + 1,
                    response.isRateLimited() ? "rate_limited" : errorCode(response),
                    error
                );
            }

            Duration delay = backoffDelay(attempt);
            log.warn(
                "API request failed for {} (Attempt {}/{}). Retrying in {} ms. Error: {}",
                identifier,
                attempt + 1,
                maxAttempts,
                delay.toMillis(),
                error
            );
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ProductFetchResult.failed(identifier, mode, attempt + 1, "interrupted", "interrupted during backoff");
            }
        }
        return ProductFetchResult.failed(identifier, mode, maxAttempts, "exhausted", "no attempt succeeded");
    }

    /**
     * {@code base * 2^attempt + uniform(0, jitterMax)}, attempt counted from 0.
     */
    Duration backoffDelay(int attempt) {
        long baseMs = settings.retryBaseDelay().toMillis();
        long exponential = baseMs * (1L << Math.min(Math.max(0, attempt), 20));
        long jitterMaxMs = settings.retryJitterMax().toMillis();
        long jitter = jitterMaxMs <= 0 ? 0L : ThreadLocalRandom.current().nextLong(jitterMaxMs + 1);
        return Duration.ofMillis(exponential + jitter);
    }

    private ProductFetchResult toResult(String identifier, FetchMode mode, HttpFetchResult response, int attempts) {
        ProductSnapshot snapshot;
        try {
            snapshot = parser.parse(identifier, response.body());
        } catch (IOException e) {
            log.warn("Malformed response for {}: {}", identifier, e.getMessage());
            return ProductFetchResult.noData(identifier, mode, attempts, "malformed_json");
        }
        if (snapshot == null) {
            log.warn("No product or price data returned for {}", identifier);
            return ProductFetchResult.noData(identifier, mode, attempts, "missing_product_or_price");
        }
        return ProductFetchResult.success(identifier, mode, snapshot, attempts);
    }

    private String buildPayload(String identifier, FetchMode mode) throws JsonProcessingException {
        ObjectNode operation = objectMapper.createObjectNode();
        operation.put("operationName", mode.operationName());
        operation.putObject("variables").put("tpnc", identifier);
        if (settings.mfeName() != null) {
            operation.putObject("extensions").put("mfeName", settings.mfeName());
        }
        operation.put("query", CatalogQueries.queryFor(mode));
        ArrayNode batch = objectMapper.createArrayNode();
        batch.add(operation);
        return objectMapper.writeValueAsString(batch);
    }

    private String errorCode(HttpFetchResult response) {
        if (response.errorCode() != null) {
            return response.errorCode();
        }
        return "http_" + response.statusCode();
    }
}
