package com.pricewatch.tracker.harvest.fetch;

import com.pricewatch.tracker.config.CatalogClientSettings;
import com.pricewatch.tracker.config.HarvestConfig;
import com.pricewatch.tracker.harvest.http.CatalogHttpClient;
import com.pricewatch.tracker.harvest.model.FetchMode;
import com.pricewatch.tracker.harvest.model.ProductFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PriceFetchClientRetryTest {
    private static final long BASE_MS = 10;
    private static final long JITTER_MS = 5;

    private MockWebServer server;
    private ExecutorService executor;
    private final List<Duration> delays = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void retriesRateLimitWithExponentialBackoffThenSucceeds() throws Exception {
        for (int i = 0; i < 4; i++) {
            server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        }
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("product-full.json")));

        ProductFetchResult result = client("secret-key").fetch("2004120000001", FetchMode.FULL);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(5);
        assertThat(result.product().title()).isEqualTo("Tesco tej 2,8% 1 l");
        assertThat(server.getRequestCount()).isEqualTo(5);
        assertThat(delays).hasSize(4);
        for (int attempt = 1; attempt <= delays.size(); attempt++) {
            long floor = BASE_MS * (1L << (attempt - 1));
            assertThat(delays.get(attempt - 1).toMillis()).isBetween(floor, floor + JITTER_MS);
        }
    }

    @Test
    void sendsSingleOperationBatchWithCatalogHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("product-full.json")));

        client("secret-key").fetch("2004120000001", FetchMode.PRICE_ONLY);

        RecordedRequest request = server.takeRequest();
        String body = request.getBody().readUtf8();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("x-apikey")).isEqualTo("secret-key");
        assertThat(request.getHeader("region")).isEqualTo("HU");
        assertThat(request.getHeader("language")).isEqualTo("hu-HU");
        assertThat(request.getHeader("User-Agent")).isEqualTo("test-agent");
        assertThat(body).startsWith("[{").contains("\"operationName\":\"GetProductPrice\"")
            .contains("\"tpnc\":\"2004120000001\"")
            .contains("\"mfeName\":\"mfe-pdp\"");
    }

    @Test
    void omitsApiKeyHeaderWhenNotConfigured() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("product-full.json")));

        client(null).fetch("2004120000001", FetchMode.FULL);

        assertThat(server.takeRequest().getHeader("x-apikey")).isNull();
    }

    @Test
    void exhaustedRateLimitIsReportedAsFailure() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(429));
        }

        ProductFetchResult result = client("secret-key").fetch("2004120000001", FetchMode.FULL);

        assertThat(result.status()).isEqualTo(ProductFetchResult.Status.FAILED);
        assertThat(result.errorCode()).isEqualTo("rate_limited");
        assertThat(delays).hasSize(4);
    }

    @Test
    void serverErrorsAreRetriedAndReportedWithStatus() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }

        ProductFetchResult result = client("secret-key").fetch("2004120000001", FetchMode.FULL);

        assertThat(result.errorCode()).isEqualTo("http_503");
        assertThat(server.getRequestCount()).isEqualTo(5);
    }

    @Test
    void missingProductIsNoDataWithoutRetry() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("product-missing.json")));

        ProductFetchResult result = client("secret-key").fetch("2004120000001", FetchMode.FULL);

        assertThat(result.status()).isEqualTo(ProductFetchResult.Status.NO_DATA);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(delays).isEmpty();
    }

    @Test
    void malformedBodyIsNoData() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>maintenance</html>"));

        ProductFetchResult result = client("secret-key").fetch("2004120000001", FetchMode.FULL);

        assertThat(result.status()).isEqualTo(ProductFetchResult.Status.NO_DATA);
        assertThat(result.errorMessage()).isEqualTo("malformed_json");
    }

    @Test
    void parsesStaticFieldsAndPromotions() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("product-full.json")));

        ProductFetchResult result = client("secret-key").fetch("2004120000001", FetchMode.FULL);

        assertThat(result.product().packSizeValue()).isEqualTo("1");
        assertThat(result.product().packSizeUnit()).isEqualTo("L");
        assertThat(result.product().price().actual()).isEqualByComparingTo("399");
        assertThat(result.product().promotions()).hasSize(2);
        assertThat(result.product().promotions().get(0).hasAttribute("CLUBCARD_PRICING")).isTrue();
    }

    private PriceFetchClient client(String apiKey) {
        CatalogClientSettings settings = new CatalogClientSettings(
            server.url("/v1/graphql").toString(),
            apiKey,
            "HU",
            "hu-HU",
            "test-agent",
            "mfe-pdp",
            5,
            Duration.ofMillis(BASE_MS),
            Duration.ofMillis(JITTER_MS),
            Duration.ofSeconds(5)
        );
        return new PriceFetchClient(
            new CatalogHttpClient(settings, executor),
            settings,
            HarvestConfig.buildObjectMapper(),
            delays::add
        );
    }

    private static String fixture(String name) throws Exception {
        return Files.readString(Path.of("src/test/resources/fixtures", name));
    }
}
