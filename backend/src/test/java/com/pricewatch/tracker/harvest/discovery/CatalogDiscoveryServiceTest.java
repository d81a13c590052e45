package com.pricewatch.tracker.harvest.discovery;

import com.pricewatch.tracker.config.HarvesterProperties;
import com.pricewatch.tracker.harvest.http.CatalogHttpClient;
import com.pricewatch.tracker.harvest.model.CatalogDiscoveryResult;
import com.pricewatch.tracker.harvest.model.HttpFetchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogDiscoveryServiceTest {
    private static final String INDEX = "https://shop.example.com/sitemaps/products-index.xml";
    private static final String SUB_1 = "https://shop.example.com/sitemaps/products-1.xml";
    private static final String SUB_2 = "https://shop.example.com/sitemaps/products-2.xml";
    private static final String SUB_3 = "https://shop.example.com/sitemaps/products-3.xml.gz";

    @Mock
    private CatalogHttpClient httpClient;

    private CatalogDiscoveryService service;

    @BeforeEach
    void setUp() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getCatalog().setSitemapIndexUrl(INDEX);
        service = new CatalogDiscoveryService(httpClient, properties);
    }

    @Test
    void collectsUniqueIdentifiersInFirstSeenOrder() throws Exception {
        respond(INDEX, ok(INDEX, fixture("sitemap-index.xml")));
        respond(SUB_1, ok(SUB_1, fixture("products-1.xml")));
        respond(SUB_2, ok(SUB_2, fixture("products-2.xml")));
        respond(SUB_3, ok(SUB_3, fixture("products-3.xml.gz")));

        CatalogDiscoveryResult result = service.discoverCatalog();

        assertThat(result.identifiers()).containsExactly(
            "2004120000001",
            "2004120000002",
            "2004120000003",
            "2004120000004"
        );
        assertThat(result.subIndexCount()).isEqualTo(3);
        assertThat(result.subIndexesFetched()).isEqualTo(3);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void failedSubIndexContributesNothing() throws Exception {
        respond(INDEX, ok(INDEX, fixture("sitemap-index.xml")));
        respond(SUB_1, ok(SUB_1, fixture("products-1.xml")));
        respond(SUB_2, status(SUB_2, 500));
        respond(SUB_3, ok(SUB_3, fixture("products-3.xml.gz")));

        CatalogDiscoveryResult result = service.discoverCatalog();

        assertThat(result.identifiers()).containsExactly("2004120000001", "2004120000002", "2004120000004");
        assertThat(result.subIndexesFetched()).isEqualTo(2);
        assertThat(result.errors()).containsEntry("http_500", 1);
    }

    @Test
    void unavailableIndexYieldsEmptyPopulation() {
        respond(INDEX, status(INDEX, 404));

        CatalogDiscoveryResult result = service.discoverCatalog();

        assertThat(result.identifiers()).isEmpty();
        assertThat(result.errors()).containsEntry("http_404", 1);
    }

    @Test
    void identifierRequiresProductPathSegment() {
        assertThat(service.extractIdentifier("https://shop.example.com/hu-HU/products/123456")).isEqualTo("123456");
        assertThat(service.extractIdentifier("https://shop.example.com/hu-HU/shop/123456")).isNull();
        assertThat(service.extractIdentifier("  ")).isNull();
    }

    private void respond(String url, HttpFetchResult result) {
        when(httpClient.get(eq(url), eq(CatalogDiscoveryService.SITEMAP_ACCEPT))).thenReturn(result);
    }

    private static HttpFetchResult ok(String url, byte[] body) {
        return new HttpFetchResult(
            url, URI.create(url), 200, null, body, "application/xml", null, Instant.now(), Duration.ofMillis(5), null, null
        );
    }

    private static HttpFetchResult status(String url, int statusCode) {
        return new HttpFetchResult(
            url, URI.create(url), statusCode, "", new byte[0], "text/html", null, Instant.now(), Duration.ofMillis(5), null, null
        );
    }

    private static byte[] fixture(String name) throws Exception {
        return Files.readAllBytes(Path.of("src/test/resources/fixtures", name));
    }
}
