package com.pricewatch.tracker.harvest.discovery;

import com.pricewatch.tracker.config.HarvesterProperties;
import com.pricewatch.tracker.harvest.http.CatalogHttpClient;
import com.pricewatch.tracker.harvest.model.CatalogDiscoveryResult;
import com.pricewatch.tracker.harvest.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

@Service
public class CatalogDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(CatalogDiscoveryService.class);
    static final String SITEMAP_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final CatalogHttpClient httpClient;
    private final String indexUrl;
    private final Pattern identifierPattern;

    public CatalogDiscoveryService(CatalogHttpClient httpClient, HarvesterProperties properties) {
        this.httpClient = httpClient;
        this.indexUrl = properties.getCatalog().getSitemapIndexUrl();
        this.identifierPattern = identifierPattern(properties.getCatalog().getProductPathSegment());
    }

    public CatalogDiscoveryResult discoverCatalog() {
        Map<String, Integer> errors = new LinkedHashMap<>();
        Document index = fetchXml(indexUrl, errors);
        if (index == null) {
            log.error("Sitemap index {} unavailable; discovery yields no identifiers", indexUrl);
            return CatalogDiscoveryResult.empty(errors);
        }

        List<String> subIndexes = new ArrayList<>();
        for (Element loc : index.select("loc")) {
            String url = normalizeSitemapUrl(loc.text());
            if (url != null && !subIndexes.contains(url)) {
                subIndexes.add(url);
            }
        }
        log.info("Found {} sitemaps in {}", subIndexes.size(), indexUrl);

        LinkedHashSet<String> identifiers = new LinkedHashSet<>();
        int fetched = 0;
        for (String subIndexUrl : subIndexes) {
            Document subIndex = fetchXml(subIndexUrl, errors);
            if (subIndex == null) {
                continue;
            }
            fetched++;
            int before = identifiers.size();
            int found = 0;
            for (Element loc : subIndex.select("loc")) {
                String identifier = extractIdentifier(loc.text());
                if (identifier != null) {
                    found++;
                    identifiers.add(identifier);
                }
            }
            log.info("Found {} products in {} ({} new)", found, subIndexUrl, identifiers.size() - before);
        }

        log.info("Total unique products discovered: {}", identifiers.size());
        return new CatalogDiscoveryResult(new ArrayList<>(identifiers), subIndexes.size(), fetched, errors);
    }

    String extractIdentifier(String loc) {
        if (loc == null || loc.isBlank()) {
            return null;
        }
        Matcher matcher = identifierPattern.matcher(loc.trim());
        return matcher.find() ? matcher.group(1) : null;
    }

    private Document fetchXml(String url, Map<String, Integer> errors) {
        HttpFetchResult fetch = httpClient.get(url, SITEMAP_ACCEPT);
        if (!fetch.isSuccessful()) {
            log.error("Error fetching sitemap {}: {}", url, fetch.describe());
            increment(errors, errorKey(fetch));
            return null;
        }
        String xmlPayload;
        try {
            xmlPayload = extractXmlPayload(url, fetch);
        } catch (IOException e) {
            log.error("Error decoding sitemap {}: {}", url, e.getMessage());
            increment(errors, "gzip_decode_error");
            return null;
        }
        if (xmlPayload == null || xmlPayload.isBlank()) {
            log.error("Empty sitemap payload from {}", url);
            increment(errors, "empty_sitemap_payload");
            return null;
        }
        try {
            return Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        } catch (RuntimeException e) {
            log.error("Error parsing sitemap {}: {}", url, e.getMessage());
            increment(errors, "xml_parse_error");
            return null;
        }
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.put(key, errors.getOrDefault(key, 0) + 1);
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }

        if (isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        String requestedUrl = sitemapUrl == null ? "" : sitemapUrl.toLowerCase(Locale.ROOT);
        String resolvedUrl = fetch.finalUrlOrRequested() == null
            ? ""
            : fetch.finalUrlOrRequested().toLowerCase(Locale.ROOT);
        if (requestedUrl.endsWith(".gz") || resolvedUrl.endsWith(".gz")) {
            return true;
        }
        if (fetch.contentEncoding() != null && fetch.contentEncoding().toLowerCase(Locale.ROOT).contains("gzip")) {
            return true;
        }
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        return normalized;
    }

    private static Pattern identifierPattern(String pathSegment) {
        String segment = pathSegment == null || pathSegment.isBlank() ? "products" : pathSegment.trim();
        segment = segment.replaceAll("^/+|/+$", "");
        return Pattern.compile("/" + Pattern.quote(segment) + "/(\\d+)");
    }
}
