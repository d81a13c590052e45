package com.pricewatch.tracker.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HarvesterPropertiesGuardrailTest {

    @Test
    void defaultsMatchDailyHarvest() {
        HarvesterProperties properties = new HarvesterProperties();
        assertEquals(5, properties.getWorkerCount());
        assertEquals(12, properties.getFreshnessWindowHours());
        assertEquals(5, properties.getFetch().getMaxAttempts());
        assertEquals(ZoneId.of("Europe/Budapest"), properties.zone());
        assertEquals("0 0 5 * * *", properties.getSchedule().getCron());
    }

    @Test
    void countsAreClamped() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setWorkerCount(0);
        properties.setFreshnessWindowHours(-3);
        properties.getFetch().setMaxAttempts(0);
        properties.getFetch().setRetryBaseDelayMs(-1);
        assertEquals(1, properties.getWorkerCount());
        assertEquals(0, properties.getFreshnessWindowHours());
        assertEquals(1, properties.getFetch().getMaxAttempts());
        assertEquals(0, properties.getFetch().getRetryBaseDelayMs());
    }

    @Test
    void blankValuesFallBackToDefaults() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setZoneId("  ");
        properties.getCatalog().setUserAgent(" ");
        properties.getCatalog().setApiKey("   ");
        assertEquals("Europe/Budapest", properties.getZoneId());
        assertTrue(properties.getCatalog().getUserAgent().startsWith("Mozilla/5.0"));
        assertNull(properties.getCatalog().getApiKey());
    }

    @Test
    void settingsOmitApiKeyHeaderWhenUnset() {
        HarvesterProperties properties = new HarvesterProperties();
        CatalogClientSettings settings = CatalogClientSettings.from(properties);

        assertFalse(settings.hasApiKey());
        assertFalse(settings.requestHeaders().containsKey("x-apikey"));
        assertEquals("HU", settings.requestHeaders().get("region"));
        assertEquals(Duration.ofMillis(2000), settings.retryBaseDelay());

        properties.getCatalog().setApiKey("k");
        assertEquals("k", CatalogClientSettings.from(properties).requestHeaders().get("x-apikey"));
    }
}
