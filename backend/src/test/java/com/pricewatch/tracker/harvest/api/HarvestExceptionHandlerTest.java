package com.pricewatch.tracker.harvest.api;

import com.pricewatch.tracker.harvest.persistence.RecordPersistenceException;
import com.pricewatch.tracker.harvest.service.ActiveHarvestException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HarvestExceptionHandlerTest {

    @Test
    void activeHarvestMapsToConflict() {
        ResponseEntity<Map<String, String>> response = new HarvestExceptionHandler()
            .handleActiveHarvest(new ActiveHarvestException("busy"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("active_harvest", response.getBody().get("error"));
        assertEquals("busy", response.getBody().get("message"));
    }

    @Test
    void storageFailureMapsToServiceUnavailable() {
        ResponseEntity<Map<String, String>> response = new HarvestExceptionHandler()
            .handlePersistence(new RecordPersistenceException("Failed to search products for 'tej'", null));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("storage_unavailable", response.getBody().get("error"));
    }
}
