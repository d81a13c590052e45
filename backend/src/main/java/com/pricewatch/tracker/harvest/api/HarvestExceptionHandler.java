package com.pricewatch.tracker.harvest.api;

import com.pricewatch.tracker.harvest.persistence.RecordPersistenceException;
import com.pricewatch.tracker.harvest.service.ActiveHarvestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class HarvestExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(HarvestExceptionHandler.class);

    @ExceptionHandler(ActiveHarvestException.class)
    public ResponseEntity<Map<String, String>> handleActiveHarvest(ActiveHarvestException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "active_harvest", "message", ex.getMessage()));
    }

    @ExceptionHandler(RecordPersistenceException.class)
    public ResponseEntity<Map<String, String>> handlePersistence(RecordPersistenceException ex) {
        log.error("Storage failure while serving request", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "storage_unavailable", "message", ex.getMessage()));
    }
}
