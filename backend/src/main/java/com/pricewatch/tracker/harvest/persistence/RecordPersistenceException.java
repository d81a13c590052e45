package com.pricewatch.tracker.harvest.persistence;

public class RecordPersistenceException extends RuntimeException {
    public RecordPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
