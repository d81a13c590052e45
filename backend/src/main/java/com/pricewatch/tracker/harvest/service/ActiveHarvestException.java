package com.pricewatch.tracker.harvest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveHarvestException extends RuntimeException {
    public ActiveHarvestException(String message) {
        super(message);
    }
}
