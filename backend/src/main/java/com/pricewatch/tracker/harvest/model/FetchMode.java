package com.pricewatch.tracker.harvest.model;

public enum FetchMode {
    FULL("GetProduct"),
    PRICE_ONLY("GetProductPrice");

    private final String operationName;

    FetchMode(String operationName) {
        this.operationName = operationName;
    }

    public String operationName() {
        return operationName;
    }
}
