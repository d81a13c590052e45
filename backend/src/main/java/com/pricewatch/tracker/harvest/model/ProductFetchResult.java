package com.pricewatch.tracker.harvest.model;

public record ProductFetchResult(
    String identifier,
    FetchMode mode,
    Status status,
    ProductSnapshot product,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public enum Status {
        SUCCESS,
        NO_DATA,
        FAILED
    }

    public static ProductFetchResult success(String identifier, FetchMode mode, ProductSnapshot product, int attempts) {
        return new ProductFetchResult(identifier, mode, Status.SUCCESS, product, attempts, null, null);
    }

    public static ProductFetchResult noData(String identifier, FetchMode mode, int attempts, String reason) {
        return new ProductFetchResult(identifier, mode, Status.NO_DATA, null, attempts, "no_data", reason);
    }

    public static ProductFetchResult failed(String identifier, FetchMode mode, int attempts, String errorCode, String message) {
        return new ProductFetchResult(identifier, mode, Status.FAILED, null, attempts, errorCode, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
