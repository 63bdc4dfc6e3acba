package com.realdiscount.pipeline.service;

/**
 * A retailer source could not deliver its feed. Fatal to the run.
 */
public class SourceException extends RuntimeException {

    private final String retailerName;

    public SourceException(String retailerName, String message) {
        super(message);
        this.retailerName = retailerName;
    }

    public SourceException(String retailerName, String message, Throwable cause) {
        super(message, cause);
        this.retailerName = retailerName;
    }

    public String getRetailerName() {
        return retailerName;
    }
}
