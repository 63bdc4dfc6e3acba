package com.realdiscount.pipeline.service;

/**
 * The feed cannot be served at all (no URL configured, 404, other 4xx). Retrying will not help,
 * so the retailerSource retry ignores it.
 */
public class FeedUnavailableException extends SourceException {

    public FeedUnavailableException(String retailerName, String message) {
        super(retailerName, message);
    }

    public FeedUnavailableException(String retailerName, String message, Throwable cause) {
        super(retailerName, message, cause);
    }
}
