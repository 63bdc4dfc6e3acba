package com.realdiscount.pipeline.service;

/**
 * An evaluation points at a canonical product, retailer or snapshot that does not exist.
 * Unlike a per-entity constraint violation this aborts the whole run.
 */
public class MissingReferenceException extends RuntimeException {

    public MissingReferenceException(String message) {
        super(message);
    }
}
