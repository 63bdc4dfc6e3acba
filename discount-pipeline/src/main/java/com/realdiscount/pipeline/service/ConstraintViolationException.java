package com.realdiscount.pipeline.service;

/**
 * A schema invariant rejected a write. Aborts the write of that entity only.
 */
public class ConstraintViolationException extends RuntimeException {

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConstraintViolationException(String message) {
        super(message);
    }
}
