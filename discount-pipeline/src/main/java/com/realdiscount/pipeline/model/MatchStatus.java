package com.realdiscount.pipeline.model;

/**
 * Lifecycle of a raw product → canonical product link.
 * Values mirror the CHECK constraint on product_matches.status.
 */
public enum MatchStatus {
    AUTO_ACCEPTED,
    /** Usable for scoring but queued for a human decision. */
    PENDING_REVIEW,
    MANUAL_CONFIRMED,
    REJECTED
}
