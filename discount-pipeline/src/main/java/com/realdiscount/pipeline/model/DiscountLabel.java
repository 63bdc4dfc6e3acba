package com.realdiscount.pipeline.model;

/**
 * Credibility label of an observed discount, ordered from least to most credible.
 * Values mirror the CHECK constraint on discount_evaluations.label.
 */
public enum DiscountLabel {
    LIKELY_FAKE,
    SUSPICIOUS,
    LIKELY_REAL,
    REAL;

    /** Lowers this label to {@code cap} when it ranks above it. */
    public DiscountLabel atMost(DiscountLabel cap) {
        return this.ordinal() > cap.ordinal() ? cap : this;
    }

    public boolean isAtLeast(DiscountLabel other) {
        return this.ordinal() >= other.ordinal();
    }
}
