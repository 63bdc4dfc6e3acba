package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.CanonicalProduct;

/**
 * One way of scoring how likely a raw listing and a canonical product are the same physical product.
 *
 * Strategies only measure; the acceptance thresholds live in {@link CanonicalMatcher} so a strategy
 * can be swapped or tested without touching the policy.
 */
public interface SimilarityStrategy {

    /** Stored as product_matches.match_method */
    String method();

    /**
     * Exact strategies are authoritative: a full-confidence hit is accepted as-is and
     * bypasses threshold classification.
     */
    boolean exact();

    /** Similarity in [0, 1]. */
    double similarity(MatchContext context, CanonicalProduct candidate);
}
