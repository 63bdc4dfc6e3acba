package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Edge from a raw product to a canonical product.
 *
 * The active link of a raw product is its one row that is not REJECTED and has no supersededAt.
 * Older rows stay as history.
 */
@Data
@Builder
public class ProductMatch {

    private Long id;
    private Long rawProductId;
    private Long canonicalProductId;
    private double matchConfidence;
    /** exact-ean | fuzzy-token-v1 (matching.method-version) | manual | new-canonical */
    private String matchMethod;
    private MatchStatus status;
    private String runId;
    private Instant createdAt;
    private Instant supersededAt;

    public boolean isActive() {
        return supersededAt == null && status != MatchStatus.REJECTED;
    }
}
