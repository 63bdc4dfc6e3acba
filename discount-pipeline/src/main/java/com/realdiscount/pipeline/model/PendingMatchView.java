package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A PENDING_REVIEW link shown to a reviewer with both sides of the match.
 */
@Data
@Builder
public class PendingMatchView {

    private long matchId;
    private long rawProductId;
    private String retailer;
    private String rawTitle;
    private String productUrl;
    private long canonicalProductId;
    private String canonicalName;
    private String brand;
    private double matchConfidence;
    private String matchMethod;
    private Instant createdAt;
}
