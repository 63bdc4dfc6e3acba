package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * One evaluation as exposed to the API / dashboard layer.
 */
@Data
@Builder
public class DealView {

    private long evaluationId;
    private String retailer;
    private String canonicalName;
    private String brand;
    private String productUrl;
    private double priceCurrent;
    private Double priceList;
    private double score;
    private DiscountLabel label;
    private Double discountPct;
    private Double histDeltaPct;
    private Double crossStoreDeltaPct;
    private boolean anchorAnomalyFlag;
    private MatchStatus matchStatus;
    private Map<String, Object> ruleTrace;
    private String scoringVersion;
    private Instant scrapedAt;
    private Instant createdAt;
    private String explanation;
}
