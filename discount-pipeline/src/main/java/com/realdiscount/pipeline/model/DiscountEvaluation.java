package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Immutable verdict for one snapshot under one scoring version.
 */
@Data
@Builder
public class DiscountEvaluation {

    private Long id;
    private Long canonicalProductId;
    private Long retailerId;
    private Long snapshotId;
    private String runId;
    private double score;
    private DiscountLabel label;
    private Double discountPct;
    private Double histDeltaPct;
    private Double crossStoreDeltaPct;
    private boolean anchorAnomalyFlag;
    /** JSON object keyed by the rule names, see {@link RuleSignals#toTrace()} */
    private String ruleTrace;
    private String scoringVersion;
    private Instant createdAt;
}
