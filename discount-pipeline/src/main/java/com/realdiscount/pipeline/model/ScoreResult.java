package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoreResult {

    double score;
    DiscountLabel label;
    /** Score alone reached LIKELY_REAL but the visible-discount gate capped the label */
    boolean gated;
    boolean anchorAnomaly;
    RuleSignals signals;
}
