package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The six rule outcomes for one snapshot plus the percentages they were derived from.
 *
 * Percentages follow one sign convention: (current - reference) / reference, so a negative
 * histDeltaPct or crossStoreDeltaPct means "cheaper than the reference". discountPct is the
 * advertised discount (list - current) / list and is positive for a markdown.
 */
@Value
@Builder
public class RuleSignals {

    // Rule trace keys. The explanation UI reads these names, keep them stable across versions.
    public static final String R1_HIST_DELTA = "R1_hist_delta_ge_15pct";
    public static final String R2_ANCHOR_SPIKE = "R2_anchor_spike_le_10pct";
    public static final String R3_CROSS_STORE = "R3_cross_store_ge_5pct";
    public static final String R4_MULTIPLE_SNAPSHOTS = "R4_seen_multiple_snapshots";
    public static final String R5_ENOUGH_HISTORY = "R5_has_enough_history";
    public static final String R6_VISIBLE_DISCOUNT = "R6_visible_discount_ge_10pct";
    public static final String ANCHOR_SPIKE_PCT = "anchor_spike_pct";

    Signal histDelta;
    Signal anchorSpike;
    Signal crossStore;
    Signal multipleSnapshots;
    Signal enoughHistory;
    Signal visibleDiscount;

    Double discountPct;
    Double histDeltaPct;
    Double crossStoreDeltaPct;
    Double anchorSpikePct;

    /**
     * Structured trace: booleans (null when absent) for R1-R6 and the numeric anchor spike.
     */
    public Map<String, Object> toTrace() {
        Map<String, Object> trace = new LinkedHashMap<>();
        trace.put(R1_HIST_DELTA, histDelta.toTraceValue());
        trace.put(R2_ANCHOR_SPIKE, anchorSpike.toTraceValue());
        trace.put(R3_CROSS_STORE, crossStore.toTraceValue());
        trace.put(R4_MULTIPLE_SNAPSHOTS, multipleSnapshots.toTraceValue());
        trace.put(R5_ENOUGH_HISTORY, enoughHistory.toTraceValue());
        trace.put(R6_VISIBLE_DISCOUNT, visibleDiscount.toTraceValue());
        trace.put(ANCHOR_SPIKE_PCT, anchorSpikePct == null ? null : round4(anchorSpikePct));
        return trace;
    }

    private static double round4(double v) {
        return Math.round(v * 10_000d) / 10_000d;
    }
}
