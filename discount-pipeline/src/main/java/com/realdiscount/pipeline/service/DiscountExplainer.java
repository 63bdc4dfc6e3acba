package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.DealView;
import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.RuleSignals;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain-language reasons for a label, read from the stored rule trace.
 */
@Component
public class DiscountExplainer {

    static final String DEFAULT_REASON = "The label follows from the weighted score and the rules.";

    public String explain(DealView deal) {
        Map<String, Object> trace = deal.getRuleTrace() == null ? Map.of() : deal.getRuleTrace();
        List<String> reasons = new ArrayList<>();

        if (Boolean.FALSE.equals(trace.get(RuleSignals.R6_VISIBLE_DISCOUNT))) {
            reasons.add("The visible discount is below 10%, so it cannot be LIKELY_REAL or REAL.");
        }
        if (Boolean.FALSE.equals(trace.get(RuleSignals.R3_CROSS_STORE)) && deal.getCrossStoreDeltaPct() != null) {
            reasons.add("The price is not at least 5% below other retailers, so competitiveness is weak.");
        }
        if (Boolean.FALSE.equals(trace.get(RuleSignals.R2_ANCHOR_SPIKE))) {
            reasons.add("The list price looks inflated compared with earlier list prices (artificial anchor risk).");
        }
        if (deal.isAnchorAnomalyFlag()) {
            reasons.add("The list price jumped more than 25% above its usual level, which forces LIKELY_FAKE.");
        }
        if (trace.get(RuleSignals.R1_HIST_DELTA) == null && trace.containsKey(RuleSignals.R1_HIST_DELTA)) {
            reasons.add("There is not enough price history yet to compare against past prices.");
        }
        if (deal.getMatchStatus() == MatchStatus.PENDING_REVIEW) {
            reasons.add("The product identity is still pending review, so cross-store comparisons may be off.");
        }

        if (reasons.isEmpty()) {
            reasons.add(DEFAULT_REASON);
        }
        return String.join(" ", reasons);
    }
}
