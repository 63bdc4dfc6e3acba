package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.model.RuleSignals;
import com.realdiscount.pipeline.model.ScoreResult;
import com.realdiscount.pipeline.model.Signal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns rule signals into a score in [0, 1] and a label.
 *
 * Only present signals contribute. Their weighted pass rate is pulled toward the neutral 0.5 by
 * how much of the total weight was actually observed:
 *
 *   raw      = Σ w(true) / Σ w(present)        (0.5 when nothing is present)
 *   coverage = Σ w(present) / Σ w(all)
 *   score    = 0.5 + (raw - 0.5) · coverage
 *
 * The label then climbs LIKELY_FAKE → SUSPICIOUS → LIKELY_REAL → REAL as long as each step's score
 * and rule conditions hold. Without a visible discount (R6) the label never passes SUSPICIOUS,
 * and an inflated anchor price forces LIKELY_FAKE.
 */
@Component
@RequiredArgsConstructor
public class DiscountScorer {

    private final DiscountPipelineProperties properties;

    public ScoreResult score(RuleSignals signals) {
        DiscountPipelineProperties.Scoring scoring = properties.getScoring();
        DiscountPipelineProperties.Scoring.Weights w = scoring.getWeights();

        double[] weights = {w.getHistDelta(), w.getAnchorSpike(), w.getCrossStore(),
                w.getMultipleSnapshots(), w.getEnoughHistory()};
        Signal[] weighted = {signals.getHistDelta(), signals.getAnchorSpike(), signals.getCrossStore(),
                signals.getMultipleSnapshots(), signals.getEnoughHistory()};

        double total = 0.0;
        double present = 0.0;
        double passed = 0.0;
        for (int i = 0; i < weights.length; i++) {
            total += weights[i];
            if (weighted[i].isPresent()) {
                present += weights[i];
                if (weighted[i].isTrue()) passed += weights[i];
            }
        }

        double raw = present > 0.0 ? passed / present : 0.5;
        double coverage = total > 0.0 ? present / total : 0.0;
        double score = Math.max(0.0, Math.min(1.0, 0.5 + (raw - 0.5) * coverage));
        score = RuleEvaluator.round4(score);

        Signal visible = signals.getVisibleDiscount();
        DiscountLabel label = DiscountLabel.LIKELY_FAKE;
        if (score >= scoring.getSuspiciousMinScore()) {
            label = DiscountLabel.SUSPICIOUS;
        }
        if (score >= scoring.getLikelyRealMinScore() && visible.isTrue()) {
            label = DiscountLabel.LIKELY_REAL;
        }
        if (score >= scoring.getRealMinScore()
                && visible.isTrue()
                && signals.getHistDelta().isTrue()
                && signals.getCrossStore().isTrue()
                && !signals.getAnchorSpike().isFalse()) {
            label = DiscountLabel.REAL;
        }

        // Visible-discount gate
        boolean gated = score >= scoring.getLikelyRealMinScore() && !visible.isTrue();
        if (!visible.isTrue()) {
            label = label.atMost(DiscountLabel.SUSPICIOUS);
        }

        boolean anomaly = signals.getAnchorSpikePct() != null
                && signals.getAnchorSpikePct() > scoring.getAnchorAnomalyThreshold();
        if (anomaly) {
            label = DiscountLabel.LIKELY_FAKE;
        }

        return ScoreResult.builder()
                .score(score)
                .label(label)
                .gated(gated)
                .anchorAnomaly(anomaly)
                .signals(signals)
                .build();
    }
}
