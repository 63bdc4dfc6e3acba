package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.model.RuleSignals;
import com.realdiscount.pipeline.model.ScoreResult;
import com.realdiscount.pipeline.model.Signal;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DiscountScorerTest {

    private final DiscountScorer scorer = new DiscountScorer(new DiscountPipelineProperties());

    private static RuleSignals.RuleSignalsBuilder allAbsent() {
        return RuleSignals.builder()
                .histDelta(Signal.absent())
                .anchorSpike(Signal.absent())
                .crossStore(Signal.absent())
                .multipleSnapshots(Signal.absent())
                .enoughHistory(Signal.absent())
                .visibleDiscount(Signal.absent());
    }

    private static RuleSignals.RuleSignalsBuilder allTrue() {
        return RuleSignals.builder()
                .histDelta(Signal.of(true))
                .anchorSpike(Signal.of(true))
                .crossStore(Signal.of(true))
                .multipleSnapshots(Signal.of(true))
                .enoughHistory(Signal.of(true))
                .visibleDiscount(Signal.of(true))
                .anchorSpikePct(0.0);
    }

    @Test
    public void noEvidenceIsNeutral() {
        ScoreResult r = scorer.score(allAbsent().build());
        assertEquals(0.5, r.getScore());
        assertEquals(DiscountLabel.SUSPICIOUS, r.getLabel());
        assertFalse(r.isGated());
    }

    @Test
    public void onePriorSnapshotWithVisibleDiscountIsSuspicious() {
        // list 10000, current 8900, one prior at 10000: R2 true, R4 false, R6 true
        ScoreResult r = scorer.score(allAbsent()
                .anchorSpike(Signal.of(true, 0.0))
                .multipleSnapshots(Signal.of(false, 1.0))
                .visibleDiscount(Signal.of(true, 0.11))
                .anchorSpikePct(0.0)
                .build());

        assertEquals(0.525, r.getScore(), 1e-9);
        assertEquals(DiscountLabel.SUSPICIOUS, r.getLabel());
    }

    @Test
    public void everythingPassingIsReal() {
        ScoreResult r = scorer.score(allTrue().build());
        assertEquals(1.0, r.getScore());
        assertEquals(DiscountLabel.REAL, r.getLabel());
    }

    @Test
    public void missingVisibleDiscountCapsAtSuspicious() {
        ScoreResult r = scorer.score(allTrue()
                .anchorSpike(Signal.absent())
                .visibleDiscount(Signal.absent())
                .anchorSpikePct(null)
                .build());

        assertEquals(0.925, r.getScore(), 1e-9);
        assertEquals(DiscountLabel.SUSPICIOUS, r.getLabel());
        assertTrue(r.isGated());
    }

    @Test
    public void falseVisibleDiscountAlsoGates() {
        ScoreResult r = scorer.score(allTrue().visibleDiscount(Signal.of(false, 0.05)).build());
        assertEquals(DiscountLabel.SUSPICIOUS, r.getLabel());
        assertTrue(r.isGated());
    }

    @Test
    public void realNeedsCrossStoreEvidence() {
        ScoreResult r = scorer.score(allTrue().crossStore(Signal.absent()).build());
        assertTrue(r.getScore() >= 0.75);
        assertEquals(DiscountLabel.LIKELY_REAL, r.getLabel());
    }

    @Test
    public void anchorAnomalyForcesLikelyFake() {
        ScoreResult r = scorer.score(allTrue()
                .anchorSpike(Signal.of(false, 0.6667))
                .anchorSpikePct(0.6667)
                .build());

        assertTrue(r.isAnchorAnomaly());
        assertEquals(DiscountLabel.LIKELY_FAKE, r.getLabel());
    }

    @Test
    public void allRulesFailingIsLikelyFake() {
        ScoreResult r = scorer.score(RuleSignals.builder()
                .histDelta(Signal.of(false))
                .anchorSpike(Signal.of(true))
                .crossStore(Signal.of(false))
                .multipleSnapshots(Signal.of(true))
                .enoughHistory(Signal.of(false))
                .visibleDiscount(Signal.of(true))
                .anchorSpikePct(0.05)
                .build());

        // 0.25 of 1.0 weight passed
        assertEquals(0.25, r.getScore(), 1e-9);
        assertEquals(DiscountLabel.LIKELY_FAKE, r.getLabel());
    }
}
