package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.PriceSnapshot;
import com.realdiscount.pipeline.model.RuleSignals;
import com.realdiscount.pipeline.model.Signal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Computes the six credibility rules for one snapshot.
 *
 * R1 price vs. own history      hist_delta_pct ≤ -histDropThreshold
 * R2 list price vs. past lists  anchor_spike_pct ≤ anchorSpikeThreshold
 * R3 price vs. other retailers  cross_store_delta_pct ≤ -crossStoreThreshold
 * R4 seen before                at least minPriorSnapshots prior observations
 * R5 history long enough        earliest prior → current spans minRetentionDays (any prior count)
 * R6 advertised markdown        (list - current) / list ≥ minVisibleDiscount
 *
 * A rule without the data it needs is ABSENT, never FALSE.
 */
@Component
@RequiredArgsConstructor
public class RuleEvaluator {

    private final DiscountPipelineProperties properties;

    /**
     * @param priceCurrent observed price
     * @param priceList    advertised original price, may be null
     * @param scrapedAt    observation time
     * @param history      prior snapshots of the same listing, oldest first
     * @param peerPrices   latest prices of the same canonical product at other retailers
     */
    public record RuleInput(double priceCurrent,
                            Double priceList,
                            Instant scrapedAt,
                            List<PriceSnapshot> history,
                            List<Double> peerPrices) {}

    public RuleSignals evaluate(RuleInput input) {
        DiscountPipelineProperties.Scoring scoring = properties.getScoring();
        DiscountPipelineProperties.History historyCfg = properties.getHistory();
        List<PriceSnapshot> history = input.history() == null ? List.of() : input.history();
        boolean enoughPriors = history.size() >= historyCfg.getMinPriorSnapshots();
        double current = input.priceCurrent();

        // R1
        Signal histDelta = Signal.absent();
        Double histDeltaPct = null;
        if (enoughPriors) {
            Double med = median(history.stream().map(PriceSnapshot::getPriceCurrent).toList());
            if (med != null) {
                double delta = (current - med) / med;
                histDeltaPct = round4(delta);
                histDelta = Signal.of(delta <= -scoring.getHistDropThreshold(), histDeltaPct);
            }
        }

        // R2
        Signal anchorSpike = Signal.absent();
        Double anchorSpikePct = null;
        if (hasListPrice(input.priceList())) {
            Double med = median(history.stream().map(PriceSnapshot::getPriceList).toList());
            if (med != null) {
                double spike = (input.priceList() - med) / med;
                anchorSpikePct = spike;
                anchorSpike = Signal.of(spike <= scoring.getAnchorSpikeThreshold(), round4(spike));
            }
        }

        // R3
        Signal crossStore = Signal.absent();
        Double crossStoreDeltaPct = null;
        Double peerMedian = median(input.peerPrices());
        if (peerMedian != null) {
            double delta = (current - peerMedian) / peerMedian;
            crossStoreDeltaPct = round4(delta);
            crossStore = Signal.of(delta <= -scoring.getCrossStoreThreshold(), crossStoreDeltaPct);
        }

        // R4
        Signal multipleSnapshots = Signal.of(enoughPriors, (double) history.size());

        // R5: decided by the span alone, one prior snapshot is enough; a short window stays ABSENT
        Signal enoughHistory = Signal.absent();
        if (!history.isEmpty()) {
            Duration span = Duration.between(history.get(0).getScrapedAt(), input.scrapedAt());
            double spanDays = span.toMinutes() / (24.0 * 60.0);
            if (spanDays >= historyCfg.getMinRetentionDays()) {
                enoughHistory = Signal.of(true, round4(spanDays));
            }
        }

        // R6
        Signal visibleDiscount = Signal.absent();
        Double discountPct = null;
        if (hasListPrice(input.priceList())) {
            double discount = (input.priceList() - current) / input.priceList();
            discountPct = round4(discount);
            visibleDiscount = Signal.of(discount >= scoring.getMinVisibleDiscount(), discountPct);
        }

        return RuleSignals.builder()
                .histDelta(histDelta)
                .anchorSpike(anchorSpike)
                .crossStore(crossStore)
                .multipleSnapshots(multipleSnapshots)
                .enoughHistory(enoughHistory)
                .visibleDiscount(visibleDiscount)
                .discountPct(discountPct)
                .histDeltaPct(histDeltaPct)
                .crossStoreDeltaPct(crossStoreDeltaPct)
                .anchorSpikePct(anchorSpikePct)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private boolean hasListPrice(Double priceList) {
        return priceList != null && priceList > 0;
    }

    /** Median of the positive values, null when there are none. */
    static Double median(List<Double> values) {
        if (values == null) return null;
        List<Double> sorted = new ArrayList<>();
        for (Double v : values) {
            if (Objects.nonNull(v) && v > 0) sorted.add(v);
        }
        if (sorted.isEmpty()) return null;
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    static double round4(double v) {
        return Math.round(v * 10_000d) / 10_000d;
    }
}
