package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.CanonicalProduct;
import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.NormalizedIdentity;
import com.realdiscount.pipeline.model.ProductMatch;
import com.realdiscount.pipeline.model.RawProduct;
import com.realdiscount.pipeline.output.CatalogStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Links a raw listing to the canonical product it represents, creating one when nothing is close.
 *
 * Policy, in order:
 *   1. a raw product is matched at most once per run; a second sighting reuses the row
 *   2. exact strategies (manual confirmation, EAN) decide on a full-confidence hit
 *   3. fuzzy similarity: ≥ auto-accept threshold accepted, ≥ review threshold queued for review
 *   4. otherwise a new canonical product is created and self-matched
 *
 * Equal confidences are broken by the candidate with more price history, then the lowest id.
 */
@Service
@Slf4j
public class CanonicalMatcher {

    public static final String NEW_CANONICAL_METHOD = "new-canonical";

    private final List<SimilarityStrategy> strategies;
    private final CatalogStore catalogStore;
    private final DiscountPipelineProperties properties;

    public CanonicalMatcher(List<SimilarityStrategy> strategies,
                            CatalogStore catalogStore,
                            DiscountPipelineProperties properties) {
        List<SimilarityStrategy> ordered = new ArrayList<>(strategies);
        AnnotationAwareOrderComparator.sort(ordered);
        this.strategies = List.copyOf(ordered);
        this.catalogStore = catalogStore;
        this.properties = properties;
    }

    public ProductMatch match(RawProduct raw, NormalizedIdentity identity, String runId) {
        Optional<ProductMatch> sameRun = catalogStore.findRunMatch(raw.getId(), runId);
        if (sameRun.isPresent()) {
            log.debug("Raw product {} already matched in run {}", raw.getId(), runId);
            return sameRun.get();
        }

        MatchContext context = new MatchContext(
                raw.getId(),
                identity,
                catalogStore.findActiveMatch(raw.getId()).orElse(null),
                catalogStore.rejectedCanonicalIds(raw.getId()));

        List<CanonicalProduct> pool = candidatePool(context);
        ProductMatch decision = decide(context, pool);

        if (decision == null) {
            CanonicalProduct created = catalogStore.insertCanonical(CanonicalProduct.builder()
                    .canonicalName(identity.name().isEmpty() ? raw.getTitle() : identity.name())
                    .brandNorm(identity.brand())
                    .sizeValue(identity.sizeValue())
                    .sizeUnit(identity.sizeUnit())
                    .categoryNorm(identity.category())
                    .ean(identity.ean())
                    .build());
            log.debug("Created canonical product {} '{}' for raw product {}",
                    created.getId(), created.getCanonicalName(), raw.getId());
            decision = ProductMatch.builder()
                    .canonicalProductId(created.getId())
                    .matchConfidence(1.0)
                    .matchMethod(NEW_CANONICAL_METHOD)
                    .status(MatchStatus.AUTO_ACCEPTED)
                    .build();
        }

        decision.setRawProductId(raw.getId());
        decision.setRunId(runId);

        if (decision.getStatus() == MatchStatus.PENDING_REVIEW) {
            log.info("Ambiguous match: raw product {} '{}' → canonical {} at {} (queued for review)",
                    raw.getId(), raw.getTitle(), decision.getCanonicalProductId(), decision.getMatchConfidence());
        }
        return catalogStore.insertMatch(decision);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    List<CanonicalProduct> candidatePool(MatchContext context) {
        Map<Long, CanonicalProduct> pool = new LinkedHashMap<>();

        Long confirmed = context.confirmedCanonicalId();
        if (confirmed != null) {
            catalogStore.findCanonical(confirmed).ifPresent(c -> pool.put(c.getId(), c));
        }
        NormalizedIdentity identity = context.identity();
        for (CanonicalProduct c : catalogStore.findCanonicalsByEan(identity.ean())) {
            pool.putIfAbsent(c.getId(), c);
        }
        for (CanonicalProduct c : catalogStore.findCanonicalsByBrandAndCategory(identity.brand(), identity.category())) {
            pool.putIfAbsent(c.getId(), c);
        }

        pool.keySet().removeAll(context.rejectedCanonicalIds());
        return new ArrayList<>(pool.values());
    }

    private ProductMatch decide(MatchContext context, List<CanonicalProduct> pool) {
        if (pool.isEmpty()) return null;
        DiscountPipelineProperties.Matching matching = properties.getMatching();

        for (SimilarityStrategy strategy : strategies) {
            Scored best = best(strategy, context, pool);
            if (best == null) continue;

            if (strategy.exact()) {
                if (best.confidence() < 1.0) continue;
                MatchStatus status = ManualConfirmationSimilarity.METHOD.equals(strategy.method())
                        ? MatchStatus.MANUAL_CONFIRMED
                        : MatchStatus.AUTO_ACCEPTED;
                return toMatch(best, strategy.method(), status);
            }

            if (best.confidence() >= matching.getAutoAcceptThreshold()) {
                return toMatch(best, strategy.method(), MatchStatus.AUTO_ACCEPTED);
            }
            if (best.confidence() >= matching.getReviewThreshold()) {
                return toMatch(best, strategy.method(), MatchStatus.PENDING_REVIEW);
            }
        }
        return null;
    }

    private Scored best(SimilarityStrategy strategy, MatchContext context, List<CanonicalProduct> pool) {
        List<Scored> top = new ArrayList<>();
        double bestConfidence = 0.0;
        for (CanonicalProduct candidate : pool) {
            double confidence = strategy.similarity(context, candidate);
            if (confidence <= 0.0) continue;
            if (confidence > bestConfidence) {
                bestConfidence = confidence;
                top.clear();
            }
            if (confidence == bestConfidence) {
                top.add(new Scored(candidate, confidence));
            }
        }
        if (top.isEmpty()) return null;
        if (top.size() == 1) return top.get(0);

        Map<Long, Integer> depth = catalogStore.historyDepth(top.stream().map(s -> s.candidate().getId()).toList());
        return top.stream()
                .min(Comparator.<Scored>comparingInt(s -> -depth.getOrDefault(s.candidate().getId(), 0))
                        .thenComparingLong(s -> s.candidate().getId()))
                .orElseThrow();
    }

    private ProductMatch toMatch(Scored scored, String method, MatchStatus status) {
        return ProductMatch.builder()
                .canonicalProductId(scored.candidate().getId())
                .matchConfidence(Math.min(1.0, scored.confidence()))
                .matchMethod(method)
                .status(status)
                .build();
    }

    private record Scored(CanonicalProduct candidate, double confidence) {}
}
