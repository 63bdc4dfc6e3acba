package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.CanonicalProduct;
import com.realdiscount.pipeline.model.NormalizedIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name similarity scaled by a size factor.
 *
 * name   = w · Dice(tokens) + (1 - w) · Dice(character bigrams)
 * factor = 1.0 same size (within tolerance) | unknown factor when one side has no size | mismatch factor
 *
 * The size factor is multiplicative so "same cream, different bottle" cannot reach the
 * auto-accept band on name alone. Two different EANs are two different products and score 0.
 *
 * The stored match_method is the configured matching.method-version (fuzzy-token-v1), so a
 * change to the formula or its weights ships under a new name.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class FuzzyTokenSimilarity implements SimilarityStrategy {

    private final IdentityNormalizer normalizer;
    private final DiscountPipelineProperties properties;

    @Override
    public String method() {
        return properties.getMatching().getMethodVersion();
    }

    @Override
    public boolean exact() {
        return false;
    }

    @Override
    public double similarity(MatchContext context, CanonicalProduct candidate) {
        NormalizedIdentity identity = context.identity();
        if (conflictingEans(identity.ean(), candidate.getEan())) return 0.0;
        double name = nameSimilarity(identity.name(), candidate.getCanonicalName());
        double size = sizeFactor(identity.sizeValue(), identity.sizeUnit(),
                candidate.getSizeValue(), candidate.getSizeUnit());
        return Math.round(name * size * 10_000d) / 10_000d;
    }

    double nameSimilarity(String left, String right) {
        Set<String> a = normalizer.nameTokens(left);
        Set<String> b = normalizer.nameTokens(right);
        if (a.isEmpty() && b.isEmpty()) return 1.0;
        if (a.isEmpty() || b.isEmpty()) return 0.0;

        double tokenWeight = properties.getMatching().getTokenWeight();
        return tokenWeight * tokenDice(a, b) + (1.0 - tokenWeight) * bigramDice(left, right);
    }

    double sizeFactor(Double leftValue, String leftUnit, Double rightValue, String rightUnit) {
        DiscountPipelineProperties.Matching matching = properties.getMatching();
        boolean leftKnown = leftValue != null && leftUnit != null;
        boolean rightKnown = rightValue != null && rightUnit != null;
        if (!leftKnown && !rightKnown) return 1.0;
        if (!leftKnown || !rightKnown) return matching.getSizeUnknownFactor();
        if (!leftUnit.equals(rightUnit)) return matching.getSizeMismatchFactor();

        double larger = Math.max(Math.abs(leftValue), Math.abs(rightValue));
        if (larger == 0.0) return 1.0;
        double relativeDiff = Math.abs(leftValue - rightValue) / larger;
        return relativeDiff <= matching.getSizeTolerance() ? 1.0 : matching.getSizeMismatchFactor();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static boolean conflictingEans(String left, String right) {
        return left != null && !left.isBlank() && right != null && !right.isBlank() && !left.equals(right);
    }

    private double tokenDice(Set<String> a, Set<String> b) {
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) shared++;
        }
        return 2.0 * shared / (a.size() + b.size());
    }

    private double bigramDice(String left, String right) {
        Map<String, Integer> a = bigrams(left.replace(" ", ""));
        Map<String, Integer> b = bigrams(right.replace(" ", ""));
        int totalA = a.values().stream().mapToInt(Integer::intValue).sum();
        int totalB = b.values().stream().mapToInt(Integer::intValue).sum();
        if (totalA + totalB == 0) return left.equals(right) ? 1.0 : 0.0;

        int shared = 0;
        for (Map.Entry<String, Integer> e : a.entrySet()) {
            shared += Math.min(e.getValue(), b.getOrDefault(e.getKey(), 0));
        }
        return 2.0 * shared / (totalA + totalB);
    }

    private Map<String, Integer> bigrams(String text) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i + 1 < text.length(); i++) {
            counts.merge(text.substring(i, i + 2), 1, Integer::sum);
        }
        return counts;
    }
}
