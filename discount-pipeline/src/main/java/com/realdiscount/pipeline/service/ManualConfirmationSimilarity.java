package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.CanonicalProduct;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * A human-confirmed link always wins and is carried forward unchanged.
 */
@Component
@Order(1)
public class ManualConfirmationSimilarity implements SimilarityStrategy {

    public static final String METHOD = "manual";

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public boolean exact() {
        return true;
    }

    @Override
    public double similarity(MatchContext context, CanonicalProduct candidate) {
        Long confirmed = context.confirmedCanonicalId();
        return confirmed != null && confirmed.equals(candidate.getId()) ? 1.0 : 0.0;
    }
}
