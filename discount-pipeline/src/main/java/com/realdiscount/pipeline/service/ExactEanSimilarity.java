package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.CanonicalProduct;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Same barcode, same product.
 */
@Component
@Order(2)
public class ExactEanSimilarity implements SimilarityStrategy {

    public static final String METHOD = "exact-ean";

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
        String ean = context.identity().ean();
        return ean != null && ean.equals(candidate.getEan()) ? 1.0 : 0.0;
    }
}
