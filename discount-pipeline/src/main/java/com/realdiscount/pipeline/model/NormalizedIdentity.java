package com.realdiscount.pipeline.model;

import java.util.Set;

/**
 * Comparable form of a listing's identity, produced by the normalizer.
 *
 * @param name     title without brand words and size expressions
 * @param tokens   significant name tokens
 * @param brand    alias-mapped brand, empty when unknown
 * @param sizeValue size in the canonical unit, null when unparsable
 * @param sizeUnit  g, ml or un; null when unparsable
 * @param category taxonomy slug, "other" when no rule matched
 * @param ean      digits-only barcode or null
 */
public record NormalizedIdentity(
        String name,
        Set<String> tokens,
        String brand,
        Double sizeValue,
        String sizeUnit,
        String category,
        String ean) {

    public boolean hasSize() {
        return sizeValue != null && sizeUnit != null;
    }
}
