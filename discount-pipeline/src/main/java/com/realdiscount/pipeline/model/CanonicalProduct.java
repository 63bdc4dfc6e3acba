package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Retailer-independent product identity. Created by the matcher only and never changed afterwards.
 */
@Data
@Builder
public class CanonicalProduct {

    private Long id;
    private String canonicalName;
    private String brandNorm;
    /** Size in the canonical unit (g, ml or un); null when the listing size could not be parsed */
    private Double sizeValue;
    private String sizeUnit;
    private String categoryNorm;
    private String ean;
    private Instant createdAt;
}
