package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

/**
 * Query filter for the evaluation surface. Null fields do not filter.
 */
@Data
@Builder
public class DealFilter {

    @Builder.Default
    private double minScore = 0.0;
    private DiscountLabel label;
    private String retailer;
    /** Case-insensitive substring of the normalized brand */
    private String brand;
    private Double minVisibleDiscount;
    /** Only rows priced below the cross-store median (negative delta) */
    private boolean crossStorePositiveOnly;
    private Integer limit;
}
