package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A retailer-local listing. Unique on (retailerId, retailerProductId) and never deleted.
 */
@Data
@Builder
public class RawProduct {

    private Long id;
    private Long retailerId;
    private String retailerProductId;
    private String productUrl;
    private String title;
    private String brandRaw;
    private String sizeRaw;
    private String categoryRaw;
    private String imageUrl;
    private String ean;
    private Instant firstSeenAt;
    private Instant lastSeenAt;
}
