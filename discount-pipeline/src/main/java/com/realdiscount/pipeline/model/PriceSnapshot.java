package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One price observation of a raw product. Append-only, unique on (rawProductId, scrapedAt).
 */
@Data
@Builder
public class PriceSnapshot {

    private Long id;
    private Long rawProductId;
    private Instant scrapedAt;
    private double priceCurrent;
    private Double priceList;
    private String currency;
    private String promoText;
    private Boolean inStock;
    /** SHA-256 over the price content, used to drop repeated observations */
    private String sourceHash;
}
