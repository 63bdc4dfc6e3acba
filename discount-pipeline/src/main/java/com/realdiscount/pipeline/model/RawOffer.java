package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One offer as delivered by the scraping layer for a single retailer, before identity resolution.
 *
 * Prices are in the retailer's currency units (CLP has no minor unit).
 * priceList is the advertised "was"/original price and may be null.
 */
@Data
@Builder
public class RawOffer {

    // ── Retailer ────────────────────────────────────────────────────────────
    private String retailerName;
    private String retailerDomain;

    // ── Listing ─────────────────────────────────────────────────────────────
    private String retailerProductId;
    private String productUrl;
    private String title;
    private String brandRaw;
    private String sizeRaw;
    private String categoryRaw;
    private String imageUrl;
    /** Barcode when the retailer exposes one */
    private String ean;

    // ── Price ───────────────────────────────────────────────────────────────
    private double priceCurrent;
    private Double priceList;
    private String currency;
    private String promoText;
    private Boolean inStock;

    /** When the offer was observed; part of the snapshot natural key */
    private Instant scrapedAt;
}
