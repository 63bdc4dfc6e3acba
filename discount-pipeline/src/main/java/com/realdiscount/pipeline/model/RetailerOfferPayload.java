package com.realdiscount.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the JSON offer records emitted by the scraping layer.
 * Kept separate from the domain model to isolate feed coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetailerOfferPayload {

    @JsonProperty("retailer_product_id")
    private String retailerProductId;

    @JsonProperty("product_url")
    private String productUrl;

    private String title;

    @JsonProperty("brand_raw")
    private String brandRaw;

    @JsonProperty("size_raw")
    private String sizeRaw;

    @JsonProperty("category_raw")
    private String categoryRaw;

    @JsonProperty("image_url")
    private String imageUrl;

    private String ean;

    @JsonProperty("price_current")
    private Double priceCurrent;

    @JsonProperty("price_list")
    private Double priceList;

    private String currency;

    @JsonProperty("promo_text")
    private String promoText;

    @JsonProperty("in_stock")
    private Boolean inStock;

    /** ISO-8601 instant, e.g. 2024-05-01T10:15:00Z */
    @JsonProperty("scraped_at")
    private String scrapedAt;
}
