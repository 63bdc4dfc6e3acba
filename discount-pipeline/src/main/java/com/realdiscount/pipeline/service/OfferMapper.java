package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.RawOffer;
import com.realdiscount.pipeline.model.RetailerOfferPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps feed payloads to the RawOffer domain model.
 *
 * Records without an id, URL, title or a positive current price cannot be tracked and are
 * dropped with a warning. A missing or unparsable scraped_at falls back to the fetch time.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OfferMapper {

    private final IdentityNormalizer normalizer;
    private final DiscountPipelineProperties properties;

    public List<RawOffer> mapAll(List<RetailerOfferPayload> payloads,
                                 DiscountPipelineProperties.RetailerSource retailer,
                                 Instant fetchedAt) {
        List<RawOffer> offers = new ArrayList<>();
        int dropped = 0;
        for (RetailerOfferPayload payload : payloads) {
            RawOffer offer = map(payload, retailer, fetchedAt);
            if (offer == null) {
                dropped++;
            } else {
                offers.add(offer);
            }
        }
        if (dropped > 0) {
            log.warn("{}: dropped {} of {} feed records", retailer.getName(), dropped, payloads.size());
        }
        return offers;
    }

    /**
     * @return the mapped offer, or null when the record cannot be tracked
     */
    public RawOffer map(RetailerOfferPayload raw, DiscountPipelineProperties.RetailerSource retailer, Instant fetchedAt) {
        if (isBlank(raw.getRetailerProductId()) || isBlank(raw.getProductUrl()) || isBlank(raw.getTitle())) {
            log.warn("{}: record missing id, url or title: {}", retailer.getName(), raw.getRetailerProductId());
            return null;
        }
        if (raw.getPriceCurrent() == null || raw.getPriceCurrent() <= 0) {
            log.warn("{}: record {} has no positive current price", retailer.getName(), raw.getRetailerProductId());
            return null;
        }

        Double priceList = raw.getPriceList() != null && raw.getPriceList() > 0 ? raw.getPriceList() : null;
        String currency = isBlank(raw.getCurrency())
                ? properties.getSource().getDefaultCurrency()
                : raw.getCurrency().trim().toUpperCase(Locale.ROOT);

        return RawOffer.builder()
                .retailerName(retailer.getName())
                .retailerDomain(retailer.getDomain())
                .retailerProductId(raw.getRetailerProductId().trim())
                .productUrl(raw.getProductUrl().trim())
                .title(raw.getTitle().trim())
                .brandRaw(emptyToNull(raw.getBrandRaw()))
                .sizeRaw(emptyToNull(raw.getSizeRaw()))
                .categoryRaw(emptyToNull(raw.getCategoryRaw()))
                .imageUrl(emptyToNull(raw.getImageUrl()))
                .ean(normalizer.normalizeEan(raw.getEan()))
                .priceCurrent(raw.getPriceCurrent())
                .priceList(priceList)
                .currency(currency)
                .promoText(emptyToNull(raw.getPromoText()))
                .inStock(raw.getInStock())
                .scrapedAt(parseScrapedAt(raw.getScrapedAt(), fetchedAt))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Instant parseScrapedAt(String value, Instant fallback) {
        if (isBlank(value)) return fallback;
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value.trim()).toInstant();
            } catch (DateTimeParseException e2) {
                log.warn("Could not parse scraped_at '{}', using fetch time", value);
                return fallback;
            }
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String emptyToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
