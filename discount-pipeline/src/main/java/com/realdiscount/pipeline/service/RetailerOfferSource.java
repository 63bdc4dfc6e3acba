package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.RawOffer;

import java.util.List;

/**
 * Delivers the current offers of one retailer.
 *
 * Implementations throw {@link SourceException} when the retailer cannot be read; an empty list
 * is also treated as a failure by the pipeline.
 */
public interface RetailerOfferSource {

    List<RawOffer> fetchOffers(DiscountPipelineProperties.RetailerSource retailer);
}
