package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

/**
 * Provenance of one retailer within a pipeline run.
 */
@Data
@Builder
public class RetailerSourceResult {

    private String retailerName;
    private SourceKind source;
    private int offerCount;
    /** Error text exactly as raised by the source; null for live sources */
    private String errorText;
}
