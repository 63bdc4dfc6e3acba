package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Retailer {

    private Long id;
    private String name;
    /** Unique natural key, e.g. "cruzverde.cl" */
    private String domain;
    private boolean active;
}
