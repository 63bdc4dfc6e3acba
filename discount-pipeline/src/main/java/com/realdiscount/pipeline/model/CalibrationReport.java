package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agreement between human labels and the model's latest labels.
 *
 * Human positive = REAL; model positive = REAL or LIKELY_REAL.
 */
@Data
@Builder
public class CalibrationReport {

    private String scoringVersion;
    private int totalLabeled;
    private int matched;
    private int missing;
    private int exactAgreement;
    private int truePositives;
    private int falsePositives;
    private int falseNegatives;
    private int trueNegatives;
    private double precision;
    private double recall;
    private double accuracy;

    /** "HUMAN->MODEL" → count */
    @Builder.Default
    private Map<String, Integer> confusion = new LinkedHashMap<>();

    @Builder.Default
    private List<String> mismatches = new ArrayList<>();

    /** Ranked best-first; empty unless a sweep was requested */
    @Builder.Default
    private List<ThresholdResult> sweep = new ArrayList<>();

    private Double recommendedThreshold;

    public record ThresholdResult(double threshold, double precision, double recall, double accuracy,
                                  int truePositives, int falsePositives) {}
}
