package com.realdiscount.pipeline.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks each pipeline execution for provenance. Stored in pipeline_runs / pipeline_run_sources.
 *
 * finishedAt and status stay null while the run is in flight and are set once, when it ends.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID
    private Instant startedAt;
    private Instant finishedAt;
    private RunStatus status;
    private int totalOffers;
    private int totalSnapshots;
    private int totalDuplicates;
    private int totalEvaluations;
    private int totalOfferErrors;
    private String errorMessage;    // null on success

    @Builder.Default
    private List<RetailerSourceResult> sources = new ArrayList<>();

    public boolean hasFailedSource() {
        return sources.stream().anyMatch(s -> s.getSource() == SourceKind.ERROR);
    }

    public boolean isFinished() {
        return finishedAt != null;
    }
}
