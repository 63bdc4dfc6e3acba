package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.PipelineRun;
import com.realdiscount.pipeline.model.RetailerSourceResult;
import com.realdiscount.pipeline.model.RunStatus;
import com.realdiscount.pipeline.model.SourceKind;
import com.realdiscount.pipeline.output.PipelineRunWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Lifecycle of a pipeline run: start, per-retailer provenance, and a single completion.
 *
 * A run is FAILED when it aborted or when any retailer errored or delivered no offers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineRunTracker {

    static final String NO_OFFERS = "Source returned no offers";

    private final PipelineRunWriter runWriter;

    public PipelineRun start() {
        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(Instant.now())
                .build();
        log.info("Pipeline run {} started", run.getRunId());
        return run;
    }

    /**
     * Records one retailer's outcome. A null error with zero offers is still an error.
     */
    public RetailerSourceResult recordSource(PipelineRun run, String retailerName, int offerCount, String error) {
        RetailerSourceResult result;
        if (error != null) {
            result = RetailerSourceResult.builder()
                    .retailerName(retailerName).source(SourceKind.ERROR).offerCount(0).errorText(error).build();
        } else if (offerCount == 0) {
            result = RetailerSourceResult.builder()
                    .retailerName(retailerName).source(SourceKind.ERROR).offerCount(0).errorText(NO_OFFERS).build();
        } else {
            result = RetailerSourceResult.builder()
                    .retailerName(retailerName).source(SourceKind.LIVE).offerCount(offerCount).build();
        }
        run.getSources().add(result);
        return result;
    }

    /**
     * Closes the run and persists it. Fails when called twice for the same run.
     *
     * @param error what aborted the run, or null
     */
    public PipelineRun complete(PipelineRun run, Throwable error) {
        if (run.isFinished()) {
            throw new IllegalStateException("Pipeline run " + run.getRunId() + " already completed");
        }
        run.setFinishedAt(Instant.now());

        if (error != null) {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        } else if (run.hasFailedSource()) {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage("Source failure: " + run.getSources().stream()
                    .filter(s -> s.getSource() == SourceKind.ERROR)
                    .map(s -> s.getRetailerName() + " (" + s.getErrorText() + ")")
                    .collect(Collectors.joining(", ")));
        } else {
            run.setStatus(RunStatus.SUCCESS);
        }

        try {
            runWriter.write(run);
        } catch (Exception e) {
            log.error("Failed to persist pipeline run {}: {}", run.getRunId(), e.getMessage(), e);
        }

        log.info("Pipeline run {} finished {}: offers={} snapshots={} duplicates={} evaluations={} offerErrors={}",
                run.getRunId(), run.getStatus(), run.getTotalOffers(), run.getTotalSnapshots(),
                run.getTotalDuplicates(), run.getTotalEvaluations(), run.getTotalOfferErrors());
        return run;
    }

    /** Most recently started run, always read from the store. */
    public Optional<PipelineRun> latestRun() {
        return runWriter.findLatest();
    }
}
