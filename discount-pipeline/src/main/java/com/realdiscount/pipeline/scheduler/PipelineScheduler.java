package com.realdiscount.pipeline.scheduler;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.PipelineRun;
import com.realdiscount.pipeline.output.SchemaWriter;
import com.realdiscount.pipeline.service.DiscountPipelineService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Daily pipeline runs, plus an optional run at startup.
 *
 * Default schedule: 06:00 UTC, after the overnight scrape of the retailer feeds.
 * Override with the PIPELINE_CRON env var or discount-pipeline.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final DiscountPipelineService pipelineService;
    private final SchemaWriter schemaWriter;
    private final DiscountPipelineProperties properties;

    /**
     * Creates the schema, then runs once when RUN_ON_STARTUP=true.
     *
     * @throws IllegalStateException when the schema cannot be created; nothing can be stored without it
     */
    @PostConstruct
    public void onStartup() {
        try {
            schemaWriter.ensureSchema();
        } catch (RuntimeException e) {
            log.error("Could not initialise discount schema: {}", e.getMessage(), e);
            throw new IllegalStateException("Discount schema initialisation failed", e);
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running the pipeline once");
            runAndReport("Startup");
        } else {
            log.info("Pipeline ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${discount-pipeline.scheduling.cron:0 0 6 * * ?}", zone = "UTC")
    public void scheduledRun() {
        runAndReport("Scheduled");
    }

    Optional<PipelineRun> runAndReport(String trigger) {
        try {
            Optional<PipelineRun> run = pipelineService.runOnce();
            if (run.isEmpty()) {
                log.warn("{} pipeline run skipped: another run is in progress", trigger);
            } else {
                log.info("{} pipeline run {} finished {}", trigger, run.get().getRunId(), run.get().getStatus());
            }
            return run;
        } catch (RuntimeException e) {
            log.error("{} pipeline run failed: {}", trigger, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
