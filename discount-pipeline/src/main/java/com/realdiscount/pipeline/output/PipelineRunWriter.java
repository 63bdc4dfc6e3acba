package com.realdiscount.pipeline.output;

import com.realdiscount.pipeline.model.PipelineRun;
import com.realdiscount.pipeline.model.RetailerSourceResult;
import com.realdiscount.pipeline.model.RunStatus;
import com.realdiscount.pipeline.model.SourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Run provenance: one pipeline_runs row plus one pipeline_run_sources row per retailer.
 * A run is written with all of its source rows or not at all.
 */
@Component
@Slf4j
public class PipelineRunWriter {

    private static final int MAX_TEXT = 4000;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public PipelineRunWriter(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public void write(PipelineRun run) {
        transactionTemplate.executeWithoutResult(status -> insert(run));
        log.info("Run {} recorded: {} ({} sources)", run.getRunId(), run.getStatus(), run.getSources().size());
    }

    private void insert(PipelineRun run) {
        jdbcTemplate.update("""
                INSERT INTO pipeline_runs
                (run_id, started_at, finished_at, status, total_offers, total_snapshots, total_duplicates,
                 total_evaluations, total_offer_errors, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                run.getRunId(),
                Timestamp.from(run.getStartedAt()),
                Timestamp.from(run.getFinishedAt()),
                run.getStatus().name(),
                run.getTotalOffers(),
                run.getTotalSnapshots(),
                run.getTotalDuplicates(),
                run.getTotalEvaluations(),
                run.getTotalOfferErrors(),
                truncate(run.getErrorMessage()));

        for (RetailerSourceResult source : run.getSources()) {
            jdbcTemplate.update("""
                    INSERT INTO pipeline_run_sources (run_id, retailer_name, source_kind, offer_count, error_text)
                    VALUES (?, ?, ?, ?, ?)
                    """,
                    run.getRunId(),
                    source.getRetailerName(),
                    source.getSource().code(),
                    source.getOfferCount(),
                    truncate(source.getErrorText()));
        }
    }

    /** Most recently started run, read fresh from the database. */
    public Optional<PipelineRun> findLatest() {
        Optional<PipelineRun> latest = jdbcTemplate.query(
                "SELECT * FROM pipeline_runs ORDER BY started_at DESC LIMIT 1", RUN_MAPPER)
                .stream().findFirst();
        latest.ifPresent(run -> run.setSources(findSources(run.getRunId())));
        return latest;
    }

    public Optional<PipelineRun> find(String runId) {
        Optional<PipelineRun> run = jdbcTemplate.query("SELECT * FROM pipeline_runs WHERE run_id = ?", RUN_MAPPER, runId)
                .stream().findFirst();
        run.ifPresent(r -> r.setSources(findSources(r.getRunId())));
        return run;
    }

    private List<RetailerSourceResult> findSources(String runId) {
        return jdbcTemplate.query("""
                SELECT retailer_name, source_kind, offer_count, error_text
                FROM pipeline_run_sources WHERE run_id = ? ORDER BY retailer_name
                """, (rs, i) -> RetailerSourceResult.builder()
                        .retailerName(rs.getString("retailer_name"))
                        .source(SourceKind.fromCode(rs.getString("source_kind")))
                        .offerCount(rs.getInt("offer_count"))
                        .errorText(rs.getString("error_text"))
                        .build(),
                runId);
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_TEXT) return text;
        return text.substring(0, MAX_TEXT);
    }

    private static final RowMapper<PipelineRun> RUN_MAPPER = (rs, i) -> PipelineRun.builder()
            .runId(rs.getString("run_id"))
            .startedAt(CatalogStore.instant(rs, "started_at"))
            .finishedAt(CatalogStore.instant(rs, "finished_at"))
            .status(RunStatus.valueOf(rs.getString("status")))
            .totalOffers(rs.getInt("total_offers"))
            .totalSnapshots(rs.getInt("total_snapshots"))
            .totalDuplicates(rs.getInt("total_duplicates"))
            .totalEvaluations(rs.getInt("total_evaluations"))
            .totalOfferErrors(rs.getInt("total_offer_errors"))
            .errorMessage(rs.getString("error_message"))
            .build();
}
