package com.realdiscount.pipeline.output;

import com.realdiscount.pipeline.model.DiscountEvaluation;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.service.ConstraintViolationException;
import com.realdiscount.pipeline.service.MissingReferenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists discount evaluations. Rows are immutable: a second evaluation of the same snapshot
 * under the same scoring version returns the stored row instead of overwriting it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EvaluationRecorder {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Result of a record call: the evaluation on record and whether this call created it.
     */
    public record RecordResult(DiscountEvaluation evaluation, boolean inserted) {}

    public RecordResult record(DiscountEvaluation evaluation) {
        requireReference("products_canonical", evaluation.getCanonicalProductId());
        requireReference("retailers", evaluation.getRetailerId());
        requireReference("price_snapshots", evaluation.getSnapshotId());

        Optional<DiscountEvaluation> existing = find(evaluation.getSnapshotId(), evaluation.getScoringVersion());
        if (existing.isPresent()) {
            log.debug("Snapshot {} already evaluated under {}", evaluation.getSnapshotId(), evaluation.getScoringVersion());
            return new RecordResult(existing.get(), false);
        }

        Instant createdAt = evaluation.getCreatedAt() != null ? evaluation.getCreatedAt() : Instant.now();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement("""
                        INSERT INTO discount_evaluations
                        (product_canonical_id, retailer_id, snapshot_id, run_id, score, label, discount_pct,
                         hist_delta_pct, cross_store_delta_pct, anchor_anomaly_flag, rule_trace, scoring_version,
                         created_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """, new String[]{"id"});
                ps.setLong(1, evaluation.getCanonicalProductId());
                ps.setLong(2, evaluation.getRetailerId());
                ps.setLong(3, evaluation.getSnapshotId());
                ps.setString(4, evaluation.getRunId());
                ps.setDouble(5, evaluation.getScore());
                ps.setString(6, evaluation.getLabel().name());
                CatalogStore.setNullableDouble(ps, 7, evaluation.getDiscountPct());
                CatalogStore.setNullableDouble(ps, 8, evaluation.getHistDeltaPct());
                CatalogStore.setNullableDouble(ps, 9, evaluation.getCrossStoreDeltaPct());
                ps.setBoolean(10, evaluation.isAnchorAnomalyFlag());
                ps.setString(11, evaluation.getRuleTrace());
                ps.setString(12, evaluation.getScoringVersion());
                ps.setTimestamp(13, Timestamp.from(createdAt));
                return ps;
            }, keyHolder);
        } catch (DataIntegrityViolationException e) {
            log.error("Evaluation of snapshot {} rejected by schema: {}", evaluation.getSnapshotId(), e.getMessage());
            throw new ConstraintViolationException(
                    "discount_evaluations rejected snapshot " + evaluation.getSnapshotId() + ": " + e.getMessage(), e);
        }

        evaluation.setId(Objects.requireNonNull(keyHolder.getKey(), "no generated key").longValue());
        evaluation.setCreatedAt(createdAt);
        return new RecordResult(evaluation, true);
    }

    public Optional<DiscountEvaluation> find(long snapshotId, String scoringVersion) {
        return jdbcTemplate.query("""
                SELECT * FROM discount_evaluations WHERE snapshot_id = ? AND scoring_version = ?
                """, EVALUATION_MAPPER, snapshotId, scoringVersion).stream().findFirst();
    }

    public List<DiscountEvaluation> findByRun(String runId) {
        return jdbcTemplate.query("SELECT * FROM discount_evaluations WHERE run_id = ? ORDER BY id",
                EVALUATION_MAPPER, runId);
    }

    /** Most recent evaluations across all products, newest first. */
    public List<DiscountEvaluation> latest(int limit) {
        return jdbcTemplate.query("SELECT * FROM discount_evaluations ORDER BY created_at DESC, id DESC LIMIT ?",
                EVALUATION_MAPPER, limit);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void requireReference(String table, Long id) {
        if (id == null) {
            throw new MissingReferenceException("Evaluation references no row in " + table);
        }
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table + " WHERE id = ?", Integer.class, id);
        if (count == null || count == 0) {
            throw new MissingReferenceException("Evaluation references missing " + table + " row " + id);
        }
    }

    private static final RowMapper<DiscountEvaluation> EVALUATION_MAPPER = (rs, i) -> DiscountEvaluation.builder()
            .id(rs.getLong("id"))
            .canonicalProductId(rs.getLong("product_canonical_id"))
            .retailerId(rs.getLong("retailer_id"))
            .snapshotId(rs.getLong("snapshot_id"))
            .runId(rs.getString("run_id"))
            .score(rs.getDouble("score"))
            .label(DiscountLabel.valueOf(rs.getString("label")))
            .discountPct(CatalogStore.nullableDouble(rs, "discount_pct"))
            .histDeltaPct(CatalogStore.nullableDouble(rs, "hist_delta_pct"))
            .crossStoreDeltaPct(CatalogStore.nullableDouble(rs, "cross_store_delta_pct"))
            .anchorAnomalyFlag(rs.getBoolean("anchor_anomaly_flag"))
            .ruleTrace(rs.getString("rule_trace"))
            .scoringVersion(rs.getString("scoring_version"))
            .createdAt(CatalogStore.instant(rs, "created_at"))
            .build();
}
