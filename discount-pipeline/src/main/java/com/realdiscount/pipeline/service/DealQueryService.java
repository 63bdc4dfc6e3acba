package com.realdiscount.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.DealFilter;
import com.realdiscount.pipeline.model.DealView;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the evaluation store.
 *
 * Every raw product contributes the evaluation of its latest snapshot under the current scoring
 * version. Rows carry the decoded rule trace and a plain-language explanation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DealQueryService {

    private static final TypeReference<LinkedHashMap<String, Object>> TRACE_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final DiscountPipelineProperties properties;
    private final DiscountExplainer explainer;
    private final PipelineRunTracker runTracker;
    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException on a min score outside [0, 1] or a non-positive limit
     */
    public List<DealView> findDeals(DealFilter filter) {
        if (filter.getMinScore() < 0.0 || filter.getMinScore() > 1.0) {
            throw new IllegalArgumentException("min_score must be between 0 and 1");
        }
        if (filter.getMinVisibleDiscount() != null
                && (filter.getMinVisibleDiscount() < 0.0 || filter.getMinVisibleDiscount() > 1.0)) {
            throw new IllegalArgumentException("min_visible_discount must be between 0 and 1");
        }
        DiscountPipelineProperties.Query query = properties.getQuery();
        int limit = filter.getLimit() == null ? query.getDefaultLimit() : filter.getLimit();
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return query(filter, Math.min(limit, query.getMaxResults()));
    }

    /** Latest evaluation per listing, newest first, without filters. */
    public List<DealView> latestEvaluations(int limit) {
        return query(DealFilter.builder().build(), limit);
    }

    public Optional<PipelineRun> latestRun() {
        return runTracker.latestRun();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<DealView> query(DealFilter filter, int limit) {
        StringBuilder sql = new StringBuilder("""
            SELECT
                de.id, de.score, de.label, de.discount_pct, de.hist_delta_pct, de.cross_store_delta_pct,
                de.anchor_anomaly_flag, de.rule_trace, de.scoring_version, de.created_at,
                r.name AS retailer, pc.canonical_name, pc.brand_norm, pr.product_url,
                ps.price_current, ps.price_list, ps.scraped_at, pm.status AS match_status
            FROM discount_evaluations de
            JOIN price_snapshots ps ON ps.id = de.snapshot_id
            JOIN products_raw pr ON pr.id = ps.product_raw_id
            JOIN retailers r ON r.id = de.retailer_id
            JOIN products_canonical pc ON pc.id = de.product_canonical_id
            LEFT JOIN product_matches pm
                ON pm.product_raw_id = pr.id AND pm.superseded_at IS NULL AND pm.status <> 'REJECTED'
            WHERE de.scoring_version = ?
              AND ps.scraped_at = (
                  SELECT MAX(ps2.scraped_at) FROM price_snapshots ps2 WHERE ps2.product_raw_id = ps.product_raw_id
              )
              AND de.score >= ?
            """);
        List<Object> params = new ArrayList<>();
        params.add(properties.getScoring().getVersion());
        params.add(filter.getMinScore());

        if (filter.getLabel() != null) {
            sql.append(" AND de.label = ?");
            params.add(filter.getLabel().name());
        }
        if (filter.getRetailer() != null && !filter.getRetailer().isBlank()) {
            sql.append(" AND LOWER(r.name) = LOWER(?)");
            params.add(filter.getRetailer().trim());
        }
        if (filter.getBrand() != null && !filter.getBrand().isBlank()) {
            sql.append(" AND LOWER(pc.brand_norm) LIKE ?");
            params.add("%" + filter.getBrand().trim().toLowerCase(Locale.ROOT) + "%");
        }
        if (filter.getMinVisibleDiscount() != null) {
            sql.append(" AND de.discount_pct IS NOT NULL AND de.discount_pct >= ?");
            params.add(filter.getMinVisibleDiscount());
        }
        if (filter.isCrossStorePositiveOnly()) {
            sql.append(" AND de.cross_store_delta_pct IS NOT NULL AND de.cross_store_delta_pct < 0");
        }
        sql.append(" ORDER BY de.created_at DESC, de.id DESC LIMIT ?");
        params.add(limit);

        List<DealView> deals = jdbcTemplate.query(sql.toString(), (rs, i) -> toDeal(rs), params.toArray());
        deals.forEach(d -> d.setExplanation(explainer.explain(d)));
        return deals;
    }

    private DealView toDeal(ResultSet rs) throws SQLException {
        String matchStatus = rs.getString("match_status");
        return DealView.builder()
                .evaluationId(rs.getLong("id"))
                .retailer(rs.getString("retailer"))
                .canonicalName(rs.getString("canonical_name"))
                .brand(rs.getString("brand_norm"))
                .productUrl(rs.getString("product_url"))
                .priceCurrent(rs.getDouble("price_current"))
                .priceList(nullableDouble(rs, "price_list"))
                .score(rs.getDouble("score"))
                .label(DiscountLabel.valueOf(rs.getString("label")))
                .discountPct(nullableDouble(rs, "discount_pct"))
                .histDeltaPct(nullableDouble(rs, "hist_delta_pct"))
                .crossStoreDeltaPct(nullableDouble(rs, "cross_store_delta_pct"))
                .anchorAnomalyFlag(rs.getBoolean("anchor_anomaly_flag"))
                .matchStatus(matchStatus == null ? null : MatchStatus.valueOf(matchStatus))
                .ruleTrace(decodeTrace(rs.getString("rule_trace")))
                .scoringVersion(rs.getString("scoring_version"))
                .scrapedAt(toInstant(rs.getTimestamp("scraped_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private Map<String, Object> decodeTrace(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, TRACE_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable rule trace: {}", e.getMessage());
            return Map.of();
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
