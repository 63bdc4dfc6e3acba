package com.realdiscount.pipeline.output;

import com.realdiscount.pipeline.model.CanonicalProduct;
import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.PendingMatchView;
import com.realdiscount.pipeline.model.ProductMatch;
import com.realdiscount.pipeline.model.RawOffer;
import com.realdiscount.pipeline.model.RawProduct;
import com.realdiscount.pipeline.model.Retailer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Retailers, raw listings, canonical products and the match edges between them.
 *
 * Upserts are select-then-write so the same statements run on H2 and PostgreSQL. Callers hold
 * the run transaction; nothing here commits on its own.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CatalogStore {

    private static final String ACTIVE_MATCH = "superseded_at IS NULL AND status <> 'REJECTED'";

    private final JdbcTemplate jdbcTemplate;

    // ── Retailers ────────────────────────────────────────────────────────────

    public Retailer upsertRetailer(String name, String domain) {
        List<Retailer> existing = jdbcTemplate.query(
                "SELECT id, name, domain, active FROM retailers WHERE domain = ?",
                RETAILER_MAPPER, domain);

        if (!existing.isEmpty()) {
            Retailer retailer = existing.get(0);
            if (!retailer.getName().equals(name)) {
                jdbcTemplate.update("UPDATE retailers SET name = ? WHERE id = ?", name, retailer.getId());
                retailer.setName(name);
            }
            return retailer;
        }

        long id = insert("INSERT INTO retailers (name, domain, active) VALUES (?, ?, TRUE)", ps -> {
            ps.setString(1, name);
            ps.setString(2, domain);
        });
        log.info("Registered retailer {} ({}) as id {}", name, domain, id);
        return Retailer.builder().id(id).name(name).domain(domain).active(true).build();
    }

    public Optional<Retailer> findRetailer(long retailerId) {
        return jdbcTemplate.query("SELECT id, name, domain, active FROM retailers WHERE id = ?",
                RETAILER_MAPPER, retailerId).stream().findFirst();
    }

    // ── Raw products ─────────────────────────────────────────────────────────

    /**
     * Creates the listing on first sighting; afterwards refreshes its descriptive fields and moves
     * last_seen_at forward. A barcode once seen is never blanked by a later feed that omits it.
     */
    public RawProduct upsertRawProduct(long retailerId, RawOffer offer) {
        List<RawProduct> existing = jdbcTemplate.query("""
                SELECT * FROM products_raw WHERE retailer_id = ? AND retailer_product_id = ?
                """, RAW_PRODUCT_MAPPER, retailerId, offer.getRetailerProductId());

        if (!existing.isEmpty()) {
            RawProduct raw = existing.get(0);
            Instant lastSeen = offer.getScrapedAt().isAfter(raw.getLastSeenAt())
                    ? offer.getScrapedAt() : raw.getLastSeenAt();
            String ean = offer.getEan() != null ? offer.getEan() : raw.getEan();

            jdbcTemplate.update("""
                    UPDATE products_raw
                    SET product_url = ?, title = ?, brand_raw = ?, size_raw = ?, category_raw = ?,
                        image_url = ?, ean = ?, last_seen_at = ?
                    WHERE id = ?
                    """,
                    offer.getProductUrl(), offer.getTitle(), offer.getBrandRaw(), offer.getSizeRaw(),
                    offer.getCategoryRaw(), offer.getImageUrl(), ean, Timestamp.from(lastSeen), raw.getId());

            raw.setProductUrl(offer.getProductUrl());
            raw.setTitle(offer.getTitle());
            raw.setBrandRaw(offer.getBrandRaw());
            raw.setSizeRaw(offer.getSizeRaw());
            raw.setCategoryRaw(offer.getCategoryRaw());
            raw.setImageUrl(offer.getImageUrl());
            raw.setEan(ean);
            raw.setLastSeenAt(lastSeen);
            return raw;
        }

        Timestamp seen = Timestamp.from(offer.getScrapedAt());
        long id = insert("""
                INSERT INTO products_raw
                (retailer_id, retailer_product_id, product_url, title, brand_raw, size_raw, category_raw,
                 image_url, ean, first_seen_at, last_seen_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """, ps -> {
            ps.setLong(1, retailerId);
            ps.setString(2, offer.getRetailerProductId());
            ps.setString(3, offer.getProductUrl());
            ps.setString(4, offer.getTitle());
            ps.setString(5, offer.getBrandRaw());
            ps.setString(6, offer.getSizeRaw());
            ps.setString(7, offer.getCategoryRaw());
            ps.setString(8, offer.getImageUrl());
            ps.setString(9, offer.getEan());
            ps.setTimestamp(10, seen);
            ps.setTimestamp(11, seen);
        });

        return RawProduct.builder()
                .id(id)
                .retailerId(retailerId)
                .retailerProductId(offer.getRetailerProductId())
                .productUrl(offer.getProductUrl())
                .title(offer.getTitle())
                .brandRaw(offer.getBrandRaw())
                .sizeRaw(offer.getSizeRaw())
                .categoryRaw(offer.getCategoryRaw())
                .imageUrl(offer.getImageUrl())
                .ean(offer.getEan())
                .firstSeenAt(offer.getScrapedAt())
                .lastSeenAt(offer.getScrapedAt())
                .build();
    }

    public Optional<RawProduct> findRawProduct(long rawProductId) {
        return jdbcTemplate.query("SELECT * FROM products_raw WHERE id = ?", RAW_PRODUCT_MAPPER, rawProductId)
                .stream().findFirst();
    }

    // ── Canonical products ───────────────────────────────────────────────────

    public CanonicalProduct insertCanonical(CanonicalProduct canonical) {
        Instant createdAt = canonical.getCreatedAt() != null ? canonical.getCreatedAt() : Instant.now();
        long id = insert("""
                INSERT INTO products_canonical
                (canonical_name, brand_norm, size_value, size_unit, category_norm, ean, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """, ps -> {
            ps.setString(1, canonical.getCanonicalName());
            ps.setString(2, canonical.getBrandNorm());
            setNullableDouble(ps, 3, canonical.getSizeValue());
            ps.setString(4, canonical.getSizeUnit());
            ps.setString(5, canonical.getCategoryNorm());
            ps.setString(6, canonical.getEan());
            ps.setTimestamp(7, Timestamp.from(createdAt));
        });
        canonical.setId(id);
        canonical.setCreatedAt(createdAt);
        return canonical;
    }

    public Optional<CanonicalProduct> findCanonical(long canonicalId) {
        return jdbcTemplate.query("SELECT * FROM products_canonical WHERE id = ?", CANONICAL_MAPPER, canonicalId)
                .stream().findFirst();
    }

    public List<CanonicalProduct> findCanonicalsByEan(String ean) {
        if (ean == null) return List.of();
        return jdbcTemplate.query("SELECT * FROM products_canonical WHERE ean = ? ORDER BY id",
                CANONICAL_MAPPER, ean);
    }

    public List<CanonicalProduct> findCanonicalsByBrandAndCategory(String brand, String category) {
        return jdbcTemplate.query("""
                SELECT * FROM products_canonical WHERE brand_norm = ? AND category_norm = ? ORDER BY id
                """, CANONICAL_MAPPER, brand, category);
    }

    /**
     * Snapshot count per canonical product, counted over raw products actively linked to it.
     * Canonical products without history are absent from the map.
     */
    public Map<Long, Integer> historyDepth(Collection<Long> canonicalIds) {
        Map<Long, Integer> depth = new HashMap<>();
        if (canonicalIds.isEmpty()) return depth;

        String placeholders = canonicalIds.stream().map(id -> "?").collect(Collectors.joining(", "));
        jdbcTemplate.query("""
                SELECT pm.product_canonical_id AS canonical_id, COUNT(ps.id) AS snapshots
                FROM product_matches pm
                JOIN price_snapshots ps ON ps.product_raw_id = pm.product_raw_id
                WHERE pm.superseded_at IS NULL AND pm.status <> 'REJECTED'
                  AND pm.product_canonical_id IN (%s)
                GROUP BY pm.product_canonical_id
                """.formatted(placeholders),
                (RowCallbackHandler) rs -> depth.put(rs.getLong("canonical_id"), rs.getInt("snapshots")),
                canonicalIds.toArray());
        return depth;
    }

    // ── Matches ──────────────────────────────────────────────────────────────

    public Optional<ProductMatch> findActiveMatch(long rawProductId) {
        return jdbcTemplate.query("SELECT * FROM product_matches WHERE product_raw_id = ? AND "
                        + ACTIVE_MATCH + " ORDER BY id DESC", MATCH_MAPPER, rawProductId)
                .stream().findFirst();
    }

    public Optional<ProductMatch> findRunMatch(long rawProductId, String runId) {
        return jdbcTemplate.query("""
                SELECT * FROM product_matches WHERE product_raw_id = ? AND run_id = ? ORDER BY id DESC
                """, MATCH_MAPPER, rawProductId, runId).stream().findFirst();
    }

    public Optional<ProductMatch> findMatch(long matchId) {
        return jdbcTemplate.query("SELECT * FROM product_matches WHERE id = ?", MATCH_MAPPER, matchId)
                .stream().findFirst();
    }

    public Set<Long> rejectedCanonicalIds(long rawProductId) {
        return new HashSet<>(jdbcTemplate.queryForList("""
                SELECT DISTINCT product_canonical_id FROM product_matches
                WHERE product_raw_id = ? AND status = 'REJECTED'
                """, Long.class, rawProductId));
    }

    /**
     * Supersedes the raw product's current active link, then inserts the new one. REJECTED rows are
     * left untouched so the rejection stays on record.
     */
    public ProductMatch insertMatch(ProductMatch match) {
        Instant createdAt = match.getCreatedAt() != null ? match.getCreatedAt() : Instant.now();

        int superseded = jdbcTemplate.update("UPDATE product_matches SET superseded_at = ? WHERE product_raw_id = ? AND "
                + ACTIVE_MATCH, Timestamp.from(createdAt), match.getRawProductId());
        if (superseded > 0) {
            log.debug("Superseded {} active match(es) of raw product {}", superseded, match.getRawProductId());
        }

        long id = insert("""
                INSERT INTO product_matches
                (product_raw_id, product_canonical_id, match_confidence, match_method, status, run_id, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """, ps -> {
            ps.setLong(1, match.getRawProductId());
            ps.setLong(2, match.getCanonicalProductId());
            ps.setDouble(3, match.getMatchConfidence());
            ps.setString(4, match.getMatchMethod());
            ps.setString(5, match.getStatus().name());
            ps.setString(6, match.getRunId());
            ps.setTimestamp(7, Timestamp.from(createdAt));
        });
        match.setId(id);
        match.setCreatedAt(createdAt);
        return match;
    }

    /** Reviewer decision applied in place to an existing row. */
    public void updateMatchDecision(long matchId, MatchStatus status, String method, double confidence) {
        jdbcTemplate.update("""
                UPDATE product_matches SET status = ?, match_method = ?, match_confidence = ? WHERE id = ?
                """, status.name(), method, confidence, matchId);
    }

    public List<PendingMatchView> findPendingReviews(int limit) {
        return jdbcTemplate.query("""
                SELECT pm.id AS match_id, pm.product_raw_id, r.name AS retailer, pr.title, pr.product_url,
                       pm.product_canonical_id, pc.canonical_name, pc.brand_norm,
                       pm.match_confidence, pm.match_method, pm.created_at
                FROM product_matches pm
                JOIN products_raw pr ON pr.id = pm.product_raw_id
                JOIN retailers r ON r.id = pr.retailer_id
                JOIN products_canonical pc ON pc.id = pm.product_canonical_id
                WHERE pm.status = 'PENDING_REVIEW' AND pm.superseded_at IS NULL
                ORDER BY pm.match_confidence DESC, pm.id
                LIMIT ?
                """, (rs, i) -> PendingMatchView.builder()
                        .matchId(rs.getLong("match_id"))
                        .rawProductId(rs.getLong("product_raw_id"))
                        .retailer(rs.getString("retailer"))
                        .rawTitle(rs.getString("title"))
                        .productUrl(rs.getString("product_url"))
                        .canonicalProductId(rs.getLong("product_canonical_id"))
                        .canonicalName(rs.getString("canonical_name"))
                        .brand(rs.getString("brand_norm"))
                        .matchConfidence(rs.getDouble("match_confidence"))
                        .matchMethod(rs.getString("match_method"))
                        .createdAt(instant(rs, "created_at"))
                        .build(),
                limit);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    @FunctionalInterface
    interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private long insert(String sql, Binder binder) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            binder.bind(ps);
            return ps;
        }, keyHolder);
        return Objects.requireNonNull(keyHolder.getKey(), "no generated key").longValue();
    }

    static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }

    static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static final RowMapper<Retailer> RETAILER_MAPPER = (rs, i) -> Retailer.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .domain(rs.getString("domain"))
            .active(rs.getBoolean("active"))
            .build();

    private static final RowMapper<RawProduct> RAW_PRODUCT_MAPPER = (rs, i) -> RawProduct.builder()
            .id(rs.getLong("id"))
            .retailerId(rs.getLong("retailer_id"))
            .retailerProductId(rs.getString("retailer_product_id"))
            .productUrl(rs.getString("product_url"))
            .title(rs.getString("title"))
            .brandRaw(rs.getString("brand_raw"))
            .sizeRaw(rs.getString("size_raw"))
            .categoryRaw(rs.getString("category_raw"))
            .imageUrl(rs.getString("image_url"))
            .ean(rs.getString("ean"))
            .firstSeenAt(instant(rs, "first_seen_at"))
            .lastSeenAt(instant(rs, "last_seen_at"))
            .build();

    private static final RowMapper<CanonicalProduct> CANONICAL_MAPPER = (rs, i) -> CanonicalProduct.builder()
            .id(rs.getLong("id"))
            .canonicalName(rs.getString("canonical_name"))
            .brandNorm(rs.getString("brand_norm"))
            .sizeValue(nullableDouble(rs, "size_value"))
            .sizeUnit(rs.getString("size_unit"))
            .categoryNorm(rs.getString("category_norm"))
            .ean(rs.getString("ean"))
            .createdAt(instant(rs, "created_at"))
            .build();

    private static final RowMapper<ProductMatch> MATCH_MAPPER = (rs, i) -> ProductMatch.builder()
            .id(rs.getLong("id"))
            .rawProductId(rs.getLong("product_raw_id"))
            .canonicalProductId(rs.getLong("product_canonical_id"))
            .matchConfidence(rs.getDouble("match_confidence"))
            .matchMethod(rs.getString("match_method"))
            .status(MatchStatus.valueOf(rs.getString("status")))
            .runId(rs.getString("run_id"))
            .createdAt(instant(rs, "created_at"))
            .supersededAt(instant(rs, "superseded_at"))
            .build();
}
