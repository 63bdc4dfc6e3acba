package com.realdiscount.pipeline.output;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.PriceSnapshot;
import com.realdiscount.pipeline.service.DuplicateSnapshotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Append-only price observations per raw product.
 *
 * Two guards keep the history clean:
 *   - the same (raw product, scraped_at) twice is a {@link DuplicateSnapshotException}
 *   - an observation whose content hash matches one stored within the dedup window is a no-op
 *     that returns the stored snapshot
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PriceHistoryStore {

    private final JdbcTemplate jdbcTemplate;
    private final DiscountPipelineProperties properties;

    /**
     * Result of an append: the snapshot now on record and whether this call created it.
     */
    public record AppendResult(PriceSnapshot snapshot, boolean inserted) {}

    public AppendResult append(long rawProductId, PriceSnapshot snapshot) {
        Instant scrapedAt = snapshot.getScrapedAt();
        if (snapshot.getCurrency() == null) {
            snapshot.setCurrency(properties.getSource().getDefaultCurrency());
        }
        Integer sameInstant = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM price_snapshots WHERE product_raw_id = ? AND scraped_at = ?
                """, Integer.class, rawProductId, Timestamp.from(scrapedAt));
        if (sameInstant != null && sameInstant > 0) {
            throw new DuplicateSnapshotException(rawProductId, scrapedAt);
        }

        String hash = contentHash(snapshot);
        Duration window = Duration.ofMinutes(properties.getHistory().getDedupWindowMinutes());
        List<PriceSnapshot> sameContent = jdbcTemplate.query("""
                SELECT * FROM price_snapshots
                WHERE product_raw_id = ? AND source_hash = ? AND scraped_at >= ? AND scraped_at <= ?
                ORDER BY scraped_at DESC
                """, SNAPSHOT_MAPPER, rawProductId, hash,
                Timestamp.from(scrapedAt.minus(window)), Timestamp.from(scrapedAt.plus(window)));
        if (!sameContent.isEmpty()) {
            log.debug("Snapshot for raw product {} at {} repeats snapshot {}; skipped",
                    rawProductId, scrapedAt, sameContent.get(0).getId());
            return new AppendResult(sameContent.get(0), false);
        }

        String currency = snapshot.getCurrency();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement("""
                        INSERT INTO price_snapshots
                        (product_raw_id, scraped_at, price_current, price_list, currency, promo_text, in_stock, source_hash)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                        """, new String[]{"id"});
                ps.setLong(1, rawProductId);
                ps.setTimestamp(2, Timestamp.from(scrapedAt));
                ps.setDouble(3, snapshot.getPriceCurrent());
                CatalogStore.setNullableDouble(ps, 4, snapshot.getPriceList());
                ps.setString(5, currency);
                ps.setString(6, snapshot.getPromoText());
                if (snapshot.getInStock() == null) {
                    ps.setNull(7, Types.BOOLEAN);
                } else {
                    ps.setBoolean(7, snapshot.getInStock());
                }
                ps.setString(8, hash);
                return ps;
            }, keyHolder);
        } catch (DuplicateKeyException e) {
            throw new DuplicateSnapshotException(rawProductId, scrapedAt);
        }

        PriceSnapshot stored = PriceSnapshot.builder()
                .id(Objects.requireNonNull(keyHolder.getKey(), "no generated key").longValue())
                .rawProductId(rawProductId)
                .scrapedAt(scrapedAt)
                .priceCurrent(snapshot.getPriceCurrent())
                .priceList(snapshot.getPriceList())
                .currency(currency)
                .promoText(snapshot.getPromoText())
                .inStock(snapshot.getInStock())
                .sourceHash(hash)
                .build();
        return new AppendResult(stored, true);
    }

    /** Snapshots inside the lookback window ending now, oldest first. */
    public List<PriceSnapshot> history(long rawProductId, Duration lookback) {
        return history(rawProductId, lookback, Instant.now());
    }

    /**
     * Snapshots strictly before {@code before} and no older than {@code before - lookback},
     * oldest first. May be empty.
     */
    public List<PriceSnapshot> history(long rawProductId, Duration lookback, Instant before) {
        return jdbcTemplate.query("""
                SELECT * FROM price_snapshots
                WHERE product_raw_id = ? AND scraped_at < ? AND scraped_at >= ?
                ORDER BY scraped_at ASC
                """, SNAPSHOT_MAPPER, rawProductId, Timestamp.from(before), Timestamp.from(before.minus(lookback)));
    }

    /**
     * Latest current price of every other-retailer listing actively linked to the canonical product,
     * observed no later than {@code asOf} plus the peer skew and inside the lookback window.
     */
    public List<Double> peerPrices(long canonicalProductId, long excludedRetailerId, Instant asOf) {
        DiscountPipelineProperties.History history = properties.getHistory();
        Instant upper = asOf.plus(Duration.ofHours(history.getPeerSkewHours()));
        Instant lower = asOf.minus(Duration.ofDays(history.getLookbackDays()));

        return jdbcTemplate.queryForList("""
                SELECT ps.price_current
                FROM product_matches pm
                JOIN products_raw pr ON pr.id = pm.product_raw_id
                JOIN price_snapshots ps ON ps.product_raw_id = pm.product_raw_id
                WHERE pm.product_canonical_id = ?
                  AND pm.superseded_at IS NULL AND pm.status <> 'REJECTED'
                  AND pr.retailer_id <> ?
                  AND ps.scraped_at <= ? AND ps.scraped_at >= ?
                  AND ps.scraped_at = (
                      SELECT MAX(ps2.scraped_at) FROM price_snapshots ps2
                      WHERE ps2.product_raw_id = ps.product_raw_id
                        AND ps2.scraped_at <= ? AND ps2.scraped_at >= ?
                  )
                ORDER BY pm.product_raw_id
                """, Double.class,
                canonicalProductId, excludedRetailerId,
                Timestamp.from(upper), Timestamp.from(lower),
                Timestamp.from(upper), Timestamp.from(lower));
    }

    /**
     * SHA-256 over the fields that make two observations "the same price".
     */
    static String contentHash(PriceSnapshot snapshot) {
        String material = String.join("|",
                Double.toString(snapshot.getPriceCurrent()),
                String.valueOf(snapshot.getPriceList()),
                String.valueOf(snapshot.getCurrency()),
                String.valueOf(snapshot.getPromoText()),
                String.valueOf(snapshot.getInStock()));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final RowMapper<PriceSnapshot> SNAPSHOT_MAPPER = (rs, i) -> PriceSnapshot.builder()
            .id(rs.getLong("id"))
            .rawProductId(rs.getLong("product_raw_id"))
            .scrapedAt(CatalogStore.instant(rs, "scraped_at"))
            .priceCurrent(rs.getDouble("price_current"))
            .priceList(CatalogStore.nullableDouble(rs, "price_list"))
            .currency(rs.getString("currency"))
            .promoText(rs.getString("promo_text"))
            .inStock(nullableBoolean(rs.getBoolean("in_stock"), rs.wasNull()))
            .sourceHash(rs.getString("source_hash"))
            .build();

    private static Boolean nullableBoolean(boolean value, boolean wasNull) {
        return wasNull ? null : value;
    }
}
