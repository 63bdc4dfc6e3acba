package com.realdiscount.pipeline.output;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the relational schema on startup.
 *
 * The DDL sticks to the subset shared by PostgreSQL and H2 (PostgreSQL mode) so the same
 * statements serve the embedded and the server-hosted store. Enumerations and natural keys are
 * enforced here, not in application code.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaWriter {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring discount schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS retailers
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                name            VARCHAR(200) NOT NULL,
                domain          VARCHAR(255) NOT NULL,
                active          BOOLEAN DEFAULT TRUE NOT NULL,
                CONSTRAINT uq_retailers_domain UNIQUE (domain)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS products_raw
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                retailer_id         BIGINT NOT NULL REFERENCES retailers (id),
                retailer_product_id VARCHAR(255) NOT NULL,
                product_url         VARCHAR(2000) NOT NULL,
                title               VARCHAR(1000) NOT NULL,
                brand_raw           VARCHAR(255),
                size_raw            VARCHAR(255),
                category_raw        VARCHAR(500),
                image_url           VARCHAR(2000),
                ean                 VARCHAR(14),
                first_seen_at       TIMESTAMP NOT NULL,
                last_seen_at        TIMESTAMP NOT NULL,
                CONSTRAINT uq_products_raw_retailer_product UNIQUE (retailer_id, retailer_product_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS products_canonical
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                canonical_name  VARCHAR(1000) NOT NULL,
                brand_norm      VARCHAR(255) NOT NULL,
                size_value      DOUBLE PRECISION,
                size_unit       VARCHAR(8),
                category_norm   VARCHAR(64) NOT NULL,
                ean             VARCHAR(14),
                created_at      TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS product_matches
            (
                id                   BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                product_raw_id       BIGINT NOT NULL REFERENCES products_raw (id),
                product_canonical_id BIGINT NOT NULL REFERENCES products_canonical (id),
                match_confidence     DOUBLE PRECISION NOT NULL
                    CHECK (match_confidence >= 0 AND match_confidence <= 1),
                match_method         VARCHAR(32) NOT NULL,
                status               VARCHAR(20) NOT NULL
                    CHECK (status IN ('AUTO_ACCEPTED', 'PENDING_REVIEW', 'MANUAL_CONFIRMED', 'REJECTED')),
                run_id               VARCHAR(36),
                created_at           TIMESTAMP NOT NULL,
                superseded_at        TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS price_snapshots
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                product_raw_id  BIGINT NOT NULL REFERENCES products_raw (id),
                scraped_at      TIMESTAMP NOT NULL,
                price_current   DOUBLE PRECISION NOT NULL CHECK (price_current >= 0),
                price_list      DOUBLE PRECISION,
                currency        VARCHAR(3) DEFAULT 'CLP' NOT NULL,
                promo_text      VARCHAR(500),
                in_stock        BOOLEAN,
                source_hash     VARCHAR(64) NOT NULL,
                CONSTRAINT uq_price_snapshots_raw_scraped UNIQUE (product_raw_id, scraped_at)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS discount_evaluations
            (
                id                    BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                product_canonical_id  BIGINT NOT NULL REFERENCES products_canonical (id),
                retailer_id           BIGINT NOT NULL REFERENCES retailers (id),
                snapshot_id           BIGINT NOT NULL REFERENCES price_snapshots (id),
                run_id                VARCHAR(36),
                score                 DOUBLE PRECISION NOT NULL CHECK (score >= 0 AND score <= 1),
                label                 VARCHAR(16) NOT NULL
                    CHECK (label IN ('REAL', 'LIKELY_REAL', 'SUSPICIOUS', 'LIKELY_FAKE')),
                discount_pct          DOUBLE PRECISION,
                hist_delta_pct        DOUBLE PRECISION,
                cross_store_delta_pct DOUBLE PRECISION,
                anchor_anomaly_flag   BOOLEAN DEFAULT FALSE NOT NULL,
                rule_trace            VARCHAR(4000) NOT NULL,
                scoring_version       VARCHAR(32) NOT NULL,
                created_at            TIMESTAMP NOT NULL,
                CONSTRAINT uq_discount_eval_snapshot_version UNIQUE (snapshot_id, scoring_version)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_runs
            (
                run_id              VARCHAR(36) PRIMARY KEY,
                started_at          TIMESTAMP NOT NULL,
                finished_at         TIMESTAMP NOT NULL,
                status              VARCHAR(10) NOT NULL CHECK (status IN ('SUCCESS', 'FAILED')),
                total_offers        INTEGER DEFAULT 0 NOT NULL,
                total_snapshots     INTEGER DEFAULT 0 NOT NULL,
                total_duplicates    INTEGER DEFAULT 0 NOT NULL,
                total_evaluations   INTEGER DEFAULT 0 NOT NULL,
                total_offer_errors  INTEGER DEFAULT 0 NOT NULL,
                error_message       VARCHAR(4000)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pipeline_run_sources
            (
                run_id          VARCHAR(36) NOT NULL REFERENCES pipeline_runs (run_id),
                retailer_name   VARCHAR(200) NOT NULL,
                source_kind     VARCHAR(10) NOT NULL CHECK (source_kind IN ('live', 'error')),
                offer_count     INTEGER DEFAULT 0 NOT NULL,
                error_text      VARCHAR(4000),
                PRIMARY KEY (run_id, retailer_name)
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_price_snapshots_product_scraped ON price_snapshots (product_raw_id, scraped_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_product_matches_status ON product_matches (product_raw_id, status)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_product_matches_canonical ON product_matches (product_canonical_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_products_canonical_brand_category ON products_canonical (brand_norm, category_norm)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_products_canonical_ean ON products_canonical (ean)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_discount_eval_product_created ON discount_evaluations (product_canonical_id, created_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_pipeline_runs_started ON pipeline_runs (started_at)");

        log.info("Discount schema ready.");
    }
}
