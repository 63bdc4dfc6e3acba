package com.realdiscount.pipeline.output;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.CanonicalProduct;
import com.realdiscount.pipeline.model.DiscountEvaluation;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.model.PriceSnapshot;
import com.realdiscount.pipeline.model.RawOffer;
import com.realdiscount.pipeline.service.MissingReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluationRecorderTest {

    private static final Instant T0 = Instant.parse("2025-03-01T06:00:00Z");

    private TestDatabase db;
    private EvaluationRecorder recorder;
    private long retailerId;
    private long canonicalId;
    private long snapshotId;

    @BeforeEach
    public void setUp() {
        db = new TestDatabase();
        CatalogStore catalogStore = new CatalogStore(db.jdbcTemplate);
        recorder = new EvaluationRecorder(db.jdbcTemplate);

        retailerId = catalogStore.upsertRetailer("CruzVerde", "cruzverde.cl").getId();
        long rawId = catalogStore.upsertRawProduct(retailerId, RawOffer.builder()
                .retailerProductId("cv-1").productUrl("https://shop.example/cv-1").title("Eucerin Hyaluron Filler 50 ml")
                .priceCurrent(19990).scrapedAt(T0).build()).getId();
        canonicalId = catalogStore.insertCanonical(CanonicalProduct.builder()
                .canonicalName("hyaluron filler").brandNorm("eucerin").categoryNorm("moisturizer").build()).getId();
        snapshotId = new PriceHistoryStore(db.jdbcTemplate, new DiscountPipelineProperties())
                .append(rawId, PriceSnapshot.builder().scrapedAt(T0).priceCurrent(19990).priceList(24990.0).build())
                .snapshot().getId();
    }

    private DiscountEvaluation evaluation(long canonical, long snapshot, String version) {
        return DiscountEvaluation.builder()
                .canonicalProductId(canonical)
                .retailerId(retailerId)
                .snapshotId(snapshot)
                .runId("run-1")
                .score(0.525)
                .label(DiscountLabel.SUSPICIOUS)
                .discountPct(0.2001)
                .ruleTrace("{\"R6_visible_discount_ge_10pct\":true}")
                .scoringVersion(version)
                .build();
    }

    @Test
    public void recordsEvaluation() {
        EvaluationRecorder.RecordResult r = recorder.record(evaluation(canonicalId, snapshotId, "v1"));

        assertTrue(r.inserted());
        assertNotNull(r.evaluation().getId());
        DiscountEvaluation stored = recorder.find(snapshotId, "v1").orElseThrow();
        assertEquals(DiscountLabel.SUSPICIOUS, stored.getLabel());
        assertEquals(0.2001, stored.getDiscountPct(), 1e-9);
        assertNull(stored.getHistDeltaPct());
        assertEquals("run-1", stored.getRunId());
    }

    @Test
    public void sameSnapshotAndVersionIsRecordedOnce() {
        DiscountEvaluation first = recorder.record(evaluation(canonicalId, snapshotId, "v1")).evaluation();
        EvaluationRecorder.RecordResult again = recorder.record(evaluation(canonicalId, snapshotId, "v1"));

        assertFalse(again.inserted());
        assertEquals(first.getId(), again.evaluation().getId());
        assertEquals(1, db.count("discount_evaluations"));
    }

    @Test
    public void newScoringVersionAddsARow() {
        recorder.record(evaluation(canonicalId, snapshotId, "v1"));
        assertTrue(recorder.record(evaluation(canonicalId, snapshotId, "v2")).inserted());
        assertEquals(2, db.count("discount_evaluations"));
    }

    @Test
    public void missingCanonicalProductIsRejected() {
        assertThrows(MissingReferenceException.class, () -> recorder.record(evaluation(9999L, snapshotId, "v1")));
        assertEquals(0, db.count("discount_evaluations"));
    }

    @Test
    public void missingSnapshotIsRejected() {
        assertThrows(MissingReferenceException.class, () -> recorder.record(evaluation(canonicalId, 9999L, "v1")));
    }

    @Test
    public void findByRunReturnsRunRows() {
        recorder.record(evaluation(canonicalId, snapshotId, "v1"));
        assertEquals(1, recorder.findByRun("run-1").size());
        assertTrue(recorder.findByRun("other").isEmpty());
        assertEquals(1, recorder.latest(10).size());
    }
}
