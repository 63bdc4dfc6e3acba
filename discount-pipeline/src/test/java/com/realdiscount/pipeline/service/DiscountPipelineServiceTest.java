package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.DiscountEvaluation;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.model.PipelineRun;
import com.realdiscount.pipeline.model.RawOffer;
import com.realdiscount.pipeline.model.RunStatus;
import com.realdiscount.pipeline.model.SourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class DiscountPipelineServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T06:00:00Z");
    private static final String TITLE = "La Roche-Posay Anthelios UVMune 400 Fluido 50 ml";
    private static final String EAN = "3337875797580";

    private PipelineFixture fx;

    @BeforeEach
    public void setUp() {
        fx = new PipelineFixture()
                .retailer("CruzVerde", "cruzverde.cl")
                .retailer("Salcobrand", "salcobrand.cl");
    }

    private void scriptSameProductAtTwoStores() {
        fx.source.offers.put("CruzVerde", List.of(PipelineFixture.offer("cv-1", TITLE, EAN, 9000, 10000.0, T0)));
        fx.source.offers.put("Salcobrand", List.of(PipelineFixture.offer("sb-1", TITLE, EAN, 10000, 11000.0, T0)));
    }

    private DiscountEvaluation evaluationFor(List<DiscountEvaluation> evaluations, String retailerName) {
        long retailerId = fx.catalogStore.upsertRetailer(retailerName,
                retailerName.equals("CruzVerde") ? "cruzverde.cl" : "salcobrand.cl").getId();
        return evaluations.stream().filter(e -> e.getRetailerId() == retailerId).findFirst().orElseThrow();
    }

    @Test
    public void cheaperStorePassesCrossStoreRule() {
        scriptSameProductAtTwoStores();

        PipelineRun run = fx.pipeline().runOnce().orElseThrow();

        assertEquals(RunStatus.SUCCESS, run.getStatus());
        assertEquals(2, run.getTotalOffers());
        assertEquals(2, run.getTotalSnapshots());
        assertEquals(2, run.getTotalEvaluations());
        assertEquals(1, fx.db.count("products_canonical"));

        List<DiscountEvaluation> evaluations = fx.recorder.findByRun(run.getRunId());
        DiscountEvaluation cheaper = evaluationFor(evaluations, "CruzVerde");
        DiscountEvaluation dearer = evaluationFor(evaluations, "Salcobrand");

        assertEquals(-0.10, cheaper.getCrossStoreDeltaPct(), 1e-9);
        assertTrue(cheaper.getRuleTrace().contains("\"R3_cross_store_ge_5pct\":true"));
        assertEquals(DiscountLabel.LIKELY_REAL, cheaper.getLabel());

        assertEquals(0.1111, dearer.getCrossStoreDeltaPct(), 1e-9);
        assertTrue(dearer.getRuleTrace().contains("\"R3_cross_store_ge_5pct\":false"));
        assertEquals(DiscountLabel.LIKELY_FAKE, dearer.getLabel());
    }

    @Test
    public void rerunWithSameOffersIsIdempotent() {
        scriptSameProductAtTwoStores();
        fx.pipeline().runOnce();

        PipelineRun second = fx.pipeline().runOnce().orElseThrow();

        assertEquals(RunStatus.SUCCESS, second.getStatus());
        assertEquals(2, second.getTotalDuplicates());
        assertEquals(0, second.getTotalSnapshots());
        assertEquals(0, second.getTotalEvaluations());
        assertEquals(2, fx.db.count("price_snapshots"));
        assertEquals(2, fx.db.count("discount_evaluations"));
        assertEquals(2, fx.db.count("products_raw"));
        assertEquals(1, fx.db.count("products_canonical"));
    }

    @Test
    public void laterObservationBuildsOnHistory() {
        scriptSameProductAtTwoStores();
        fx.pipeline().runOnce();

        Instant later = T0.plus(Duration.ofDays(1));
        fx.source.offers.put("CruzVerde", List.of(PipelineFixture.offer("cv-1", TITLE, EAN, 8900, 10000.0, later)));
        fx.source.offers.put("Salcobrand", List.of(PipelineFixture.offer("sb-1", TITLE, EAN, 10000, 11000.0, later)));
        PipelineRun run = fx.pipeline().runOnce().orElseThrow();

        assertEquals(2, run.getTotalEvaluations());
        DiscountEvaluation cv = evaluationFor(fx.recorder.findByRun(run.getRunId()), "CruzVerde");
        assertTrue(cv.getRuleTrace().contains("\"R2_anchor_spike_le_10pct\":true"));
        assertTrue(cv.getRuleTrace().contains("\"R4_seen_multiple_snapshots\":false"));
        assertTrue(cv.getRuleTrace().contains("\"R1_hist_delta_ge_15pct\":null"));
    }

    @Test
    public void emptyFeedFailsTheRunAndStoresNothing() {
        fx.source.offers.put("CruzVerde", List.of(PipelineFixture.offer("cv-1", TITLE, EAN, 9000, 10000.0, T0)));

        PipelineRun run = fx.pipeline().runOnce().orElseThrow();

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(SourceKind.ERROR, run.getSources().get(1).getSource());
        assertEquals(PipelineRunTracker.NO_OFFERS, run.getSources().get(1).getErrorText());
        assertEquals(0, fx.db.count("price_snapshots"));
        assertEquals(0, fx.db.count("discount_evaluations"));
        assertEquals(RunStatus.FAILED, fx.tracker.latestRun().orElseThrow().getStatus());
    }

    @Test
    public void sourceErrorIsRecordedVerbatim() {
        fx.source.offers.put("CruzVerde", List.of(PipelineFixture.offer("cv-1", TITLE, EAN, 9000, 10000.0, T0)));
        fx.source.failures.put("Salcobrand", new SourceException("Salcobrand", "Feed call failed: 503 Service Unavailable"));

        PipelineRun run = fx.pipeline().runOnce().orElseThrow();

        assertEquals(RunStatus.FAILED, run.getStatus());
        PipelineRun stored = fx.tracker.latestRun().orElseThrow();
        assertEquals("Feed call failed: 503 Service Unavailable", stored.getSources().stream()
                .filter(s -> s.getRetailerName().equals("Salcobrand")).findFirst().orElseThrow().getErrorText());
        assertEquals(0, fx.db.count("products_raw"));
    }

    @Test
    public void brokenOfferIsCountedAndTheRestContinue() {
        RawOffer broken = PipelineFixture.offer("cv-2", TITLE, null, 5000, null, T0);
        broken.setProductUrl(null);
        fx.source.offers.put("CruzVerde", List.of(broken, PipelineFixture.offer("cv-1", TITLE, EAN, 9000, 10000.0, T0)));
        fx.source.offers.put("Salcobrand", List.of(PipelineFixture.offer("sb-1", TITLE, EAN, 10000, 11000.0, T0)));

        PipelineRun run = fx.pipeline().runOnce().orElseThrow();

        assertEquals(RunStatus.SUCCESS, run.getStatus());
        assertEquals(3, run.getTotalOffers());
        assertEquals(1, run.getTotalOfferErrors());
        assertEquals(2, run.getTotalEvaluations());
        assertEquals(2, fx.db.count("products_raw"));
    }

    @Test
    public void noRetailersFailsTheRun() {
        fx.properties.getRetailers().clear();

        PipelineRun run = fx.pipeline().runOnce().orElseThrow();

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals("No retailers configured", run.getErrorMessage());
    }

    @Test
    public void disabledRetailerIsNotFetched() {
        scriptSameProductAtTwoStores();
        fx.properties.getRetailers().get(1).setEnabled(false);

        PipelineRun run = fx.pipeline().runOnce().orElseThrow();

        assertEquals(RunStatus.SUCCESS, run.getStatus());
        assertEquals(1, run.getSources().size());
        assertEquals(1, run.getTotalEvaluations());
    }

    @Test
    public void overlappingTriggerIsSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DiscountPipelineProperties.RetailerSource only = fx.properties.getRetailers().get(0);
        fx.properties.getRetailers().remove(1);
        fx.source.offers.put(only.getName(), List.of(PipelineFixture.offer("cv-1", TITLE, EAN, 9000, 10000.0, T0)));
        DiscountPipelineService slow = new DiscountPipelineService(fx.properties,
                retailer -> {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return fx.source.fetchOffers(retailer);
                },
                fx.normalizer, fx.matcher, fx.catalogStore, fx.historyStore,
                new RuleEvaluator(fx.properties), new DiscountScorer(fx.properties), fx.recorder, fx.tracker,
                fx.objectMapper, fx.db.transactionManager);

        Thread first = new Thread(slow::runOnce);
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(slow.isRunning());
        Optional<PipelineRun> skipped = slow.runOnce();
        assertTrue(skipped.isEmpty());

        release.countDown();
        first.join(5000);
        assertFalse(slow.isRunning());
    }
}
