package com.realdiscount.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.DiscountEvaluation;
import com.realdiscount.pipeline.model.NormalizedIdentity;
import com.realdiscount.pipeline.model.PipelineRun;
import com.realdiscount.pipeline.model.PriceSnapshot;
import com.realdiscount.pipeline.model.ProductMatch;
import com.realdiscount.pipeline.model.RawOffer;
import com.realdiscount.pipeline.model.RawProduct;
import com.realdiscount.pipeline.model.Retailer;
import com.realdiscount.pipeline.model.RuleSignals;
import com.realdiscount.pipeline.model.ScoreResult;
import com.realdiscount.pipeline.output.CatalogStore;
import com.realdiscount.pipeline.output.EvaluationRecorder;
import com.realdiscount.pipeline.output.PriceHistoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates one pipeline run.
 *
 *   1. fetch every enabled retailer concurrently; any failure or empty feed fails the run
 *   2. ingest: upsert retailer and raw product, match to a canonical product, append the snapshot
 *   3. evaluate every newly stored snapshot: rules → score → label → record
 *
 * Steps 2 and 3 run in one transaction on a single thread, in feed order. Each offer gets its own
 * savepoint, so a bad offer is rolled back and counted while the rest of the run continues.
 * A missing reference aborts the whole run and nothing is committed.
 */
@Service
@Slf4j
public class DiscountPipelineService {

    private final DiscountPipelineProperties properties;
    private final RetailerOfferSource offerSource;
    private final IdentityNormalizer normalizer;
    private final CanonicalMatcher matcher;
    private final CatalogStore catalogStore;
    private final PriceHistoryStore historyStore;
    private final RuleEvaluator ruleEvaluator;
    private final DiscountScorer scorer;
    private final EvaluationRecorder recorder;
    private final PipelineRunTracker tracker;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate runTransaction;
    private final TransactionTemplate offerSavepoint;

    private final ReentrantLock runLock = new ReentrantLock();

    public DiscountPipelineService(DiscountPipelineProperties properties,
                                   RetailerOfferSource offerSource,
                                   IdentityNormalizer normalizer,
                                   CanonicalMatcher matcher,
                                   CatalogStore catalogStore,
                                   PriceHistoryStore historyStore,
                                   RuleEvaluator ruleEvaluator,
                                   DiscountScorer scorer,
                                   EvaluationRecorder recorder,
                                   PipelineRunTracker tracker,
                                   ObjectMapper objectMapper,
                                   PlatformTransactionManager transactionManager) {
        this.properties = properties;
        this.offerSource = offerSource;
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.catalogStore = catalogStore;
        this.historyStore = historyStore;
        this.ruleEvaluator = ruleEvaluator;
        this.scorer = scorer;
        this.recorder = recorder;
        this.tracker = tracker;
        this.objectMapper = objectMapper;
        this.runTransaction = new TransactionTemplate(transactionManager);
        this.offerSavepoint = new TransactionTemplate(transactionManager);
        this.offerSavepoint.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    /**
     * Runs the pipeline unless a run is already in progress.
     *
     * @return the completed run, or empty when the trigger was skipped
     */
    public Optional<PipelineRun> runOnce() {
        if (!runLock.tryLock()) {
            log.warn("Pipeline run already in progress, trigger skipped");
            return Optional.empty();
        }
        try {
            return Optional.of(execute());
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private PipelineRun execute() {
        PipelineRun run = tracker.start();
        Throwable failure = null;
        try {
            List<DiscountPipelineProperties.RetailerSource> retailers = properties.getRetailers().stream()
                    .filter(DiscountPipelineProperties.RetailerSource::isEnabled)
                    .toList();
            if (retailers.isEmpty()) {
                throw new IllegalStateException("No retailers configured");
            }

            Map<DiscountPipelineProperties.RetailerSource, List<RawOffer>> fetched = fetchAll(run, retailers);
            if (run.hasFailedSource()) {
                log.error("Run {}: at least one retailer failed, no offers processed", run.getRunId());
            } else {
                try {
                    runTransaction.executeWithoutResult(status -> process(run, fetched));
                } catch (RuntimeException e) {
                    // rolled back: nothing from this run was stored
                    run.setTotalSnapshots(0);
                    run.setTotalDuplicates(0);
                    run.setTotalEvaluations(0);
                    throw e;
                }
            }
        } catch (Exception e) {
            failure = e;
            log.error("Pipeline run {} aborted: {}", run.getRunId(), e.getMessage(), e);
        } finally {
            tracker.complete(run, failure);
        }
        return run;
    }

    private Map<DiscountPipelineProperties.RetailerSource, List<RawOffer>> fetchAll(
            PipelineRun run, List<DiscountPipelineProperties.RetailerSource> retailers) {

        int threads = Math.max(1, Math.min(properties.getSource().getParallelism(), retailers.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<DiscountPipelineProperties.RetailerSource, CompletableFuture<List<RawOffer>>> futures = new LinkedHashMap<>();
            for (DiscountPipelineProperties.RetailerSource retailer : retailers) {
                futures.put(retailer, CompletableFuture.supplyAsync(() -> offerSource.fetchOffers(retailer), executor));
            }

            Map<DiscountPipelineProperties.RetailerSource, List<RawOffer>> fetched = new LinkedHashMap<>();
            for (Map.Entry<DiscountPipelineProperties.RetailerSource, CompletableFuture<List<RawOffer>>> entry : futures.entrySet()) {
                String name = entry.getKey().getName();
                try {
                    List<RawOffer> offers = entry.getValue().join();
                    int count = offers == null ? 0 : offers.size();
                    tracker.recordSource(run, name, count, null);
                    if (count > 0) {
                        log.info("{}: {} offers fetched", name, count);
                        fetched.put(entry.getKey(), offers);
                    } else {
                        log.error("{}: feed returned no offers", name);
                    }
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                    log.error("{}: fetch failed: {}", name, message, cause);
                    tracker.recordSource(run, name, 0, message);
                }
            }
            return fetched;
        } finally {
            executor.shutdown();
        }
    }

    private void process(PipelineRun run, Map<DiscountPipelineProperties.RetailerSource, List<RawOffer>> fetched) {
        List<Ingested> ingested = new ArrayList<>();
        for (Map.Entry<DiscountPipelineProperties.RetailerSource, List<RawOffer>> entry : fetched.entrySet()) {
            DiscountPipelineProperties.RetailerSource source = entry.getKey();
            Retailer retailer = catalogStore.upsertRetailer(source.getName(), source.getDomain());
            for (RawOffer offer : entry.getValue()) {
                run.setTotalOffers(run.getTotalOffers() + 1);
                Ingested result = ingest(run, retailer, offer);
                if (result != null) ingested.add(result);
            }
        }
        log.info("Run {}: ingested {} offers, {} new snapshots, {} duplicates",
                run.getRunId(), run.getTotalOffers(), run.getTotalSnapshots(), run.getTotalDuplicates());

        for (Ingested item : ingested) {
            evaluate(run, item);
        }
        log.info("Run {}: {} evaluations recorded", run.getRunId(), run.getTotalEvaluations());
    }

    private Ingested ingest(PipelineRun run, Retailer retailer, RawOffer offer) {
        try {
            return offerSavepoint.execute(status -> {
                RawProduct raw = catalogStore.upsertRawProduct(retailer.getId(), offer);
                NormalizedIdentity identity = normalizer.normalize(offer);
                ProductMatch match = matcher.match(raw, identity, run.getRunId());
                try {
                    PriceHistoryStore.AppendResult appended = historyStore.append(raw.getId(), toSnapshot(offer));
                    if (!appended.inserted()) {
                        run.setTotalDuplicates(run.getTotalDuplicates() + 1);
                        return null;
                    }
                    run.setTotalSnapshots(run.getTotalSnapshots() + 1);
                    return new Ingested(retailer, raw, match, appended.snapshot());
                } catch (DuplicateSnapshotException e) {
                    log.debug("{}", e.getMessage());
                    run.setTotalDuplicates(run.getTotalDuplicates() + 1);
                    return null;
                }
            });
        } catch (MissingReferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            run.setTotalOfferErrors(run.getTotalOfferErrors() + 1);
            log.error("Offer {} from {} failed during ingest: {}",
                    offer.getRetailerProductId(), retailer.getName(), e.getMessage(), e);
            return null;
        }
    }

    private void evaluate(PipelineRun run, Ingested item) {
        try {
            offerSavepoint.executeWithoutResult(status -> {
                PriceSnapshot snapshot = item.snapshot();
                Duration lookback = Duration.ofDays(properties.getHistory().getLookbackDays());

                RuleSignals signals = ruleEvaluator.evaluate(new RuleEvaluator.RuleInput(
                        snapshot.getPriceCurrent(),
                        snapshot.getPriceList(),
                        snapshot.getScrapedAt(),
                        historyStore.history(item.raw().getId(), lookback, snapshot.getScrapedAt()),
                        historyStore.peerPrices(item.match().getCanonicalProductId(), item.retailer().getId(),
                                snapshot.getScrapedAt())));
                ScoreResult result = scorer.score(signals);

                DiscountEvaluation evaluation = DiscountEvaluation.builder()
                        .canonicalProductId(item.match().getCanonicalProductId())
                        .retailerId(item.retailer().getId())
                        .snapshotId(snapshot.getId())
                        .runId(run.getRunId())
                        .score(result.getScore())
                        .label(result.getLabel())
                        .discountPct(signals.getDiscountPct())
                        .histDeltaPct(signals.getHistDeltaPct())
                        .crossStoreDeltaPct(signals.getCrossStoreDeltaPct())
                        .anchorAnomalyFlag(result.isAnchorAnomaly())
                        .ruleTrace(toJson(signals))
                        .scoringVersion(properties.getScoring().getVersion())
                        .build();

                if (recorder.record(evaluation).inserted()) {
                    run.setTotalEvaluations(run.getTotalEvaluations() + 1);
                }
                if (result.isGated()) {
                    log.debug("Snapshot {} capped at {} by the visible-discount gate", snapshot.getId(), result.getLabel());
                }
            });
        } catch (MissingReferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            run.setTotalOfferErrors(run.getTotalOfferErrors() + 1);
            log.error("Offer {} from {} failed during evaluation: {}",
                    item.raw().getRetailerProductId(), item.retailer().getName(), e.getMessage(), e);
        }
    }

    private PriceSnapshot toSnapshot(RawOffer offer) {
        return PriceSnapshot.builder()
                .scrapedAt(offer.getScrapedAt())
                .priceCurrent(offer.getPriceCurrent())
                .priceList(offer.getPriceList())
                .currency(offer.getCurrency())
                .promoText(offer.getPromoText())
                .inStock(offer.getInStock())
                .build();
    }

    private String toJson(RuleSignals signals) {
        try {
            return objectMapper.writeValueAsString(signals.toTrace());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize rule trace", e);
        }
    }

    private record Ingested(Retailer retailer, RawProduct raw, ProductMatch match, PriceSnapshot snapshot) {}
}
