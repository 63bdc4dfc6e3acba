package com.realdiscount.pipeline.config;

import com.realdiscount.pipeline.model.CalibrationReport;
import com.realdiscount.pipeline.model.DealFilter;
import com.realdiscount.pipeline.model.DealView;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.model.PendingMatchView;
import com.realdiscount.pipeline.model.ProductMatch;
import com.realdiscount.pipeline.service.DealQueryService;
import com.realdiscount.pipeline.service.DiscountPipelineService;
import com.realdiscount.pipeline.service.LabelCalibrationService;
import com.realdiscount.pipeline.service.MatchReviewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.StringReader;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class DiscountController {

    private final DiscountPipelineService pipelineService;
    private final DealQueryService dealQueryService;
    private final MatchReviewService matchReviewService;
    private final LabelCalibrationService labelCalibrationService;
    private final DiscountPipelineProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "real-discount-pipeline",
                "scoringVersion", properties.getScoring().getVersion(),
                "running", pipelineService.isRunning()
        ));
    }

    // ── Pipeline ──────────────────────────────────────────────────────────────

    @PostMapping("/pipeline/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (pipelineService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A pipeline run is already in progress"));
        }
        new Thread(pipelineService::runOnce, "manual-pipeline-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/status/latest")
    public ResponseEntity<?> latestRun() {
        try {
            return dealQueryService.latestRun()
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No pipeline run recorded yet")));
        } catch (Exception e) {
            log.error("Latest run lookup failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Deal query API ────────────────────────────────────────────────────────

    /**
     * Latest evaluation per listing under the current scoring version.
     *
     * GET /deals?min_score=0.55&label=LIKELY_REAL&retailer=Falabella&brand=samsung
     *           &min_visible_discount=0.10&cross_store_positive_only=true&limit=50
     */
    @GetMapping("/deals")
    public ResponseEntity<?> deals(
            @RequestParam(name = "min_score", defaultValue = "0") double minScore,
            @RequestParam(required = false) String label,
            @RequestParam(required = false) String retailer,
            @RequestParam(required = false) String brand,
            @RequestParam(name = "min_visible_discount", required = false) Double minVisibleDiscount,
            @RequestParam(name = "cross_store_positive_only", defaultValue = "false") boolean crossStorePositiveOnly,
            @RequestParam(required = false) Integer limit) {
        try {
            DealFilter filter = DealFilter.builder()
                    .minScore(minScore)
                    .label(parseLabel(label))
                    .retailer(retailer)
                    .brand(brand)
                    .minVisibleDiscount(minVisibleDiscount)
                    .crossStorePositiveOnly(crossStorePositiveOnly)
                    .limit(limit)
                    .build();
            List<DealView> result = dealQueryService.findDeals(filter);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Deal query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Match review ──────────────────────────────────────────────────────────

    @GetMapping("/matches/pending")
    public ResponseEntity<?> pendingMatches(@RequestParam(defaultValue = "50") int limit) {
        try {
            List<PendingMatchView> result = matchReviewService.pendingReviews(limit);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Pending match query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/matches/{id}/confirm")
    public ResponseEntity<?> confirmMatch(@PathVariable long id) {
        try {
            ProductMatch match = matchReviewService.confirm(id);
            return ResponseEntity.ok(match);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Confirming match {} failed: {}", id, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/matches/{id}/reject")
    public ResponseEntity<?> rejectMatch(@PathVariable long id) {
        try {
            ProductMatch match = matchReviewService.reject(id);
            return ResponseEntity.ok(match);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Rejecting match {} failed: {}", id, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Labels ────────────────────────────────────────────────────────────────

    @PostMapping("/labels/export")
    public ResponseEntity<?> exportLabels(@RequestParam(defaultValue = "500") int limit) {
        try {
            LabelCalibrationService.ExportResult result = labelCalibrationService.exportLabelCandidates(limit);
            return ResponseEntity.ok(Map.of("path", result.path().toString(), "rows", result.rows()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Label export failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Compares human labels with the model's latest predictions.
     *
     * POST /labels/calibrate?sweep=true with the labelled CSV as the request body.
     */
    @PostMapping(value = "/labels/calibrate", consumes = {MediaType.TEXT_PLAIN_VALUE, "text/csv"})
    public ResponseEntity<?> calibrate(@RequestBody String csv,
                                       @RequestParam(defaultValue = "false") boolean sweep) {
        try {
            CalibrationReport report = labelCalibrationService.calibrate(new StringReader(csv), sweep);
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Label calibration failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    private static DiscountLabel parseLabel(String label) {
        if (label == null || label.isBlank()) return null;
        try {
            return DiscountLabel.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown label '" + label + "'");
        }
    }
}
