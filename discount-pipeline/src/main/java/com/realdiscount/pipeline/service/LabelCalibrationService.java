package com.realdiscount.pipeline.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.CalibrationReport;
import com.realdiscount.pipeline.model.DealView;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.output.LabelCandidateCsvWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Label export and calibration against human judgement.
 *
 * Human positive = REAL. Model positive = REAL or LIKELY_REAL.
 * The threshold sweep predicts positive when score ≥ t and the visible-discount gate holds,
 * and ranks thresholds by precision desc, recall desc, threshold asc.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LabelCalibrationService {

    static final Set<String> VALID_HUMAN_LABELS = Set.of("REAL", "LIKELY_REAL", "SUSPICIOUS", "LIKELY_FAKE", "FAKE");
    static final List<String> REQUIRED_COLUMNS = List.of("product_url", "retailer", "label_human", "notes");

    private static final int SWEEP_FROM = 40;
    private static final int SWEEP_TO = 90;
    private static final int SWEEP_STEP = 5;

    private final DealQueryService dealQueryService;
    private final LabelCandidateCsvWriter csvWriter;
    private final DiscountPipelineProperties properties;

    public record ExportResult(Path path, int rows) {}

    private record LabeledRow(String productUrl, String retailer, String labelHuman) {}

    public ExportResult exportLabelCandidates(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        List<DealView> deals = dealQueryService.latestEvaluations(limit);
        Path path = csvWriter.write(deals);
        return new ExportResult(path, deals.size());
    }

    public CalibrationReport calibrate(Reader csv, boolean sweep) {
        List<LabeledRow> labels = readLabels(csv);

        Map<String, DealView> predictions = new HashMap<>();
        for (DealView deal : dealQueryService.latestEvaluations(Integer.MAX_VALUE)) {
            predictions.putIfAbsent(key(deal.getProductUrl(), deal.getRetailer()), deal);
        }

        int matched = 0;
        int exact = 0;
        int tp = 0, fp = 0, fn = 0, tn = 0;
        Map<String, Integer> confusion = new TreeMap<>();
        List<String> mismatches = new ArrayList<>();
        List<Joined> joined = new ArrayList<>();

        for (LabeledRow row : labels) {
            DealView pred = predictions.get(key(row.productUrl(), row.retailer()));
            if (pred == null) {
                mismatches.add(String.format("MISSING prediction | retailer=%s | url=%s | human=%s",
                        row.retailer(), row.productUrl(), row.labelHuman()));
                continue;
            }
            matched++;
            joined.add(new Joined(row, pred));

            String model = pred.getLabel().name();
            confusion.merge(row.labelHuman() + "->" + model, 1, Integer::sum);
            if (row.labelHuman().equals(model)) {
                exact++;
            } else {
                mismatches.add(String.format(Locale.ROOT,
                        "MISMATCH | retailer=%s | human=%s | pred=%s | score=%.4f | discount=%s | cross=%s | url=%s",
                        row.retailer(), row.labelHuman(), model, pred.getScore(),
                        fmt(pred.getDiscountPct()), fmt(pred.getCrossStoreDeltaPct()), row.productUrl()));
            }

            boolean humanPositive = "REAL".equals(row.labelHuman());
            boolean modelPositive = pred.getLabel().isAtLeast(DiscountLabel.LIKELY_REAL);
            if (humanPositive && modelPositive) tp++;
            else if (modelPositive) fp++;
            else if (humanPositive) fn++;
            else tn++;
        }

        CalibrationReport report = CalibrationReport.builder()
                .scoringVersion(properties.getScoring().getVersion())
                .totalLabeled(labels.size())
                .matched(matched)
                .missing(labels.size() - matched)
                .exactAgreement(exact)
                .truePositives(tp)
                .falsePositives(fp)
                .falseNegatives(fn)
                .trueNegatives(tn)
                .precision(ratio(tp, tp + fp))
                .recall(ratio(tp, tp + fn))
                .accuracy(ratio(exact, matched))
                .confusion(new LinkedHashMap<>(confusion))
                .mismatches(mismatches)
                .build();

        if (sweep && !joined.isEmpty()) {
            List<CalibrationReport.ThresholdResult> ranked = sweep(joined);
            report.setSweep(ranked);
            report.setRecommendedThreshold(ranked.get(0).threshold());
        }

        log.info("Calibration: {} labeled, {} matched, precision={} recall={}",
                labels.size(), matched, report.getPrecision(), report.getRecall());
        return report;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private record Joined(LabeledRow human, DealView model) {}

    private List<CalibrationReport.ThresholdResult> sweep(List<Joined> joined) {
        double minVisible = properties.getScoring().getMinVisibleDiscount();
        List<CalibrationReport.ThresholdResult> results = new ArrayList<>();

        for (int step = SWEEP_FROM; step <= SWEEP_TO; step += SWEEP_STEP) {
            double t = step / 100.0;
            int tp = 0, fp = 0, fn = 0, tn = 0;
            for (Joined j : joined) {
                boolean humanPositive = "REAL".equals(j.human().labelHuman());
                Double discount = j.model().getDiscountPct();
                boolean predicted = j.model().getScore() >= t && discount != null && discount >= minVisible;
                if (humanPositive && predicted) tp++;
                else if (predicted) fp++;
                else if (humanPositive) fn++;
                else tn++;
            }
            results.add(new CalibrationReport.ThresholdResult(t,
                    ratio(tp, tp + fp), ratio(tp, tp + fn), ratio(tp + tn, tp + fp + fn + tn), tp, fp));
        }

        results.sort(Comparator.comparingDouble(CalibrationReport.ThresholdResult::precision).reversed()
                .thenComparing(Comparator.comparingDouble(CalibrationReport.ThresholdResult::recall).reversed())
                .thenComparingDouble(CalibrationReport.ThresholdResult::threshold));
        return results;
    }

    private List<LabeledRow> readLabels(Reader csv) {
        List<LabeledRow> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReader(csv)) {
            String[] header = reader.readNext();
            if (header == null) {
                throw new IllegalArgumentException("Labels CSV is empty");
            }
            Map<String, Integer> index = new HashMap<>();
            for (int i = 0; i < header.length; i++) {
                index.put(header[i].trim().replace("\uFEFF", "").toLowerCase(Locale.ROOT), i);
            }
            List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !index.containsKey(c)).toList();
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException("Missing CSV columns: " + String.join(", ", missing));
            }

            String[] line;
            while ((line = reader.readNext()) != null) {
                String url = cell(line, index.get("product_url"));
                String retailer = cell(line, index.get("retailer"));
                String label = cell(line, index.get("label_human")).toUpperCase(Locale.ROOT);
                if (url.isEmpty() || retailer.isEmpty() || label.isEmpty()) continue;
                if (!VALID_HUMAN_LABELS.contains(label)) {
                    throw new IllegalArgumentException("Invalid label_human '" + label + "' in row for " + url);
                }
                rows.add(new LabeledRow(url, retailer, label));
            }
        } catch (IOException | CsvValidationException e) {
            throw new RuntimeException("CSV read failed", e);
        }
        return rows;
    }

    private static String cell(String[] line, int index) {
        return index < line.length && line[index] != null ? line[index].trim() : "";
    }

    private static String key(String url, String retailer) {
        return (url == null ? "" : url.trim()) + "|" + (retailer == null ? "" : retailer.trim().toLowerCase(Locale.ROOT));
    }

    private static String fmt(Double value) {
        return value == null ? "null" : String.format(Locale.ROOT, "%.4f", value);
    }

    private static double ratio(int num, int den) {
        return den == 0 ? 0.0 : (double) num / den;
    }
}
