package com.realdiscount.pipeline.output;

import com.opencsv.CSVWriter;
import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.DealView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the latest evaluations to a CSV a human can label.
 *
 * Output path pattern: {outputDir}/label_candidates_{yyyyMMdd_HHmmss}.csv
 *
 * label_human and notes are left blank for the reviewer; the filled-in file is the input of the
 * label calibration report.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LabelCandidateCsvWriter {

    static final String[] HEADERS = {
            "product_url", "retailer",
            "label_human", "notes",
            "label_model", "score",
            "discount_pct", "cross_store_delta_pct",
            "created_at"
    };

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final DiscountPipelineProperties properties;

    public Path write(List<DealView> deals) {
        Path outputDir = Paths.get(properties.getExport().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("label_candidates_%s.csv", ZonedDateTime.now(ZoneOffset.UTC).format(FILE_STAMP));
        Path outputPath = outputDir.resolve(filename);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            write(deals, out);
        } catch (IOException e) {
            log.error("Failed to write label candidates {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }

        log.info("Written {} label candidates to CSV: {}", deals.size(), outputPath);
        return outputPath;
    }

    public void write(List<DealView> deals, Writer out) throws IOException {
        CSVWriter writer = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
        writer.writeNext(HEADERS);
        for (DealView d : deals) {
            writer.writeNext(toRow(d));
        }
        writer.flush();
    }

    private String[] toRow(DealView d) {
        return new String[]{
                str(d.getProductUrl()),
                str(d.getRetailer()),
                "",
                "",
                str(d.getLabel()),
                str(d.getScore()),
                str(d.getDiscountPct()),
                str(d.getCrossStoreDeltaPct()),
                str(d.getCreatedAt())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
