package com.ukdataalerts.coronavirus.output;

import com.opencsv.CSVWriter;
import com.ukdataalerts.coronavirus.config.AlertsProperties;
import com.ukdataalerts.coronavirus.model.AreaResult;
import com.ukdataalerts.coronavirus.model.CheckResult;
import com.ukdataalerts.coronavirus.model.ComparisonWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the full per-area comparison of a check to CSV, alerting or not.
 *
 * Output path pattern: {outputDir}/{metric}_{areaType}_{upperBound}.csv
 * e.g. /data/output/newCasesBySpecimenDate_ltla_2021-03-07.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvReportWriter {

    private final AlertsProperties properties;

    public boolean isEnabled() {
        return properties.getOutput().getCsv().isEnabled();
    }

    public Path write(CheckResult result) {
        ComparisonWindow window = result.getWindow();
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("%s_%s_%s.csv",
                result.getCheck().getMetric(), result.getCheck().getAreaType(), window.upperBound());
        Path outputPath = outputDir.resolve(filename);

        boolean rateColumn = result.getRows().stream().anyMatch(AreaResult::isRateColumn);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers(window, rateColumn));
            }

            for (AreaResult r : result.getRows()) {
                writer.writeNext(toRow(r, rateColumn, result.getAlerts().contains(r)));
            }

            log.info("Written {} rows to CSV: {}", result.getRows().size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    private String[] headers(ComparisonWindow window, boolean rateColumn) {
        List<String> headers = new ArrayList<>(List.of(
                "areaName", "areaCode", window.priorLabel(), window.currentLabel(), "percentageChange"));
        if (rateColumn) {
            headers.add("lastSevenDaysPer100000");
        }
        headers.add("alert");
        return headers.toArray(new String[0]);
    }

    private String[] toRow(AreaResult r, boolean rateColumn, boolean alert) {
        List<String> row = new ArrayList<>(List.of(
                str(r.getAreaName()),
                str(r.getAreaCode()),
                str(r.getPriorAggregate()),
                str(r.getCurrentAggregate()),
                str(r.roundedPercentageChange())));
        if (rateColumn) {
            row.add(str(r.roundedPer100000Rate()));
        }
        row.add(String.valueOf(alert));
        return row.toArray(new String[0]);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
