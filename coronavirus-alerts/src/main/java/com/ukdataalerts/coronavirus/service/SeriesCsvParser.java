package com.ukdataalerts.coronavirus.service;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.ukdataalerts.coronavirus.model.TimeSeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses the dashboard API's CSV download into {@link TimeSeriesPoint}s.
 *
 * Columns are located by header name, not position:
 *   areaCode, areaName, areaType, date, &lt;metricName&gt;
 * The API returns newest dates first; order is preserved.
 */
@Component
@Slf4j
public class SeriesCsvParser {

    static final String COL_AREA_CODE = "areaCode";
    static final String COL_AREA_NAME = "areaName";
    static final String COL_DATE = "date";

    public List<TimeSeriesPoint> parse(Reader csv, String metricName) throws IOException {
        try (CSVReader reader = new CSVReaderBuilder(csv).build()) {
            String[] header = reader.readNext();
            if (header == null) {
                return List.of();
            }

            int areaCodeCol = requireColumn(header, COL_AREA_CODE);
            int areaNameCol = requireColumn(header, COL_AREA_NAME);
            int dateCol = requireColumn(header, COL_DATE);
            int valueCol = requireColumn(header, metricName);

            List<TimeSeriesPoint> points = new ArrayList<>();
            int malformed = 0;
            String[] cols;
            while ((cols = reader.readNext()) != null) {
                if (cols.length == 1 && cols[0].isBlank()) continue;

                LocalDate date = parseDate(safeGet(cols, dateCol));
                String areaName = safeGet(cols, areaNameCol);
                if (date == null || areaName.isEmpty()) {
                    malformed++;
                    continue;
                }

                points.add(new TimeSeriesPoint(
                        areaName,
                        safeGet(cols, areaCodeCol),
                        date,
                        parseDouble(safeGet(cols, valueCol))));
            }

            log.info("Parsed {}: {} rows, {} malformed skipped", metricName, points.size(), malformed);
            return points;

        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV for metric " + metricName + ": " + e.getMessage(), e);
        }
    }

    private int requireColumn(String[] header, String name) throws IOException {
        for (int i = 0; i < header.length; i++) {
            // first header cell may carry a UTF-8 BOM
            if (header[i].replace("\uFEFF", "").trim().equals(name)) {
                return i;
            }
        }
        throw new IOException("Column '" + name + "' missing from CSV header " + Arrays.toString(header));
    }

    private String safeGet(String[] cols, int idx) {
        if (idx >= cols.length) return "";
        return cols[idx] == null ? "" : cols[idx].trim();
    }

    private LocalDate parseDate(String val) {
        if (val.isEmpty()) return null;
        try { return LocalDate.parse(val); } catch (DateTimeParseException e) { return null; }
    }

    private Double parseDouble(String val) {
        if (val.isEmpty()) return null;
        try { return Double.parseDouble(val); } catch (NumberFormatException e) { return null; }
    }
}
