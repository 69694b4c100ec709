package com.ukdataalerts.coronavirus.service;

import com.ukdataalerts.coronavirus.config.AlertsProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellReference;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a population table out of an ONS / NHS England spreadsheet (.xls or .xlsx).
 *
 * The layout (sheet, header row, key column, value columns) comes from
 * configuration because each publisher shapes its workbook differently.
 * Value columns are summed, e.g. the NHS sheet splits people into Under 16 and 16+.
 */
@Component
@Slf4j
public class PopulationWorkbookParser {

    private final DataFormatter formatter = new DataFormatter();

    public Map<String, Long> parse(InputStream workbookStream, AlertsProperties.Workbook layout) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(workbookStream)) {
            Sheet sheet = workbook.getSheet(layout.getSheet());
            if (sheet == null) {
                throw new IOException("Sheet '" + layout.getSheet() + "' not found in population workbook");
            }

            int keyCol = CellReference.convertColStringToIndex(layout.getKeyColumn());
            List<Integer> valueCols = layout.getValueColumns().stream()
                    .map(CellReference::convertColStringToIndex)
                    .toList();
            if (valueCols.isEmpty()) {
                throw new IOException("No value columns configured for sheet '" + layout.getSheet() + "'");
            }

            Map<String, Long> populations = new LinkedHashMap<>();
            int skipped = 0;
            int lastRow = layout.getMaxRows() > 0
                    ? Math.min(sheet.getLastRowNum(), layout.getHeaderRow() + layout.getMaxRows())
                    : sheet.getLastRowNum();

            for (int i = layout.getHeaderRow() + 1; i <= lastRow; i++) {
                Row row = sheet.getRow(i);
                String key = row == null ? "" : formatter.formatCellValue(row.getCell(keyCol)).trim();
                if (key.isEmpty()) {
                    if (layout.getMaxRows() > 0) continue;
                    break;
                }

                Long total = sum(row, valueCols);
                if (total == null) {
                    skipped++;
                    continue;
                }
                populations.put(key, total);
            }

            log.info("Read {} populations from sheet '{}' ({} rows without figures skipped)",
                    populations.size(), layout.getSheet(), skipped);
            return populations;
        }
    }

    private Long sum(Row row, List<Integer> valueCols) {
        long total = 0;
        for (int col : valueCols) {
            Double value = numeric(row.getCell(col));
            if (value == null) {
                return null;
            }
            total += Math.round(value);
        }
        return total;
    }

    private Double numeric(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC) {
            return cell.getNumericCellValue();
        }
        if (type == CellType.STRING) {
            String text = cell.getStringCellValue().replace(",", "").trim();
            try { return Double.parseDouble(text); } catch (NumberFormatException e) { return null; }
        }
        return null;
    }
}
