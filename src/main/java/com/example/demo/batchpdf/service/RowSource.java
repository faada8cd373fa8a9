package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.exception.DataSourceException;
import com.example.demo.batchpdf.model.DataRow;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the batch input table. CSV files go through Jackson CSV with a header
 * row; .xlsx/.xls workbooks through Apache POI, with every cell rendered the way
 * Excel displays it.
 */
@Slf4j
@Component
public class RowSource {
    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper = new CsvMapper();

    public List<DataRow> read(Path path, String sheet) {
        if (!Files.isRegularFile(path)) {
            throw new DataSourceException("Data file not found: " + path.toAbsolutePath());
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        List<DataRow> rows = name.endsWith(".csv") ? readCsv(path) : readWorkbook(path, sheet);
        log.info("Read {} row(s) from {}", rows.size(), path.getFileName());
        return rows;
    }

    List<DataRow> readCsv(Path path) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> it = csvMapper
                     .readerForMapOf(String.class)
                     .with(schema)
                     .with(CsvParser.Feature.TRIM_SPACES)
                     .readValues(reader)) {
            List<DataRow> rows = new ArrayList<>();
            while (it.hasNext()) {
                rows.add(DataRow.of(stripBom(it.next())));
            }
            return rows;
        } catch (IOException | RuntimeException e) {
            throw new DataSourceException("Could not read CSV " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    List<DataRow> readWorkbook(Path path, String sheetRef) {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            Sheet sheet = selectSheet(workbook, sheetRef);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                return List.of();
            }
            List<String> columns = new ArrayList<>();
            for (int c = 0; c < header.getLastCellNum(); c++) {
                Cell cell = header.getCell(c);
                columns.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator).trim());
            }

            List<DataRow> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (int c = 0; c < columns.size(); c++) {
                    if (columns.get(c).isEmpty()) {
                        continue;
                    }
                    Cell cell = row == null ? null : row.getCell(c);
                    String value = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
                    blank &= value.isBlank();
                    values.put(columns.get(c), value);
                }
                if (blank) {
                    log.debug("Skipping empty spreadsheet row {}", r + 1);
                    continue;
                }
                rows.add(DataRow.of(values));
            }
            return rows;
        } catch (IOException | RuntimeException e) {
            if (e instanceof DataSourceException) {
                throw (DataSourceException) e;
            }
            throw new DataSourceException("Could not read workbook " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static Sheet selectSheet(Workbook workbook, String sheetRef) {
        String ref = sheetRef == null || sheetRef.isBlank() ? "0" : sheetRef.trim();
        Sheet sheet = workbook.getSheet(ref);
        if (sheet == null && ref.chars().allMatch(Character::isDigit)) {
            int index = Integer.parseInt(ref);
            if (index < workbook.getNumberOfSheets()) {
                sheet = workbook.getSheetAt(index);
            }
        }
        if (sheet == null) {
            throw new DataSourceException("Sheet not found: " + ref);
        }
        return sheet;
    }

    private static Map<String, String> stripBom(Map<String, String> row) {
        Map<String, String> out = new LinkedHashMap<>();
        row.forEach((key, value) -> out.put(
                !key.isEmpty() && key.charAt(0) == BOM ? key.substring(1) : key, value));
        return out;
    }
}
