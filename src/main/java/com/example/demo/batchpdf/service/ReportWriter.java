package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.model.RenderResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Writes {@code _report.json} and {@code _report.csv} next to the produced PDFs.
 * A report that cannot be written is logged and does not fail the batch.
 */
@Slf4j
@Component
public class ReportWriter {
    public static final String JSON_REPORT = "_report.json";
    public static final String CSV_REPORT = "_report.csv";

    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final CsvMapper csvMapper = new CsvMapper();

    public void write(Path outputDir, List<RenderResult> results) {
        List<Map<String, Object>> rows = results.stream()
                .map(RenderResult::toFlatMap)
                .collect(Collectors.toList());

        Path json = outputDir.resolve(JSON_REPORT);
        try {
            Files.createDirectories(outputDir);
            try (Writer writer = Files.newBufferedWriter(json, StandardCharsets.UTF_8)) {
                jsonMapper.writeValue(writer, rows);
            }
            log.info("Report saved to: {}", json);
        } catch (IOException e) {
            log.warn("Could not write JSON report {}: {}", json, e.getMessage());
        }

        Path csv = outputDir.resolve(CSV_REPORT);
        try {
            Files.createDirectories(outputDir);
            try (Writer writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
                csvMapper.writer(csvSchema(rows)).writeValues(writer).writeAll(rows).close();
            }
            log.info("Report saved to: {}", csv);
        } catch (IOException e) {
            log.warn("Could not write CSV report {}: {}", csv, e.getMessage());
        }
    }

    /**
     * Header is the sorted union of the keys of every result.
     */
    static CsvSchema csvSchema(List<Map<String, Object>> rows) {
        Set<String> keys = new TreeSet<>();
        rows.forEach(row -> keys.addAll(row.keySet()));
        CsvSchema.Builder builder = CsvSchema.builder();
        keys.forEach(builder::addColumn);
        return builder.build().withHeader();
    }
}
