package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.aspect.LogExecutionTime;
import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.exception.BatchPdfException;
import com.example.demo.batchpdf.exception.RowConfigurationException;
import com.example.demo.batchpdf.export.ExportOutcome;
import com.example.demo.batchpdf.export.PdfArtifactInspector;
import com.example.demo.batchpdf.model.BatchOptions;
import com.example.demo.batchpdf.model.BatchReport;
import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.model.PreflightReport;
import com.example.demo.batchpdf.model.RenderResult;
import com.example.demo.batchpdf.model.RenderStatus;
import com.example.demo.batchpdf.model.RowRange;
import com.example.demo.batchpdf.token.TokenFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs a batch: preflight once, then every row in order through
 * resolve, fill and export, collecting one {@link RenderResult} per row.
 *
 * Rows are processed one at a time. A failing row is recorded and the loop
 * moves on; only a strict preflight failure stops the batch, and it does so
 * before the first row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchRenderService {
    public static final String SKIP_COLUMN = "SKIP";
    public static final String OUTPUT_COLUMN = "OUTPUT";
    static final String OUTPUT_DIR_ERROR = "OUTPUT_DIR_ERROR";
    static final Set<String> SKIP_VALUES = Set.of("1", "true", "sí", "si", "x", "y", "yes");

    private final TemplatePreflight templatePreflight;
    private final TemplateResolver templateResolver;
    private final FilenamePatternExpander filenamePatternExpander;
    private final DocumentRenderer documentRenderer;
    private final PdfArtifactInspector pdfArtifactInspector;
    private final ReportWriter reportWriter;
    private final BatchPdfProperties properties;

    public BatchReport runBatch(List<DataRow> rows, BatchOptions options) {
        return runBatch(rows, RowRange.ALL, options);
    }

    @LogExecutionTime("BatchRenderService.runBatch")
    public BatchReport runBatch(List<DataRow> rows, RowRange range, BatchOptions options) {
        int start = range.startIndex(rows.size());
        int end = range.endIndex(rows.size());
        List<DataRow> selected = rows.subList(start, end);

        PreflightReport preflight = templatePreflight.check(selected, options.isStrict());

        int total = selected.size();
        log.info("Rows to process: {}", total);

        List<RenderResult> results = new ArrayList<>(total);
        for (int i = start; i < end; i++) {
            String progress = "[" + (i - start + 1) + "/" + total + "]";
            results.add(processRow(rows.get(i), i, progress, options));
        }

        if (options.isWriteReports()) {
            reportWriter.write(options.getOutputDir(), results);
        }

        BatchReport report = BatchReport.builder()
                .preflight(preflight)
                .results(Collections.unmodifiableList(results))
                .build();
        log.info("Batch finished: {} OK, {} error(s), {} skipped, {} dry-run",
                report.count(RenderStatus.OK), report.count(RenderStatus.ERROR),
                report.count(RenderStatus.SKIPPED), report.count(RenderStatus.DRY_RUN));
        return report;
    }

    RenderResult processRow(DataRow row, int index, String progress, BatchOptions options) {
        if (isSkipped(row)) {
            log.info("{} SKIP set, row skipped", progress);
            return RenderResult.skipped(index);
        }

        String templateName = templateResolver.templateNameFor(row);
        Path template;
        Path pdfPath;
        try {
            checkRequiredColumns(row);
            template = templateResolver.resolve(templateName);
            row = applyColumnFormatters(row);
            pdfPath = outputPathFor(row, index, options);
        } catch (RuntimeException e) {
            String message = describe(e);
            log.error("{} Row {} ({}): {}", progress, index, templateName, message);
            return RenderResult.error(index, templateName, null, message);
        }

        if (options.isDryRun()) {
            log.info("{} [DRY-RUN] Template={} -> {}", progress, template.getFileName(), pdfPath.getFileName());
            return RenderResult.builder()
                    .row(index)
                    .status(RenderStatus.DRY_RUN)
                    .template(templateName)
                    .output(pdfPath.toString())
                    .build();
        }

        try {
            log.info("{} {} -> {}", progress, template.getFileName(), pdfPath.getFileName());
            ExportOutcome outcome = documentRenderer.render(template, row, pdfPath, options.getEngine());
            log.debug("{} exported with {}", progress, outcome.getEngine());
            return RenderResult.builder()
                    .row(index)
                    .status(RenderStatus.OK)
                    .template(templateName)
                    .output(pdfPath.toString())
                    .bytes(Files.exists(pdfPath) ? Files.size(pdfPath) : 0L)
                    .pages(pdfArtifactInspector.pageCount(pdfPath).orElse(null))
                    .build();
        } catch (Exception e) {
            String message = describe(e);
            log.error("Row {} ({}) failed: {}", index, template.getFileName(), message, e);
            return RenderResult.error(index, templateName, pdfPath.toString(), message);
        }
    }

    private static String describe(Exception e) {
        return e instanceof BatchPdfException
                ? ((BatchPdfException) e).getDescription()
                : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    static boolean isSkipped(DataRow row) {
        String value = row.getIgnoreCase(SKIP_COLUMN).trim().toLowerCase(Locale.ROOT);
        return SKIP_VALUES.contains(value);
    }

    private void checkRequiredColumns(DataRow row) {
        List<String> missing = new ArrayList<>();
        for (String column : properties.getRequiredColumns()) {
            if (!row.hasColumnIgnoreCase(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new RowConfigurationException("Missing required columns: " + missing
                    + ". Available: " + row.columns());
        }
    }

    DataRow applyColumnFormatters(DataRow row) {
        DataRow formatted = row;
        for (Map.Entry<String, String> entry : properties.getColumnFormatters().entrySet()) {
            String column = entry.getKey();
            if (formatted.hasColumn(column)) {
                formatted = formatted.withValue(column, TokenFilters.apply(entry.getValue(), formatted.get(column)));
            }
        }
        return formatted;
    }

    private Path outputPathFor(DataRow row, int index, BatchOptions options) {
        String fileName = filenamePatternExpander.expand(options.getFilenamePattern(), row, index);
        Path targetDir = options.getOutputDir();
        String subfolder = row.getIgnoreCase(OUTPUT_COLUMN).trim();
        if (!subfolder.isEmpty()) {
            String folder = FilenamePatternExpander.sanitize(subfolder);
            targetDir = targetDir.resolve(folder.matches("\\.+") ? "_" : folder);
        }
        try {
            Files.createDirectories(targetDir);
        } catch (IOException e) {
            throw new BatchPdfException(OUTPUT_DIR_ERROR, "Cannot create output directory " + targetDir + ": " + e.getMessage(), e);
        }
        return targetDir.resolve(fileName);
    }
}
