package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.exception.DataSourceException;
import com.example.demo.batchpdf.model.BatchOptions;
import com.example.demo.batchpdf.model.BatchReport;
import com.example.demo.batchpdf.model.BatchRequest;
import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.model.PreflightReport;
import com.example.demo.batchpdf.model.RowRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point shared by the REST API and the startup runner: merges a request
 * with the configured defaults, loads the rows and hands them to the batch loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchLauncher {
    private final BatchRenderService batchRenderService;
    private final TemplatePreflight templatePreflight;
    private final RowSource rowSource;
    private final BatchPdfProperties properties;

    public BatchReport run(BatchRequest request) {
        return batchRenderService.runBatch(rows(request), range(request), options(request));
    }

    public PreflightReport preflight(BatchRequest request) {
        RowRange range = range(request);
        List<DataRow> rows = rows(request);
        List<DataRow> selected = rows.subList(range.startIndex(rows.size()), range.endIndex(rows.size()));
        return templatePreflight.check(selected, Boolean.TRUE.equals(request.getStrict()));
    }

    /**
     * Batch described entirely by configuration.
     */
    public BatchReport runConfigured() {
        return run(new BatchRequest());
    }

    List<DataRow> rows(BatchRequest request) {
        if (request.getRows() != null && !request.getRows().isEmpty()) {
            return request.getRows().stream().map(DataRow::of).collect(Collectors.toList());
        }
        String dataPath = request.getDataPath() != null ? request.getDataPath() : properties.getDataPath();
        if (dataPath == null || dataPath.isBlank()) {
            throw new DataSourceException("No rows given and no data path configured");
        }
        String sheet = request.getSheet() != null ? request.getSheet() : properties.getSheet();
        return rowSource.read(Path.of(dataPath), sheet);
    }

    RowRange range(BatchRequest request) {
        Integer from = request.getRowFrom() != null ? request.getRowFrom() : properties.getRowFrom();
        Integer to = request.getRowTo() != null ? request.getRowTo() : properties.getRowTo();
        return RowRange.of(from, to);
    }

    BatchOptions options(BatchRequest request) {
        BatchOptions.BatchOptionsBuilder builder = properties.toBatchOptions().toBuilder();
        if (request.getOutputDir() != null) {
            builder.outputDir(Path.of(request.getOutputDir()));
        }
        if (request.getFilenamePattern() != null) {
            builder.filenamePattern(request.getFilenamePattern());
        }
        if (request.getEngine() != null) {
            builder.engine(request.getEngine());
        }
        if (request.getDryRun() != null) {
            builder.dryRun(request.getDryRun());
        }
        if (request.getStrict() != null) {
            builder.strict(request.getStrict());
        }
        return builder.build();
    }
}
