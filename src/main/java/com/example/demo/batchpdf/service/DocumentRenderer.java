package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.aspect.LogExecutionTime;
import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.conversion.FormatNormalizer;
import com.example.demo.batchpdf.document.DocumentFiller;
import com.example.demo.batchpdf.document.OfficeDocument;
import com.example.demo.batchpdf.document.OfficeDocuments;
import com.example.demo.batchpdf.export.ExportEngineSelector;
import com.example.demo.batchpdf.export.ExportOutcome;
import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.model.DocumentKind;
import com.example.demo.batchpdf.model.ExportEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One row, one PDF: normalize the template, fill a private in-memory copy,
 * save it to a scratch directory and export it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRenderer {
    private final FormatNormalizer formatNormalizer;
    private final DocumentFiller documentFiller;
    private final ExportEngineSelector exportEngineSelector;
    private final BatchPdfProperties properties;

    @LogExecutionTime("DocumentRenderer.render")
    public ExportOutcome render(Path template, DataRow row, Path pdfPath, ExportEngine engine) throws IOException {
        Path canonical = formatNormalizer.normalize(template);
        Path scratch = Files.createTempDirectory("batchpdf-render-");
        try {
            Path edited;
            try (OfficeDocument document = OfficeDocuments.open(canonical)) {
                documentFiller.fill(document, row, properties.toWalkOptions());
                edited = scratch.resolve(DocumentKind.stemOf(pdfPath) + "." + document.getKind().getExtension());
                document.save(edited);
            }
            return exportEngineSelector.export(edited, pdfPath, engine);
        } finally {
            try {
                FileSystemUtils.deleteRecursively(scratch);
            } catch (IOException e) {
                log.warn("Could not delete scratch directory {}: {}", scratch, e.getMessage());
            }
        }
    }
}
