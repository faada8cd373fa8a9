package com.example.demo.batchpdf.export;

import com.example.demo.batchpdf.aspect.LogExecutionTime;
import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.conversion.ConversionEngine;
import com.example.demo.batchpdf.exception.ConversionException;
import com.example.demo.batchpdf.exception.ExportException;
import com.example.demo.batchpdf.exception.UnsupportedTemplateFormatException;
import com.example.demo.batchpdf.model.DocumentKind;
import com.example.demo.batchpdf.model.ExportEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Exports an edited document to PDF.
 *
 * <pre>
 *   AUTO        -> TRY_PRIMARY if the native application is ready, else TRY_CONVERSION_ENGINE
 *   MSOFFICE    -> TRY_PRIMARY
 *   LIBREOFFICE -> TRY_CONVERSION_ENGINE
 *
 *   TRY_PRIMARY           -- ok --> SUCCEEDED
 *                         -- unavailable or failed --> TRY_CONVERSION_ENGINE
 *   TRY_CONVERSION_ENGINE -- ok --> SUCCEEDED
 *                         -- failed, tries left --> TRY_CONVERSION_ENGINE
 *                         -- failed, retries + 1 tries made --> FAILED
 * </pre>
 *
 * Each attempt writes into its own scratch directory; the PDF is moved to the
 * requested output path only after it has been found there.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportEngineSelector {
    private final NativeOfficeChannel nativeChannel;
    private final ConversionEngine conversionEngine;
    private final BatchPdfProperties properties;

    @LogExecutionTime("ExportEngineSelector.export")
    public ExportOutcome export(Path edited, Path output, ExportEngine choice) {
        DocumentKind kind = DocumentKind.fromPath(edited)
                .orElseThrow(() -> new UnsupportedTemplateFormatException("." + DocumentKind.extensionOf(edited)));
        int maxAttempts = Math.max(0, properties.getExportRetries()) + 1;

        ExportState state = initialState(choice == null ? ExportEngine.AUTO : choice, kind);
        ExportEngine usedEngine = null;
        int attempts = 0;
        RuntimeException lastFailure = null;

        while (!state.isTerminal()) {
            switch (state) {
                case TRY_PRIMARY:
                    if (tryNative(kind, edited, output)) {
                        usedEngine = ExportEngine.MSOFFICE;
                        state = ExportState.SUCCEEDED;
                    } else {
                        state = ExportState.TRY_CONVERSION_ENGINE;
                    }
                    break;
                case TRY_CONVERSION_ENGINE:
                    attempts++;
                    try {
                        attemptConversion(edited, output);
                        usedEngine = ExportEngine.LIBREOFFICE;
                        state = ExportState.SUCCEEDED;
                    } catch (RuntimeException e) {
                        lastFailure = e;
                        log.warn("{} export attempt {}/{} for {} failed: {}", conversionEngine.getName(),
                                attempts, maxAttempts, edited.getFileName(), e.getMessage());
                        if (attempts >= maxAttempts) {
                            state = ExportState.FAILED;
                        }
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected export state " + state);
            }
        }

        if (state == ExportState.FAILED) {
            throw new ExportException("PDF export of " + edited.getFileName() + " failed after "
                    + attempts + " attempt(s): " + lastFailure.getMessage(), lastFailure);
        }
        log.debug("Exported {} with {} ({} conversion attempt(s))", output.getFileName(), usedEngine, attempts);
        return ExportOutcome.builder()
                .output(output)
                .engine(usedEngine)
                .conversionAttempts(attempts)
                .build();
    }

    ExportState initialState(ExportEngine choice, DocumentKind kind) {
        switch (choice) {
            case MSOFFICE:
                return ExportState.TRY_PRIMARY;
            case LIBREOFFICE:
                return ExportState.TRY_CONVERSION_ENGINE;
            case AUTO:
            default:
                return nativeChannel.isReady(kind) ? ExportState.TRY_PRIMARY : ExportState.TRY_CONVERSION_ENGINE;
        }
    }

    private boolean tryNative(DocumentKind kind, Path edited, Path output) {
        if (!nativeChannel.isReady(kind)) {
            log.info("Native office export unavailable for {}; using {}", kind, conversionEngine.getName());
            return false;
        }
        Path scratch = createScratch();
        try {
            Path pdf = scratch.resolve(DocumentKind.stemOf(edited) + ".pdf");
            if (!nativeChannel.exportFixedLayout(edited, pdf) || !Files.exists(pdf)) {
                log.warn("Native office export of {} did not produce a PDF; using {}",
                        edited.getFileName(), conversionEngine.getName());
                return false;
            }
            moveInto(pdf, output);
            return true;
        } catch (RuntimeException e) {
            log.warn("Native office export of {} failed: {}; using {}",
                    edited.getFileName(), e.getMessage(), conversionEngine.getName());
            return false;
        } finally {
            deleteScratch(scratch);
        }
    }

    private void attemptConversion(Path edited, Path output) {
        Path scratch = createScratch();
        try {
            conversionEngine.convert(edited, scratch, properties.getPdfFilter(), properties.getPdfFilterOptions());
            Path pdf = scratch.resolve(DocumentKind.stemOf(edited) + ".pdf");
            if (!Files.exists(pdf)) {
                throw new ConversionException(ConversionException.MISSING_ARTIFACT,
                        conversionEngine.getName() + " did not produce " + pdf.getFileName());
            }
            moveInto(pdf, output);
        } finally {
            deleteScratch(scratch);
        }
    }

    private static void moveInto(Path pdf, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.move(pdf, output, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ConversionException(ConversionException.CONVERSION_FAILED,
                    "Could not move PDF to " + output + ": " + e.getMessage(), e);
        }
    }

    private static Path createScratch() {
        try {
            return Files.createTempDirectory("batchpdf-export-");
        } catch (IOException e) {
            throw new ConversionException(ConversionException.CONVERSION_FAILED,
                    "Could not create a scratch directory: " + e.getMessage(), e);
        }
    }

    private static void deleteScratch(Path scratch) {
        try {
            FileSystemUtils.deleteRecursively(scratch);
        } catch (IOException e) {
            log.warn("Could not delete scratch directory {}: {}", scratch, e.getMessage());
        }
    }
}
