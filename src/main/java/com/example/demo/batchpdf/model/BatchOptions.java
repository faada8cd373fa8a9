package com.example.demo.batchpdf.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Per-batch switches. Everything else comes from {@code BatchPdfProperties}.
 */
@Value
@Builder(toBuilder = true)
public class BatchOptions {
    Path outputDir;
    String filenamePattern;
    @Builder.Default
    ExportEngine engine = ExportEngine.AUTO;
    boolean dryRun;
    boolean strict;
    @Builder.Default
    boolean writeReports = true;
}
