package com.example.demo.batchpdf.export;

import com.example.demo.batchpdf.model.ExportEngine;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class ExportOutcome {
    Path output;
    /** MSOFFICE or LIBREOFFICE, never AUTO. */
    ExportEngine engine;
    /** Conversion engine attempts made; 0 when the native channel succeeded first. */
    int conversionAttempts;
}
