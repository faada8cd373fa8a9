package com.example.demo.batchpdf.conversion;

import java.nio.file.Path;
import java.util.Optional;

/**
 * External format transcoding service (LibreOffice in production).
 */
public interface ConversionEngine {

    /**
     * Converts {@code input} into {@code outputDir}.
     *
     * @param targetFormat  target extension or filter name, e.g. "docx", "pdf"
     * @param formatOptions optional filter options appended as "format:options"
     * @return the produced file
     * @throws com.example.demo.batchpdf.exception.ConversionException on a non-zero
     *         exit or when the expected file was not produced
     */
    Path convert(Path input, Path outputDir, String targetFormat, String formatOptions);

    default Path convert(Path input, Path outputDir, String targetFormat) {
        return convert(input, outputDir, targetFormat, null);
    }

    /**
     * Version banner of the engine, empty when it cannot be started.
     */
    Optional<String> detectVersion();

    default String getName() {
        return getClass().getSimpleName();
    }
}
