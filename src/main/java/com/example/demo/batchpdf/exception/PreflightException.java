package com.example.demo.batchpdf.exception;

import lombok.Getter;

import java.util.Set;

/**
 * Strict preflight failure: templates use tokens that have no matching column.
 */
@Getter
public class PreflightException extends BatchPdfException {
    public static final String STRICT_PREFLIGHT = "STRICT_PREFLIGHT";

    private final Set<String> missingColumns;

    public PreflightException(Set<String> missingColumns) {
        super(STRICT_PREFLIGHT, "Missing data columns for tokens: " + missingColumns);
        this.missingColumns = missingColumns;
    }
}
