package com.example.demo.batchpdf.exception;

/**
 * Raised once every applicable export strategy has been exhausted.
 * The cause is the failure of the last conversion attempt.
 */
public class ExportException extends BatchPdfException {
    public static final String EXPORT_FAILED = "EXPORT_FAILED";

    public ExportException(String description, Throwable cause) {
        super(EXPORT_FAILED, description, cause);
    }
}
