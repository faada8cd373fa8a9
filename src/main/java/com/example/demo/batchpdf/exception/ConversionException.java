package com.example.demo.batchpdf.exception;

/**
 * Failure of the external conversion engine: non-zero exit, process start
 * failure, or a missing produced artifact.
 */
public class ConversionException extends BatchPdfException {
    public static final String CONVERSION_FAILED = "CONVERSION_FAILED";
    public static final String MISSING_ARTIFACT = "MISSING_ARTIFACT";

    public ConversionException(String code, String description) {
        super(code, description);
    }

    public ConversionException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
