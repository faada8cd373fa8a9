package com.example.demo.batchpdf.exception;

import lombok.Getter;

/**
 * Base exception for the batch pipeline.
 * Carries a machine readable code and a human readable description so callers
 * (controllers, the result log) can report failures without parsing messages.
 */
@Getter
public class BatchPdfException extends RuntimeException {
    private final String code;
    private final String description;

    public BatchPdfException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public BatchPdfException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
