package com.example.demo.batchpdf.exception;

/**
 * Thrown when the TEMPLATE value of a row cannot be turned into a template file.
 */
public class TemplateResolutionException extends BatchPdfException {
    public static final String TEMPLATE_NOT_FOUND = "TEMPLATE_NOT_FOUND";
    public static final String INVALID_TEMPLATE_NAME = "INVALID_TEMPLATE_NAME";
    public static final String TEMPLATE_NAME_MISSING = "TEMPLATE_NAME_MISSING";

    public TemplateResolutionException(String code, String description) {
        super(code, description);
    }
}
