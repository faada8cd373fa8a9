package com.example.demo.batchpdf.exception;

public class UnsupportedTemplateFormatException extends BatchPdfException {
    public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";

    public UnsupportedTemplateFormatException(String extension) {
        super(UNSUPPORTED_FORMAT, "Unsupported template extension: " + extension);
    }
}
