package com.example.demo.batchpdf.exception;

/**
 * A row cannot be processed because of its data: a required column is empty or
 * the output filename pattern references a column the row does not have.
 */
public class RowConfigurationException extends BatchPdfException {
    public static final String MISSING_COLUMN = "MISSING_COLUMN";

    public RowConfigurationException(String description) {
        super(MISSING_COLUMN, description);
    }
}
