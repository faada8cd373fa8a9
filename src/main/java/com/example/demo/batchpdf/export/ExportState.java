package com.example.demo.batchpdf.export;

/**
 * States of a single PDF export.
 */
public enum ExportState {
    TRY_PRIMARY,
    TRY_CONVERSION_ENGINE,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
