package com.example.demo.batchpdf.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Export engine choice.
 * AUTO prefers the native office application when it is ready, MSOFFICE always
 * tries it first, LIBREOFFICE goes straight to the conversion engine. The
 * conversion engine is the backstop for every choice.
 */
public enum ExportEngine {
    AUTO,
    MSOFFICE,
    LIBREOFFICE;

    @JsonCreator
    public static ExportEngine fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return ExportEngine.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
