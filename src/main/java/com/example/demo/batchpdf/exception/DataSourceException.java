package com.example.demo.batchpdf.exception;

public class DataSourceException extends BatchPdfException {
    public static final String DATA_SOURCE_ERROR = "DATA_SOURCE_ERROR";

    public DataSourceException(String description, Throwable cause) {
        super(DATA_SOURCE_ERROR, description, cause);
    }

    public DataSourceException(String description) {
        super(DATA_SOURCE_ERROR, description);
    }
}
