package com.example.demo.batchpdf.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RenderStatus {
    OK("OK"),
    ERROR("ERROR"),
    SKIPPED("SKIPPED"),
    DRY_RUN("DRY-RUN");

    private final String label;

    RenderStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
