package com.example.demo.batchpdf.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one row. Immutable once appended to the result log.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenderResult {
    /** 0-based row index in the input data. */
    int row;
    RenderStatus status;
    String template;
    String output;
    Long bytes;
    Integer pages;
    String error;

    public static RenderResult skipped(int row) {
        return RenderResult.builder().row(row).status(RenderStatus.SKIPPED).build();
    }

    public static RenderResult error(int row, String template, String output, String error) {
        return RenderResult.builder()
                .row(row)
                .status(RenderStatus.ERROR)
                .template(template)
                .output(output)
                .error(error)
                .build();
    }

    /**
     * Flat view with only the populated fields, used by the CSV report.
     */
    public Map<String, Object> toFlatMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("row", row);
        out.put("status", status.getLabel());
        if (template != null) out.put("template", template);
        if (output != null) out.put("output", output);
        if (bytes != null) out.put("bytes", bytes);
        if (pages != null) out.put("pages", pages);
        if (error != null) out.put("error", error);
        return out;
    }
}
