package com.example.demo.batchpdf.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * REST request for a batch run or a preflight.
 *
 * Rows are either given inline ({@code rows}) or read from a CSV/XLSX file
 * ({@code dataPath}). Any option left null falls back to the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {
    @Builder.Default
    private List<Map<String, String>> rows = new ArrayList<>();

    private String dataPath;
    private String sheet;
    private Integer rowFrom;
    private Integer rowTo;

    private String outputDir;
    private String filenamePattern;
    private ExportEngine engine;
    private Boolean dryRun;
    private Boolean strict;
}
