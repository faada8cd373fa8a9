package com.example.demo.batchpdf.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.SortedSet;

/**
 * Comparison of the tokens used by the batch's templates against the data columns.
 */
@Value
@Builder
public class PreflightReport {
    /** Inner token expressions as found, e.g. "Name|upper". */
    SortedSet<String> rawTokens;
    /** Column names referenced by the tokens. */
    SortedSet<String> baseTokens;
    /** Token base names with no data column. */
    SortedSet<String> missingColumns;
    /** Data columns no token refers to (TEMPLATE excluded). */
    SortedSet<String> unusedColumns;
    /** Templates that could not be scanned, with the reason. */
    Map<String, String> unreadableTemplates;

    public boolean hasMissingColumns() {
        return missingColumns != null && !missingColumns.isEmpty();
    }
}
