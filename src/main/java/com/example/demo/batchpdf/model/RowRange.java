package com.example.demo.batchpdf.model;

import lombok.Value;

/**
 * Inclusive, 0-based slice of the input rows. A null bound is open.
 */
@Value
public class RowRange {
    public static final RowRange ALL = new RowRange(null, null);

    Integer from;
    Integer to;

    public static RowRange of(Integer from, Integer to) {
        return from == null && to == null ? ALL : new RowRange(from, to);
    }

    public int startIndex(int size) {
        return from == null ? 0 : Math.max(0, Math.min(from, size));
    }

    /** Exclusive end index. */
    public int endIndex(int size) {
        return to == null ? size : Math.max(startIndex(size), Math.min(to + 1, size));
    }
}
