package com.example.demo.batchpdf.document;

import lombok.Builder;
import lombok.Value;

/**
 * Optional regions to visit while walking a document.
 */
@Value
@Builder
public class WalkOptions {
    public static final WalkOptions ALL = WalkOptions.builder().build();

    /** Slide decks: slide masters and their layouts. */
    @Builder.Default
    boolean scanMasters = true;

    /** Word documents: headers and footers. */
    @Builder.Default
    boolean scanHeadersFooters = true;
}
