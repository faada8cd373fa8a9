package com.example.demo.batchpdf.document;

import lombok.Builder;
import lombok.Value;

/**
 * Basic character formatting captured from a run before it is removed.
 * A null attribute was not explicitly set on the run and is left to the
 * document defaults when the style is re-applied.
 */
@Value
@Builder
public class RunStyle {
    public static final RunStyle UNSET = RunStyle.builder().build();

    /** Point size. */
    Double fontSize;
    Boolean bold;
    Boolean italic;
    String fontName;
    /** Underline kind as named by the owning document model (e.g. SINGLE, sng, none). */
    String underline;
    /** RGB hex without '#', e.g. "1F3864". */
    String color;
}
