package com.example.demo.batchpdf.document;

/**
 * Smallest text-bearing node of a document (a paragraph), seen as an ordered
 * sequence of styled runs. Implemented once per document model so the
 * substitution logic can be written against this capability only.
 */
public interface TextUnit {

    /**
     * Concatenation of all run texts, in order.
     */
    String getText();

    int getRunCount();

    /**
     * Explicit formatting of the first run, or {@link RunStyle#UNSET} when the unit has no runs.
     */
    RunStyle captureFirstRunStyle();

    /**
     * Removes every run and appends a single run holding {@code text}, then
     * re-applies the non-null attributes of {@code style}.
     */
    void replaceRuns(String text, RunStyle style);
}
