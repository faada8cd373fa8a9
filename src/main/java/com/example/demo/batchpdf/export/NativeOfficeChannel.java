package com.example.demo.batchpdf.export;

import com.example.demo.batchpdf.model.DocumentKind;

import java.nio.file.Path;

/**
 * Fixed-layout export through the office application installed on the host.
 */
public interface NativeOfficeChannel {

    /**
     * Whether the application for this document kind is available. Implementations
     * probe the host at most once and remember the answer.
     */
    boolean isReady(DocumentKind kind);

    /**
     * Exports {@code input} to a PDF at {@code output}.
     *
     * @return true when the application reported success; false when the channel is
     *         not usable for this document
     */
    boolean exportFixedLayout(Path input, Path output);

    /** Releases the application instances. Safe to call more than once. */
    void shutdown();
}
