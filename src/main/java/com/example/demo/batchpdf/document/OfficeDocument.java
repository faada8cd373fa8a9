package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.model.DocumentKind;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * A canonical document loaded in memory, owned by a single render operation.
 */
public interface OfficeDocument extends Closeable {

    DocumentKind getKind();

    /**
     * Lazy, single-use traversal of every text unit in a fixed visiting order.
     * Regions the document does not have are skipped.
     */
    Stream<TextUnit> textUnits(WalkOptions options);

    void save(Path target) throws IOException;
}
