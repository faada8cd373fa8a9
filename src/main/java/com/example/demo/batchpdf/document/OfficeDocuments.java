package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.exception.UnsupportedTemplateFormatException;
import com.example.demo.batchpdf.model.DocumentKind;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens canonical documents. The file is read into memory, so the source
 * (possibly a cached conversion shared by many rows) is never modified.
 */
public final class OfficeDocuments {

    private OfficeDocuments() {
    }

    public static OfficeDocument open(Path path) throws IOException {
        DocumentKind kind = DocumentKind.fromPath(path)
                .orElseThrow(() -> new UnsupportedTemplateFormatException("." + DocumentKind.extensionOf(path)));

        try (InputStream in = Files.newInputStream(path)) {
            switch (kind) {
                case WORD_PROCESSING:
                    return new WordDocument(new XWPFDocument(in));
                case SLIDE_DECK:
                    return new SlideDeckDocument(new XMLSlideShow(in));
                default:
                    throw new IllegalStateException("Unhandled document kind: " + kind);
            }
        }
    }
}
