package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.model.DocumentKind;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * DOCX adapter.
 *
 * Visiting order: body paragraphs, body tables (row-major, nested tables
 * depth-first), then headers and footers when enabled.
 */
public class WordDocument implements OfficeDocument {
    private final XWPFDocument document;

    public WordDocument(XWPFDocument document) {
        this.document = document;
    }

    public XWPFDocument getDocument() {
        return document;
    }

    @Override
    public DocumentKind getKind() {
        return DocumentKind.WORD_PROCESSING;
    }

    @Override
    public Stream<TextUnit> textUnits(WalkOptions options) {
        Stream<TextUnit> body = Stream.concat(
                document.getParagraphs().stream().map(WordParagraphUnit::new),
                document.getTables().stream().flatMap(WordDocument::tableUnits));

        if (!options.isScanHeadersFooters()) {
            return body;
        }
        Stream<TextUnit> headers = document.getHeaderList().stream().flatMap(WordDocument::headerFooterUnits);
        Stream<TextUnit> footers = document.getFooterList().stream().flatMap(WordDocument::headerFooterUnits);
        return Stream.of(body, headers, footers).flatMap(s -> s);
    }

    private static Stream<TextUnit> headerFooterUnits(XWPFHeaderFooter part) {
        return Stream.concat(
                part.getParagraphs().stream().map(WordParagraphUnit::new),
                part.getTables().stream().flatMap(WordDocument::tableUnits));
    }

    private static Stream<TextUnit> tableUnits(XWPFTable table) {
        return table.getRows().stream()
                .flatMap(row -> row.getTableCells().stream())
                .flatMap(WordDocument::cellUnits);
    }

    private static Stream<TextUnit> cellUnits(XWPFTableCell cell) {
        return Stream.concat(
                cell.getParagraphs().stream().map(WordParagraphUnit::new),
                cell.getTables().stream().flatMap(WordDocument::tableUnits));
    }

    @Override
    public void save(Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            document.write(out);
        }
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
