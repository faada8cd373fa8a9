package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.model.DocumentKind;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * PPTX adapter.
 *
 * Visiting order: slide masters and their layouts (when enabled), then for each
 * slide its shapes followed by its speaker notes. Tables are visited cell by
 * cell, row-major; group shapes are expanded recursively.
 */
public class SlideDeckDocument implements OfficeDocument {
    private final XMLSlideShow slideShow;

    public SlideDeckDocument(XMLSlideShow slideShow) {
        this.slideShow = slideShow;
    }

    public XMLSlideShow getSlideShow() {
        return slideShow;
    }

    @Override
    public DocumentKind getKind() {
        return DocumentKind.SLIDE_DECK;
    }

    @Override
    public Stream<TextUnit> textUnits(WalkOptions options) {
        Stream<TextUnit> masters = options.isScanMasters()
                ? slideShow.getSlideMasters().stream().flatMap(SlideDeckDocument::masterUnits)
                : Stream.empty();
        Stream<TextUnit> slides = slideShow.getSlides().stream().flatMap(SlideDeckDocument::slideUnits);
        return Stream.concat(masters, slides);
    }

    private static Stream<TextUnit> masterUnits(XSLFSlideMaster master) {
        return Stream.concat(
                shapeUnits(master.getShapes()),
                Arrays.stream(master.getSlideLayouts()).flatMap(layout -> shapeUnits(layout.getShapes())));
    }

    private static Stream<TextUnit> slideUnits(XSLFSlide slide) {
        return Stream.concat(shapeUnits(slide.getShapes()), notesUnits(slide));
    }

    private static Stream<TextUnit> notesUnits(XSLFSlide slide) {
        XSLFNotes notes = slide.getNotes();
        return notes == null ? Stream.empty() : shapeUnits(notes.getShapes());
    }

    private static Stream<TextUnit> shapeUnits(List<XSLFShape> shapes) {
        return shapes.stream().flatMap(SlideDeckDocument::unitsOf);
    }

    private static Stream<TextUnit> unitsOf(XSLFShape shape) {
        if (shape instanceof XSLFTextShape) {
            return paragraphUnits((XSLFTextShape) shape);
        }
        if (shape instanceof XSLFTable) {
            return ((XSLFTable) shape).getRows().stream()
                    .flatMap(row -> row.getCells().stream())
                    .flatMap(SlideDeckDocument::paragraphUnits);
        }
        if (shape instanceof XSLFGroupShape) {
            return shapeUnits(((XSLFGroupShape) shape).getShapes());
        }
        return Stream.empty();
    }

    private static Stream<TextUnit> paragraphUnits(XSLFTextShape textShape) {
        return textShape.getTextParagraphs().stream().map(SlideParagraphUnit::new);
    }

    @Override
    public void save(Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            slideShow.write(out);
        }
    }

    @Override
    public void close() throws IOException {
        slideShow.close();
    }
}
