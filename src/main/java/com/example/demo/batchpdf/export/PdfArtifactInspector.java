package com.example.demo.batchpdf.export;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
@Component
public class PdfArtifactInspector {

    /**
     * Page count of a produced PDF, or empty when PDFBox cannot read it.
     */
    public Optional<Integer> pageCount(Path pdf) {
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            return Optional.of(document.getNumberOfPages());
        } catch (IOException e) {
            log.warn("Could not read produced PDF {}: {}", pdf, e.getMessage());
            return Optional.empty();
        }
    }
}
