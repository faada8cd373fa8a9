package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.exception.ExportException;
import com.example.demo.batchpdf.exception.PreflightException;
import com.example.demo.batchpdf.export.ExportOutcome;
import com.example.demo.batchpdf.export.PdfArtifactInspector;
import com.example.demo.batchpdf.export.TestPdfs;
import com.example.demo.batchpdf.model.BatchOptions;
import com.example.demo.batchpdf.model.BatchReport;
import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.model.ExportEngine;
import com.example.demo.batchpdf.model.PreflightReport;
import com.example.demo.batchpdf.model.RenderResult;
import com.example.demo.batchpdf.model.RenderStatus;
import com.example.demo.batchpdf.model.RowRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the batch loop. Template scanning and rendering are mocked;
 * resolution, naming and reporting are real.
 */
@DisplayName("Batch render service")
public class BatchRenderServiceTest {

    @TempDir
    Path tempDir;

    private TemplatePreflight templatePreflight;
    private DocumentRenderer documentRenderer;
    private BatchPdfProperties properties;
    private BatchRenderService service;
    private Path outputDir;
    private BatchOptions options;

    @BeforeEach
    public void setup() throws Exception {
        Path templates = Files.createDirectory(tempDir.resolve("plantillas"));
        Files.writeString(templates.resolve("carta.docx"), "x");
        Files.writeString(templates.resolve("diploma.pptx"), "x");
        outputDir = tempDir.resolve("salida");

        properties = new BatchPdfProperties();
        properties.setTemplateDir(templates.toString());
        properties.setOutputDir(outputDir.toString());

        templatePreflight = mock(TemplatePreflight.class);
        when(templatePreflight.check(any(), anyBoolean())).thenReturn(PreflightReport.builder()
                .rawTokens(new TreeSet<>()).baseTokens(new TreeSet<>())
                .missingColumns(new TreeSet<>()).unusedColumns(new TreeSet<>())
                .unreadableTemplates(Map.of())
                .build());

        documentRenderer = mock(DocumentRenderer.class);
        when(documentRenderer.render(any(), any(), any(), any())).thenAnswer(invocation -> {
            Path pdf = invocation.getArgument(2);
            TestPdfs.write(pdf, 2);
            return ExportOutcome.builder().output(pdf).engine(ExportEngine.LIBREOFFICE).conversionAttempts(1).build();
        });

        service = new BatchRenderService(templatePreflight, new TemplateResolver(properties),
                new FilenamePatternExpander(), documentRenderer, new PdfArtifactInspector(), new ReportWriter(), properties);
        options = properties.toBatchOptions();
    }

    private static DataRow row(String... keyValues) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put(keyValues[i], keyValues[i + 1]);
        }
        return DataRow.of(values);
    }

    private static List<RenderStatus> statuses(BatchReport report) {
        return report.getResults().stream().map(RenderResult::getStatus).collect(Collectors.toList());
    }

    @Test
    @DisplayName("One failing row never stops the batch and results keep row order")
    public void testFailureIsolation() throws Exception {
        doThrow(new ExportException("PDF export of Eva failed", new RuntimeException("soffice crashed")))
                .when(documentRenderer).render(any(), any(), eq(outputDir.resolve("Eva - 2024.pdf")), any());

        BatchReport report = service.runBatch(List.of(
                row("TEMPLATE", "carta.docx", "NOMBRE", "Ana", "SALIDA", "2024"),
                row("TEMPLATE", "no-existe.docx", "NOMBRE", "Luis", "SALIDA", "2024"),
                row("TEMPLATE", "carta.docx", "NOMBRE", "Eva", "SALIDA", "2024"),
                row("TEMPLATE", "diploma.pptx", "NOMBRE", "Rosa", "SALIDA", "2024")), options);

        assertEquals(List.of(RenderStatus.OK, RenderStatus.ERROR, RenderStatus.ERROR, RenderStatus.OK), statuses(report));
        assertEquals(List.of(0, 1, 2, 3), report.getResults().stream().map(RenderResult::getRow).collect(Collectors.toList()));

        RenderResult ok = report.getResults().get(0);
        assertEquals("carta.docx", ok.getTemplate());
        assertEquals(outputDir.resolve("Ana - 2024.pdf").toString(), ok.getOutput());
        assertTrue(ok.getBytes() > 0);
        assertEquals(2, ok.getPages());

        assertTrue(report.getResults().get(1).getError().contains("Template not found"));
        assertEquals("PDF export of Eva failed", report.getResults().get(2).getError());
        assertEquals(outputDir.resolve("Eva - 2024.pdf").toString(), report.getResults().get(2).getOutput());
        assertThrows(UnsupportedOperationException.class, () -> report.getResults().add(RenderResult.skipped(9)));
    }

    @Test
    @DisplayName("SKIP accepts the usual truthy spellings")
    public void testSkip() {
        List<DataRow> rows = List.of("1", "true", "Sí", "si", "X", "y", "YES", "0", "no", "").stream()
                .map(value -> row("TEMPLATE", "carta.docx", "NOMBRE", "N" + value, "SALIDA", "s", "SKIP", value))
                .collect(Collectors.toList());

        BatchReport report = service.runBatch(rows, options.toBuilder().dryRun(true).build());

        assertEquals(7, report.count(RenderStatus.SKIPPED));
        assertEquals(3, report.count(RenderStatus.DRY_RUN));
    }

    @Test
    @DisplayName("Dry run resolves names but renders nothing")
    public void testDryRun() throws Exception {
        BatchReport report = service.runBatch(List.of(
                row("TEMPLATE", "carta.docx", "NOMBRE", "Ana", "SALIDA", "2024")), options.toBuilder().dryRun(true).build());

        RenderResult result = report.getResults().get(0);
        assertEquals(RenderStatus.DRY_RUN, result.getStatus());
        assertEquals(outputDir.resolve("Ana - 2024.pdf").toString(), result.getOutput());
        assertNull(result.getBytes());
        verify(documentRenderer, never()).render(any(), any(), any(), any());
        assertFalse(Files.exists(outputDir.resolve("Ana - 2024.pdf")));
    }

    @Test
    @DisplayName("OUTPUT column routes the PDF into a sanitized subfolder")
    public void testOutputSubfolder() {
        BatchReport report = service.runBatch(List.of(
                row("TEMPLATE", "carta.docx", "NOMBRE", "Ana", "SALIDA", "2024", "OUTPUT", "1º A/B"),
                row("TEMPLATE", "carta.docx", "NOMBRE", "Luis", "SALIDA", "2024", "OUTPUT", "..")), options);

        assertEquals(outputDir.resolve("1º A_B").resolve("Ana - 2024.pdf").toString(), report.getResults().get(0).getOutput());
        assertTrue(Files.exists(outputDir.resolve("1º A_B").resolve("Ana - 2024.pdf")));
        assertEquals(outputDir.resolve("_").resolve("Luis - 2024.pdf").toString(), report.getResults().get(1).getOutput());
    }

    @Test
    @DisplayName("Characters the file system rejects in OUTPUT or TEMPLATE fail only that row")
    public void testInvalidPathCharactersAreRowErrors() {
        BatchReport report = service.runBatch(List.of(
                row("TEMPLATE", "carta.docx", "NOMBRE", "Ana", "SALIDA", "2024", "OUTPUT", "a\u0000b"),
                row("TEMPLATE", "car\u0000ta.docx", "NOMBRE", "Eva", "SALIDA", "2024"),
                row("TEMPLATE", "carta.docx", "NOMBRE", "Luis", "SALIDA", "2024")), options);

        assertEquals(List.of(RenderStatus.ERROR, RenderStatus.ERROR, RenderStatus.OK), statuses(report));
        assertTrue(report.getResults().get(0).getError().startsWith("InvalidPathException"));
        assertTrue(report.getResults().get(1).getError().startsWith("InvalidPathException"));
        assertTrue(Files.exists(outputDir.resolve("Luis - 2024.pdf")));
    }

    @Test
    @DisplayName("Missing filename column and missing required column are row errors")
    public void testRowConfigurationErrors() {
        BatchReport report = service.runBatch(List.of(
                row("TEMPLATE", "carta.docx", "NOMBRE", "Ana"),
                row("NOMBRE", "Luis", "SALIDA", "2024")), options);

        assertEquals(List.of(RenderStatus.ERROR, RenderStatus.ERROR), statuses(report));
        assertTrue(report.getResults().get(0).getError().contains("SALIDA"));
        assertNull(report.getResults().get(0).getOutput());
        assertTrue(report.getResults().get(1).getError().contains("TEMPLATE"));
    }

    @Test
    @DisplayName("Column formatters are applied before the row is rendered")
    public void testColumnFormatters() throws Exception {
        properties.getColumnFormatters().put("Importe", "euros");
        properties.getColumnFormatters().put("Fecha", "dmy");

        service.runBatch(List.of(row("TEMPLATE", "carta.docx", "NOMBRE", "Ana", "SALIDA", "2024",
                "Importe", "1234,5", "Fecha", "2024-03-05")), options);

        ArgumentCaptor<DataRow> captor = ArgumentCaptor.forClass(DataRow.class);
        verify(documentRenderer).render(any(), captor.capture(), any(), any());
        assertEquals("1.234,50 €", captor.getValue().get("Importe"));
        assertEquals("05/03/2024", captor.getValue().get("Fecha"));
    }

    @Test
    @DisplayName("Row range keeps the original row indices")
    public void testRowRange() {
        List<DataRow> rows = List.of("a", "b", "c", "d").stream()
                .map(name -> row("TEMPLATE", "carta.docx", "NOMBRE", name, "SALIDA", "x"))
                .collect(Collectors.toList());

        BatchReport report = service.runBatch(rows, RowRange.of(1, 2), options.toBuilder().dryRun(true).build());

        assertEquals(List.of(1, 2), report.getResults().stream().map(RenderResult::getRow).collect(Collectors.toList()));
        verify(templatePreflight).check(eq(rows.subList(1, 3)), eq(false));
    }

    @Test
    @DisplayName("index placeholder is the row index")
    public void testIndexInFilename() {
        BatchReport report = service.runBatch(List.of(
                row("TEMPLATE", "carta.docx", "Empresa", "ACME"),
                row("TEMPLATE", "carta.docx", "Empresa", "Initech")),
                options.toBuilder().filenamePattern("{index:04d}_{Empresa}.pdf").dryRun(true).build());

        assertEquals(outputDir.resolve("0001_Initech.pdf").toString(), report.getResults().get(1).getOutput());
    }

    @Test
    public void testReportsWritten() {
        service.runBatch(List.of(row("TEMPLATE", "carta.docx", "NOMBRE", "Ana", "SALIDA", "2024")), options);

        assertTrue(Files.exists(outputDir.resolve(ReportWriter.JSON_REPORT)));
        assertTrue(Files.exists(outputDir.resolve(ReportWriter.CSV_REPORT)));
    }

    @Test
    @DisplayName("Strict preflight failure stops the batch before any row")
    public void testStrictPreflightAborts() throws Exception {
        when(templatePreflight.check(any(), eq(true))).thenThrow(new PreflightException(Set.of("B")));

        assertThrows(PreflightException.class, () -> service.runBatch(List.of(
                row("TEMPLATE", "carta.docx", "NOMBRE", "Ana", "SALIDA", "2024")), options.toBuilder().strict(true).build()));
        verify(documentRenderer, never()).render(any(), any(), any(), any());
        assertFalse(Files.exists(outputDir.resolve(ReportWriter.JSON_REPORT)));
    }
}
