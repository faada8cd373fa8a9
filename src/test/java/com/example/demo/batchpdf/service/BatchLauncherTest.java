package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.exception.DataSourceException;
import com.example.demo.batchpdf.model.BatchOptions;
import com.example.demo.batchpdf.model.BatchRequest;
import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.model.ExportEngine;
import com.example.demo.batchpdf.model.RowRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class BatchLauncherTest {

    @TempDir
    Path tempDir;

    private BatchRenderService batchRenderService;
    private TemplatePreflight templatePreflight;
    private BatchPdfProperties properties;
    private BatchLauncher launcher;

    @BeforeEach
    public void setup() {
        batchRenderService = mock(BatchRenderService.class);
        templatePreflight = mock(TemplatePreflight.class);
        properties = new BatchPdfProperties();
        properties.setOutputDir(tempDir.resolve("salida").toString());
        properties.setEngine(ExportEngine.LIBREOFFICE);
        properties.setDryRun(true);
        launcher = new BatchLauncher(batchRenderService, templatePreflight, new RowSource(), properties);
    }

    @Test
    public void testOptionsFallBackToConfiguration() {
        BatchOptions options = launcher.options(new BatchRequest());

        assertEquals(tempDir.resolve("salida"), options.getOutputDir());
        assertEquals("{NOMBRE} - {SALIDA}.pdf", options.getFilenamePattern());
        assertEquals(ExportEngine.LIBREOFFICE, options.getEngine());
        assertTrue(options.isDryRun());
        assertFalse(options.isStrict());
        assertTrue(options.isWriteReports());
    }

    @Test
    public void testRequestOverridesConfiguration() {
        BatchOptions options = launcher.options(BatchRequest.builder()
                .outputDir("/tmp/otra")
                .filenamePattern("{index}.pdf")
                .engine(ExportEngine.AUTO)
                .dryRun(false)
                .strict(true)
                .build());

        assertEquals(Path.of("/tmp/otra"), options.getOutputDir());
        assertEquals("{index}.pdf", options.getFilenamePattern());
        assertEquals(ExportEngine.AUTO, options.getEngine());
        assertFalse(options.isDryRun());
        assertTrue(options.isStrict());
    }

    @Test
    public void testRangeFromRequestOrConfiguration() {
        properties.setRowFrom(2);
        properties.setRowTo(5);

        assertEquals(RowRange.of(2, 5), launcher.range(new BatchRequest()));
        assertEquals(RowRange.of(0, 5), launcher.range(BatchRequest.builder().rowFrom(0).build()));
    }

    @Test
    public void testInlineRowsWinOverDataPath() {
        List<DataRow> rows = launcher.rows(BatchRequest.builder()
                .rows(List.of(Map.of("NOMBRE", " Ana "), Map.of("NOMBRE", "Luis")))
                .dataPath(tempDir.resolve("no-existe.csv").toString())
                .build());

        assertEquals(2, rows.size());
        assertEquals("Ana", rows.get(0).get("NOMBRE"));
    }

    @Test
    public void testRowsFromDataPath() throws Exception {
        Path csv = Files.writeString(tempDir.resolve("datos.csv"), "TEMPLATE,NOMBRE\ncarta.docx,Ana\ncarta.docx,Luis\n");

        List<DataRow> rows = launcher.rows(BatchRequest.builder().dataPath(csv.toString()).build());

        assertEquals(2, rows.size());
        assertEquals("Luis", rows.get(1).get("NOMBRE"));
    }

    @Test
    public void testNoRowsAndNoDataPath() {
        properties.setDataPath(" ");

        assertThrows(DataSourceException.class, () -> launcher.rows(new BatchRequest()));
    }

    @Test
    public void testPreflightUsesSliceAndRequestStrictness() {
        BatchRequest request = BatchRequest.builder()
                .rows(List.of(Map.of("NOMBRE", "a"), Map.of("NOMBRE", "b"), Map.of("NOMBRE", "c")))
                .rowFrom(1)
                .build();

        launcher.preflight(request);

        verify(templatePreflight).check(eq(List.of(DataRow.of(Map.of("NOMBRE", "b")), DataRow.of(Map.of("NOMBRE", "c")))), eq(false));
    }

    @Test
    public void testRunDelegatesToBatchLoop() {
        launcher.run(BatchRequest.builder().rows(List.of(Map.of("NOMBRE", "a"))).build());

        verify(batchRenderService).runBatch(any(), eq(RowRange.ALL), any(BatchOptions.class));
    }
}
