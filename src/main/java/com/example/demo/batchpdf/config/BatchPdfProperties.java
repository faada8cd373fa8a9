package com.example.demo.batchpdf.config;

import com.example.demo.batchpdf.document.WalkOptions;
import com.example.demo.batchpdf.model.BatchOptions;
import com.example.demo.batchpdf.model.ExportEngine;
import com.example.demo.batchpdf.model.RowRange;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch configuration.
 *
 * Example application.yml:
 *
 * batchpdf:
 *   template-dir: ./plantillas
 *   data-path: ./datos.xlsx
 *   output-dir: ./salida
 *   filename-pattern: "{NOMBRE} - {SALIDA}.pdf"
 *   engine: auto
 *   export-retries: 2
 *   column-formatters:
 *     Importe: euros
 *     Fecha: dmy
 *
 * Every value can be overridden from the command line, e.g.
 * {@code --batchpdf.dry-run=true --batchpdf.engine=libreoffice}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "batchpdf")
public class BatchPdfProperties {

    /** Directory holding the template files referenced by the TEMPLATE column. */
    private String templateDir = "plantillas";

    /** Input spreadsheet (.xlsx/.xls) or .csv used by the startup runner. */
    private String dataPath = "datos.xlsx";

    /** Sheet name or 0-based index; ignored for CSV. */
    private String sheet = "0";

    private String outputDir = "salida";

    /** Output file name pattern; may use any column and {index} / {index:04d}. */
    private String filenamePattern = "{NOMBRE} - {SALIDA}.pdf";

    /** Template used when a row's TEMPLATE cell is empty (null means error). */
    private String defaultTemplate;

    private List<String> requiredColumns = new ArrayList<>(List.of("TEMPLATE"));

    private boolean dryRun = false;

    /** Abort before any row when a template token has no matching column. */
    private boolean strict = false;

    /** Conversion engine retries for PDF export (total tries = retries + 1). */
    private int exportRetries = 2;

    private ExportEngine engine = ExportEngine.AUTO;

    /** Path to the LibreOffice binary; null uses "soffice" from PATH. */
    private String sofficeBin;

    private String pdfFilter = "pdf";

    /** LibreOffice PDF filter options, e.g. "SelectPdfVersion=1;Quality=90". */
    private String pdfFilterOptions;

    /** Slide decks: also scan slide masters and layouts. */
    private boolean scanMasters = true;

    /** Word documents: also scan headers and footers. */
    private boolean scanHeadersFooters = true;

    /** Column name to filter name, applied to the value before substitution. */
    private Map<String, String> columnFormatters = new LinkedHashMap<>();

    /** First row to process (inclusive, 0-based). */
    private Integer rowFrom;

    /** Last row to process (inclusive, 0-based). */
    private Integer rowTo;

    /** Run one batch from the configured data path when the application starts. */
    private boolean runOnStartup = false;

    public BatchOptions toBatchOptions() {
        return BatchOptions.builder()
                .outputDir(Path.of(outputDir))
                .filenamePattern(filenamePattern)
                .engine(engine)
                .dryRun(dryRun)
                .strict(strict)
                .build();
    }

    public WalkOptions toWalkOptions() {
        return WalkOptions.builder()
                .scanMasters(scanMasters)
                .scanHeadersFooters(scanHeadersFooters)
                .build();
    }

    public RowRange toRowRange() {
        return RowRange.of(rowFrom, rowTo);
    }
}
