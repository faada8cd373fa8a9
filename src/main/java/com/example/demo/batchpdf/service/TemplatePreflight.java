package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.conversion.FormatNormalizer;
import com.example.demo.batchpdf.document.DocumentFiller;
import com.example.demo.batchpdf.document.OfficeDocument;
import com.example.demo.batchpdf.document.OfficeDocuments;
import com.example.demo.batchpdf.document.TokenDiscovery;
import com.example.demo.batchpdf.exception.BatchPdfException;
import com.example.demo.batchpdf.exception.PreflightException;
import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.model.PreflightReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Scans every distinct template of a batch once, before any row is rendered,
 * and compares the tokens found with the data columns.
 *
 * Templates that cannot be resolved or opened are reported and skipped here;
 * the rows that use them fail individually later.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplatePreflight {
    private final TemplateResolver templateResolver;
    private final FormatNormalizer formatNormalizer;
    private final TokenDiscovery tokenDiscovery;
    private final BatchPdfProperties properties;

    /**
     * @throws PreflightException when {@code strict} and some token has no column
     */
    public PreflightReport check(Collection<DataRow> rows, boolean strict) {
        Set<String> columns = new LinkedHashSet<>();
        Set<String> templates = new LinkedHashSet<>();
        for (DataRow row : rows) {
            row.columns().stream()
                    .filter(c -> !c.equalsIgnoreCase(DocumentFiller.TEMPLATE_COLUMN))
                    .forEach(columns::add);
            String name = templateResolver.templateNameFor(row);
            if (!name.isEmpty()) {
                templates.add(name);
            }
        }

        SortedSet<String> rawTokens = new TreeSet<>();
        Map<String, String> unreadable = new LinkedHashMap<>();
        for (String name : templates) {
            try {
                rawTokens.addAll(scan(templateResolver.resolve(name)));
            } catch (BatchPdfException e) {
                log.warn("[Preflight] Cannot scan template '{}': {}", name, e.getDescription());
                unreadable.put(name, e.getDescription());
            } catch (IOException | RuntimeException e) {
                String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("[Preflight] Cannot open template '{}': {}", name, reason);
                unreadable.put(name, reason);
            }
        }

        SortedSet<String> baseTokens = new TreeSet<>(tokenDiscovery.baseNames(rawTokens));
        SortedSet<String> missing = new TreeSet<>();
        for (String token : baseTokens) {
            if (!columns.contains(token)) {
                missing.add(token);
            }
        }
        SortedSet<String> unused = new TreeSet<>();
        for (String column : columns) {
            if (!baseTokens.contains(column)) {
                unused.add(column);
            }
        }

        log.info("[Preflight] Tokens found in templates (raw): {}", rawTokens);
        log.info("[Preflight] Base token names: {}", baseTokens);
        if (!missing.isEmpty()) {
            log.warn("[Preflight] Tokens without matching columns: {}", missing);
        }
        if (!unused.isEmpty()) {
            log.info("[Preflight] Columns not used by any token: {}", unused);
        }

        PreflightReport report = PreflightReport.builder()
                .rawTokens(rawTokens)
                .baseTokens(baseTokens)
                .missingColumns(missing)
                .unusedColumns(unused)
                .unreadableTemplates(unreadable)
                .build();
        if (strict && report.hasMissingColumns()) {
            throw new PreflightException(missing);
        }
        return report;
    }

    private Set<String> scan(Path template) throws IOException {
        Path canonical = formatNormalizer.normalize(template);
        try (OfficeDocument document = OfficeDocuments.open(canonical)) {
            return tokenDiscovery.discover(document, properties.toWalkOptions());
        }
    }
}
