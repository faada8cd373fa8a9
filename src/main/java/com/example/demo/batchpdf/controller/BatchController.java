package com.example.demo.batchpdf.controller;

import com.example.demo.batchpdf.exception.BatchPdfException;
import com.example.demo.batchpdf.exception.DataSourceException;
import com.example.demo.batchpdf.exception.PreflightException;
import com.example.demo.batchpdf.exception.TemplateResolutionException;
import com.example.demo.batchpdf.model.BatchReport;
import com.example.demo.batchpdf.model.BatchRequest;
import com.example.demo.batchpdf.model.PreflightReport;
import com.example.demo.batchpdf.service.BatchLauncher;
import com.example.demo.batchpdf.service.EnvironmentInspector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for batch runs.
 *
 * POST /api/batches/run
 * {
 *   "rows": [ { "TEMPLATE": "carta.docx", "NOMBRE": "Ana", "SALIDA": "2024" } ],
 *   "outputDir": "./salida",
 *   "engine": "libreoffice",
 *   "dryRun": false
 * }
 *
 * Rows may be replaced by "dataPath" (CSV/XLSX) plus an optional "sheet".
 * Unset fields take the batchpdf.* configuration values.
 */
@Slf4j
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
public class BatchController {
    private final BatchLauncher batchLauncher;
    private final EnvironmentInspector environmentInspector;

    @PostMapping("/run")
    public ResponseEntity<BatchReport> run(@RequestBody BatchRequest request) {
        log.info("Received batch run request ({} inline row(s), dataPath={})",
                request.getRows() == null ? 0 : request.getRows().size(), request.getDataPath());
        BatchReport report = batchLauncher.run(request);
        return ResponseEntity.ok(report);
    }

    @PostMapping("/preflight")
    public ResponseEntity<PreflightReport> preflight(@RequestBody BatchRequest request) {
        return ResponseEntity.ok(batchLauncher.preflight(request));
    }

    /**
     * Which export engines are usable on this host.
     */
    @GetMapping("/environment")
    public ResponseEntity<Map<String, Object>> environment() {
        return ResponseEntity.ok(environmentInspector.inspect());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Batch PDF service is running");
    }

    @ExceptionHandler(BatchPdfException.class)
    public ResponseEntity<Map<String, Object>> handleBatchFailure(BatchPdfException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", e.getCode());
        body.put("description", e.getDescription());
        if (e instanceof PreflightException) {
            body.put("missingColumns", ((PreflightException) e).getMissingColumns());
        }

        HttpStatus status;
        if (e instanceof PreflightException) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else if (TemplateResolutionException.TEMPLATE_NOT_FOUND.equals(e.getCode())) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof DataSourceException || e instanceof TemplateResolutionException) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.warn("Batch request failed with {}: {}", e.getCode(), e.getDescription());
        return new ResponseEntity<>(body, status);
    }
}
