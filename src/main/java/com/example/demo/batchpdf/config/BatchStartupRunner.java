package com.example.demo.batchpdf.config;

import com.example.demo.batchpdf.model.BatchReport;
import com.example.demo.batchpdf.model.RenderStatus;
import com.example.demo.batchpdf.service.BatchLauncher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one batch from configuration at startup, e.g.
 * {@code java -jar batch-pdf-service.jar --batchpdf.run-on-startup=true --batchpdf.data-path=datos.csv}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "batchpdf", name = "run-on-startup", havingValue = "true")
public class BatchStartupRunner implements ApplicationRunner {
    private final BatchLauncher batchLauncher;
    private final BatchPdfProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Running startup batch: data={}, templates={}, output={}",
                properties.getDataPath(), properties.getTemplateDir(), properties.getOutputDir());
        BatchReport report = batchLauncher.runConfigured();
        log.info("Startup batch done: {} OK, {} error(s), {} skipped",
                report.count(RenderStatus.OK), report.count(RenderStatus.ERROR), report.count(RenderStatus.SKIPPED));
    }
}
