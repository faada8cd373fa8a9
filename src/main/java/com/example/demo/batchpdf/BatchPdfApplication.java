package com.example.demo.batchpdf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Batch office template to PDF service.
 * Fills {{TOKEN}} placeholders in DOCX/PPTX (and legacy formats) from tabular rows
 * and exports one PDF per row.
 */
@SpringBootApplication
public class BatchPdfApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchPdfApplication.class, args);
    }
}
