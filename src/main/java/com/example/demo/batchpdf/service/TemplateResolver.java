package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.config.BatchPdfProperties;
import com.example.demo.batchpdf.document.DocumentFiller;
import com.example.demo.batchpdf.exception.TemplateResolutionException;
import com.example.demo.batchpdf.model.DataRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps the TEMPLATE cell of a row to a file inside the template directory.
 *
 * Only bare file names are accepted; anything with a path separator, or that
 * would resolve outside the template directory, is rejected.
 */
@Component
@RequiredArgsConstructor
public class TemplateResolver {
    private final BatchPdfProperties properties;

    public Path templateDir() {
        return Path.of(properties.getTemplateDir());
    }

    /**
     * Template name a row asks for, falling back to the configured default when blank.
     * Returns "" when neither is set.
     */
    public String templateNameFor(DataRow row) {
        String name = row.getIgnoreCase(DocumentFiller.TEMPLATE_COLUMN);
        if (name.isBlank() && properties.getDefaultTemplate() != null) {
            return properties.getDefaultTemplate().trim();
        }
        return name.trim();
    }

    public Path resolve(String templateName) {
        String name = templateName == null ? "" : templateName.trim();
        if (name.isEmpty() && properties.getDefaultTemplate() != null) {
            name = properties.getDefaultTemplate().trim();
        }
        if (name.isEmpty()) {
            throw new TemplateResolutionException(TemplateResolutionException.TEMPLATE_NAME_MISSING,
                    "Empty TEMPLATE and no default template configured");
        }
        if (name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
            throw new TemplateResolutionException(TemplateResolutionException.INVALID_TEMPLATE_NAME,
                    "TEMPLATE must be a file name, not a path: " + name);
        }

        Path base = templateDir().toAbsolutePath().normalize();
        Path candidate = base.resolve(name).normalize();
        if (!candidate.startsWith(base)) {
            throw new TemplateResolutionException(TemplateResolutionException.INVALID_TEMPLATE_NAME,
                    "TEMPLATE resolves outside the template directory: " + name);
        }
        if (!Files.isRegularFile(candidate)) {
            throw new TemplateResolutionException(TemplateResolutionException.TEMPLATE_NOT_FOUND,
                    "Template not found: " + candidate);
        }
        return candidate;
    }
}
