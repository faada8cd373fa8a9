package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.exception.RowConfigurationException;
import com.example.demo.batchpdf.model.DataRow;
import org.springframework.stereotype.Component;

import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands output file name patterns such as {@code "{NOMBRE} - {SALIDA}.pdf"}
 * or {@code "{index:04d}_{Empresa}.pdf"}.
 *
 * Placeholders name a row column or {@code index} (the 0-based row number);
 * an optional {@code :spec} is a printf-style conversion applied to the index.
 */
@Component
public class FilenamePatternExpander {
    public static final String INDEX = "index";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}:]+)(?::([^{}]*))?}");
    private static final Pattern UNSAFE = Pattern.compile("[<>:\"/\\\\|?*]");

    /**
     * Sanitized file name ending in ".pdf".
     *
     * @throws RowConfigurationException when the pattern names a column the row lacks
     */
    public String expand(String pattern, DataRow row, int index) {
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1).trim();
            String spec = matcher.group(2);
            String value;
            if (INDEX.equals(key) && !row.hasColumn(INDEX)) {
                value = formatIndex(index, spec, pattern);
            } else if (row.hasColumn(key)) {
                value = row.get(key);
            } else {
                throw new RowConfigurationException("Filename pattern requires a missing column: '" + key
                        + "'. Pattern: " + pattern + " | Columns: " + row.columns());
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);

        String name = sanitize(sb.toString());
        if (!name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            name += ".pdf";
        }
        return name;
    }

    /**
     * Replaces characters that are not allowed in file names with '_'.
     */
    public static String sanitize(String name) {
        return UNSAFE.matcher(name).replaceAll("_").trim();
    }

    private static String formatIndex(int index, String spec, String pattern) {
        if (spec == null || spec.isBlank()) {
            return Integer.toString(index);
        }
        try {
            return String.format(Locale.ROOT, "%" + spec.trim(), index);
        } catch (IllegalFormatException e) {
            throw new RowConfigurationException("Invalid index format '" + spec + "' in pattern " + pattern);
        }
    }
}
