package com.example.demo.batchpdf.token;

import java.util.regex.Pattern;

/**
 * Token delimiters and the patterns used to find tokens in document text.
 */
public final class TokenPatterns {
    public static final String PREFIX = "{{";
    public static final String SUFFIX = "}}";
    public static final String DEFAULT_SEPARATOR = "?:";
    public static final String FILTER_SEPARATOR = "|";

    /**
     * Any {{...}} occurrence; group 1 is the trimmed inner expression.
     * Used when substituting.
     */
    public static final Pattern EXPRESSION = Pattern.compile("\\{\\{\\s*([^}]+?)\\s*\\}\\}");

    /**
     * Stricter pattern used by preflight discovery: letters, digits, underscore,
     * hyphen, space and the filter/default punctuation.
     */
    public static final Pattern DISCOVERY = Pattern.compile("\\{\\{\\s*([\\p{L}\\p{N}_\\- :|?]+?)\\s*\\}\\}");

    private TokenPatterns() {
    }

    /**
     * Bare token form of a column, e.g. {@code {{NAME}}}.
     */
    public static String token(String column) {
        return PREFIX + column + SUFFIX;
    }
}
