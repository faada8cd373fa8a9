package com.example.demo.batchpdf.token;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Parsed form of a token's inner text.
 *
 * Grammar: {@code <column>('|' <filter>)* ('?:' <default>)?}
 *
 * Parsing never fails: text that does not follow the filter/default syntax
 * is simply read as a bare column name.
 */
@Value
public class TokenExpression {
    String baseName;
    List<String> filters;
    String defaultValue;

    public Optional<String> getDefault() {
        return Optional.ofNullable(defaultValue);
    }

    public static TokenExpression parse(String expression) {
        String main = expression == null ? "" : expression;
        String defaultValue = null;

        int separator = main.indexOf(TokenPatterns.DEFAULT_SEPARATOR);
        if (separator >= 0) {
            defaultValue = main.substring(separator + TokenPatterns.DEFAULT_SEPARATOR.length()).trim();
            main = main.substring(0, separator).trim();
        }

        String[] pieces = main.split("\\|", -1);
        String baseName = pieces[0].trim();
        List<String> filters = new ArrayList<>();
        for (int i = 1; i < pieces.length; i++) {
            filters.add(pieces[i].trim());
        }
        return new TokenExpression(baseName, Collections.unmodifiableList(filters), defaultValue);
    }

    /**
     * Column name referenced by an expression, with filters and default stripped.
     * "Amount|euros" and "Amount?:0" both give "Amount".
     */
    public static String baseNameOf(String expression) {
        return parse(expression).getBaseName();
    }
}
