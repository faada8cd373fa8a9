package com.example.demo.batchpdf.token;

import com.example.demo.batchpdf.model.DataRow;
import org.springframework.stereotype.Component;

/**
 * Evaluates one token expression against a row.
 *
 * This is a total function: it always returns a string and never throws.
 * A missing or blank column yields the default when one is given (the default
 * is not filtered), otherwise the column value passes through the filters left
 * to right. Unknown filters are skipped.
 */
@Component
public class TokenEvaluator {

    public String evaluate(String expression, DataRow row) {
        return evaluate(TokenExpression.parse(expression), row);
    }

    public String evaluate(TokenExpression expression, DataRow row) {
        String value = row.get(expression.getBaseName());

        if (expression.getDefaultValue() != null && value.isBlank()) {
            return expression.getDefaultValue();
        }

        for (String filter : expression.getFilters()) {
            value = TokenFilters.apply(filter, value);
        }
        return value;
    }
}
