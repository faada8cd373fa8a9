package com.example.demo.batchpdf.token;

import com.example.demo.batchpdf.model.DataRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for token parsing and evaluation
 */
@DisplayName("Token evaluator")
public class TokenEvaluatorTest {

    private final TokenEvaluator evaluator = new TokenEvaluator();

    private static DataRow row(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return DataRow.of(map);
    }

    @Test
    public void testParseFiltersAndDefault() {
        TokenExpression expression = TokenExpression.parse(" Name | trim|upper ?: N/A ");

        assertEquals("Name", expression.getBaseName());
        assertEquals(List.of("trim", "upper"), expression.getFilters());
        assertEquals("N/A", expression.getDefaultValue());
    }

    @Test
    @DisplayName("Default splits at the first '?:' only")
    public void testParseFirstDefaultSeparator() {
        TokenExpression expression = TokenExpression.parse("A?:x?:y");

        assertEquals("A", expression.getBaseName());
        assertEquals("x?:y", expression.getDefaultValue());
        assertTrue(expression.getFilters().isEmpty());
    }

    @Test
    public void testParseBareName() {
        TokenExpression expression = TokenExpression.parse("City");

        assertEquals("City", expression.getBaseName());
        assertTrue(expression.getDefault().isEmpty());
        assertEquals("City", TokenExpression.baseNameOf("City|lower?:Madrid"));
    }

    @Test
    public void testFiltersAppliedLeftToRight() {
        assertEquals("ANA", evaluator.evaluate("Name|trim|upper", row("Name", "ana")));
        assertEquals("1.234,50 €", evaluator.evaluate("Amount|euros", row("Amount", "1234,5")));
    }

    @Test
    @DisplayName("Blank value falls back to the default, which is not filtered")
    public void testDefaultIsNotFiltered() {
        assertEquals("n/a", evaluator.evaluate("Name|upper?:n/a", row("Name", "   ")));
        assertEquals("n/a", evaluator.evaluate("Missing|upper?:n/a", row("Name", "ana")));
    }

    @Test
    @DisplayName("Absent column without default gives empty string")
    public void testAbsentColumnWithoutDefault() {
        assertEquals("", evaluator.evaluate("Missing|upper", row("Name", "ana")));
        assertEquals("", evaluator.evaluate("", row("Name", "ana")));
        assertEquals("", evaluator.evaluate("|upper", row("Name", "ana")));
    }

    @Test
    public void testUnknownFiltersAreSkipped() {
        assertEquals("ANA", evaluator.evaluate("Name|shout|upper", row("Name", "ana")));
    }
}
