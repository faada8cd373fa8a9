package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.token.TokenEvaluator;
import com.example.demo.batchpdf.token.TokenPatterns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;

/**
 * Replaces tokens inside one text unit.
 *
 * Tokens can be split across runs by the authoring application, so replacement
 * works on the unit's concatenated text. When the text changes, the unit is
 * collapsed to a single run carrying the first run's basic formatting; formatting
 * of the other runs is lost. Units whose text does not change are not touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunConsolidator {
    private final TokenEvaluator tokenEvaluator;

    /**
     * @param unit    paragraph to rewrite
     * @param row     full row, used for {{expr|filter?:default}} tokens
     * @param fastMap column to value, replaced literally as {{column}}
     * @return true when the unit's text changed
     */
    public boolean substitute(TextUnit unit, DataRow row, Map<String, String> fastMap) {
        String original = unit.getText();
        if (original.isEmpty()) {
            return false;
        }

        String replaced = original;
        for (Map.Entry<String, String> entry : fastMap.entrySet()) {
            String token = TokenPatterns.token(entry.getKey());
            if (replaced.contains(token)) {
                replaced = replaced.replace(token, entry.getValue());
            }
        }

        replaced = evaluateExpressions(replaced, row);

        if (replaced.equals(original)) {
            return false;
        }

        RunStyle style = unit.captureFirstRunStyle();
        unit.replaceRuns(replaced, style);
        log.trace("Substituted '{}' -> '{}'", original, replaced);
        return true;
    }

    private String evaluateExpressions(String text, DataRow row) {
        Matcher matcher = TokenPatterns.EXPRESSION.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        do {
            String value = tokenEvaluator.evaluate(matcher.group(1), row);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }
}
