package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.token.TokenExpression;
import com.example.demo.batchpdf.token.TokenPatterns;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;

/**
 * Read-only walk that lists the token expressions a document uses.
 */
@Component
public class TokenDiscovery {

    /**
     * Inner text of every token found, e.g. "Amount|euros" or "Name?:N/A".
     */
    public Set<String> discover(OfficeDocument document, WalkOptions options) {
        Set<String> found = new TreeSet<>();
        document.textUnits(options).forEach(unit -> collect(unit.getText(), found));
        return found;
    }

    /**
     * Column names referenced by the given expressions.
     */
    public Set<String> baseNames(Collection<String> expressions) {
        Set<String> names = new TreeSet<>();
        for (String expression : expressions) {
            names.add(TokenExpression.baseNameOf(expression));
        }
        return names;
    }

    private void collect(String text, Set<String> found) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher matcher = TokenPatterns.DISCOVERY.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group(1).trim());
        }
    }
}
