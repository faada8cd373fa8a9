package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.model.DataRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Substitutes a row into every text unit of a document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentFiller {
    public static final String TEMPLATE_COLUMN = "TEMPLATE";

    private final RunConsolidator runConsolidator;

    /**
     * @return number of units whose text changed
     */
    public int fill(OfficeDocument document, DataRow row, WalkOptions options) {
        Map<String, String> fastMap = fastMap(row);
        int[] changed = {0};
        document.textUnits(options).forEach(unit -> {
            if (runConsolidator.substitute(unit, row, fastMap)) {
                changed[0]++;
            }
        });
        log.debug("Filled {} text unit(s) in {} document", changed[0], document.getKind());
        return changed[0];
    }

    /**
     * Plain {{column}} replacements: every column except TEMPLATE.
     */
    static Map<String, String> fastMap(DataRow row) {
        Map<String, String> map = new LinkedHashMap<>();
        row.asMap().forEach((column, value) -> {
            if (!column.equalsIgnoreCase(TEMPLATE_COLUMN)) {
                map.put(column, value);
            }
        });
        return map;
    }
}
