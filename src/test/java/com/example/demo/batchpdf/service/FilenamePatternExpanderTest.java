package com.example.demo.batchpdf.service;

import com.example.demo.batchpdf.exception.RowConfigurationException;
import com.example.demo.batchpdf.model.DataRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Output filename patterns")
public class FilenamePatternExpanderTest {

    private final FilenamePatternExpander expander = new FilenamePatternExpander();

    private static DataRow row() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("NOMBRE", "Ana López");
        values.put("SALIDA", "2024");
        values.put("Empresa", "ACME S.L.");
        return DataRow.of(values);
    }

    @Test
    public void testDefaultPattern() {
        assertEquals("Ana López - 2024.pdf", expander.expand("{NOMBRE} - {SALIDA}.pdf", row(), 0));
    }

    @Test
    @DisplayName("index supports printf-style padding")
    public void testIndex() {
        assertEquals("0007_ACME S.L..pdf", expander.expand("{index:04d}_{Empresa}", row(), 7));
        assertEquals("7.pdf", expander.expand("{index}", row(), 7));
    }

    @Test
    @DisplayName("Unsafe characters are replaced and .pdf is appended once")
    public void testSanitizeAndSuffix() {
        DataRow row = DataRow.of(Map.of("ID", "a/b:c*d?\"e<f>g|h\\i"));
        assertEquals("a_b_c_d__e_f_g_h_i.pdf", expander.expand("{ID}", row, 0));
        assertEquals("x.PDF", expander.expand("x.PDF", row, 0));
    }

    @Test
    @DisplayName("Pattern naming a missing column is a row configuration error")
    public void testMissingColumn() {
        RowConfigurationException e = assertThrows(RowConfigurationException.class,
                () -> expander.expand("{NOMBRE}_{CURSO}.pdf", row(), 0));

        assertEquals(RowConfigurationException.MISSING_COLUMN, e.getCode());
        assertTrue(e.getDescription().contains("CURSO"));
    }

    @Test
    public void testInvalidIndexFormat() {
        assertThrows(RowConfigurationException.class, () -> expander.expand("{index:q}", row(), 1));
    }
}
