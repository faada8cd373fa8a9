package com.example.demo.batchpdf.document;

import com.example.demo.batchpdf.model.DataRow;
import com.example.demo.batchpdf.token.TokenEvaluator;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Run consolidation")
public class RunConsolidatorTest {

    private final RunConsolidator consolidator = new RunConsolidator(new TokenEvaluator());

    private static DataRow row() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("TEMPLATE", "carta.docx");
        values.put("Name", "Ana");
        values.put("Amount", "1234,5");
        values.put("Price", "$1 \\ 2");
        return DataRow.of(values);
    }

    private boolean substitute(TextUnit unit) {
        DataRow row = row();
        return consolidator.substitute(unit, row, DocumentFiller.fastMap(row));
    }

    @Test
    @DisplayName("Token split across runs collapses into one run with the first run's style")
    public void testSplitTokenInWordParagraph() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = TestDocuments.splitParagraph(document, "Hello {{", "Na", "me}}!");
            XWPFRun first = paragraph.getRuns().get(0);
            first.setBold(true);
            first.setFontSize(14.0);
            first.setFontFamily("Arial");
            first.setColor("1F3864");

            WordParagraphUnit unit = new WordParagraphUnit(paragraph);
            assertTrue(substitute(unit));

            assertEquals(1, paragraph.getRuns().size());
            XWPFRun run = paragraph.getRuns().get(0);
            assertEquals("Hello Ana!", run.text());
            assertTrue(run.isBold());
            assertEquals(14.0, run.getFontSizeAsDouble());
            assertEquals("Arial", run.getFontFamily());
            assertEquals("1F3864", run.getColor());
        }
    }

    @Test
    @DisplayName("Attributes not set on the first run are not forced on the new run")
    public void testUnsetAttributesStayUnset() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = TestDocuments.splitParagraph(document, "{{Name}}", " plain");

            assertTrue(substitute(new WordParagraphUnit(paragraph)));

            XWPFRun run = paragraph.getRuns().get(0);
            assertNull(run.getFontSizeAsDouble());
            assertNull(run.getFontFamily());
            assertNull(run.getColor());
        }
    }

    @Test
    @DisplayName("Paragraph without tokens is left untouched")
    public void testNoTokensIsNoOp() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = TestDocuments.splitParagraph(document, "Hello ", "world");
            paragraph.getRuns().get(1).setItalic(true);

            assertFalse(substitute(new WordParagraphUnit(paragraph)));

            assertEquals(2, paragraph.getRuns().size());
            assertTrue(paragraph.getRuns().get(1).isItalic());
        }
    }

    @Test
    public void testEmptyParagraphIsNoOp() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = document.createParagraph();
            assertFalse(substitute(new WordParagraphUnit(paragraph)));
            assertEquals(0, paragraph.getRuns().size());
        }
    }

    @Test
    @DisplayName("Second pass over a substituted unit changes nothing")
    public void testIdempotent() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = TestDocuments.splitParagraph(document, "{{Na", "me}}");
            WordParagraphUnit unit = new WordParagraphUnit(paragraph);

            assertTrue(substitute(unit));
            assertFalse(substitute(unit));
            assertEquals("Ana", unit.getText());
        }
    }

    @Test
    @DisplayName("Expressions with filters and defaults go through the evaluator")
    public void testExpressionPath() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = TestDocuments.splitParagraph(document,
                    "{{ Name|upper }} owes {{Amount|euros}} to {{Creditor?:the bank}}");

            assertTrue(substitute(new WordParagraphUnit(paragraph)));
            assertEquals("ANA owes 1.234,50 € to the bank", paragraph.getText());
        }
    }

    @Test
    @DisplayName("Replacement values are inserted literally")
    public void testReplacementCharactersAreLiteral() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph paragraph = TestDocuments.splitParagraph(document, "{{Price}} / {{Price|trim}}");

            assertTrue(substitute(new WordParagraphUnit(paragraph)));
            assertEquals("$1 \\ 2 / $1 \\ 2", paragraph.getText());
        }
    }

    @Test
    @DisplayName("TEMPLATE column is not part of the literal replacement map")
    public void testTemplateColumnExcludedFromFastMap() {
        Map<String, String> fastMap = DocumentFiller.fastMap(row());
        assertFalse(fastMap.containsKey("TEMPLATE"));
        assertEquals("Ana", fastMap.get("Name"));
    }

    @Test
    @DisplayName("Slide paragraph split across runs collapses into one run")
    public void testSplitTokenInSlideParagraph() throws Exception {
        try (XMLSlideShow show = new XMLSlideShow()) {
            XSLFTextBox box = show.createSlide().createTextBox();
            box.clearText();
            XSLFTextParagraph paragraph = box.addNewTextParagraph();
            XSLFTextRun first = paragraph.addNewTextRun();
            first.setText("Dear {{Na");
            first.setBold(true);
            first.setFontSize(18.0);
            paragraph.addNewTextRun().setText("me}},");

            SlideParagraphUnit unit = new SlideParagraphUnit(paragraph);
            assertTrue(substitute(unit));

            assertEquals(1, paragraph.getTextRuns().size());
            XSLFTextRun run = paragraph.getTextRuns().get(0);
            assertEquals("Dear Ana,", run.getRawText());
            assertTrue(run.isBold());
            assertEquals(18.0, run.getFontSize());

            assertFalse(substitute(unit));
        }
    }

    @Test
    @DisplayName("Soft line breaks in a slide paragraph survive the collapse")
    public void testSlideLineBreakKept() throws Exception {
        try (XMLSlideShow show = new XMLSlideShow()) {
            XSLFTextBox box = show.createSlide().createTextBox();
            box.clearText();
            XSLFTextParagraph paragraph = box.addNewTextParagraph();
            XSLFTextRun first = paragraph.addNewTextRun();
            first.setText("Dear {{Name}}");
            first.setItalic(true);
            paragraph.addLineBreak();
            paragraph.addNewTextRun().setText("Total {{Amount|euros}}");

            SlideParagraphUnit unit = new SlideParagraphUnit(paragraph);
            assertEquals("Dear {{Name}}\nTotal {{Amount|euros}}", unit.getText());
            assertTrue(substitute(unit));

            assertEquals(1, paragraph.getXmlObject().sizeOfBrArray());
            assertEquals(2, paragraph.getXmlObject().sizeOfRArray());
            assertEquals("Dear Ana", paragraph.getXmlObject().getRArray(0).getT());
            assertEquals("Total 1.234,50 €", paragraph.getXmlObject().getRArray(1).getT());
            assertTrue(paragraph.getXmlObject().getRArray(1).getRPr().getI());
            assertEquals("Dear Ana\nTotal 1.234,50 €", unit.getText());
        }
    }
}
