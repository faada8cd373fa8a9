package com.example.demo.batchpdf.document;

import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.drawingml.x2006.main.CTRegularTextRun;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextCharacterProperties;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextField;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTextLineBreak;

import java.awt.Color;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link TextUnit} over a PPTX text paragraph (text box, placeholder, table cell or notes).
 */
class SlideParagraphUnit implements TextUnit {
    private static final String NO_UNDERLINE = "none";

    private final XSLFTextParagraph paragraph;

    SlideParagraphUnit(XSLFTextParagraph paragraph) {
        this.paragraph = paragraph;
    }

    @Override
    public String getText() {
        return paragraph.getTextRuns().stream()
                .map(XSLFTextRun::getRawText)
                .collect(Collectors.joining());
    }

    @Override
    public int getRunCount() {
        return paragraph.getTextRuns().size();
    }

    @Override
    public RunStyle captureFirstRunStyle() {
        List<XSLFTextRun> runs = paragraph.getTextRuns();
        if (runs.isEmpty()) {
            return RunStyle.UNSET;
        }
        CTTextCharacterProperties rPr = characterProperties(runs.get(0).getXmlObject());
        if (rPr == null) {
            return RunStyle.UNSET;
        }

        String color = null;
        if (rPr.isSetSolidFill() && rPr.getSolidFill().isSetSrgbClr()) {
            color = toHex(rPr.getSolidFill().getSrgbClr().getVal());
        }

        return RunStyle.builder()
                .fontSize(rPr.isSetSz() ? rPr.getSz() / 100.0 : null)
                .bold(rPr.isSetB() ? rPr.getB() : null)
                .italic(rPr.isSetI() ? rPr.getI() : null)
                .fontName(rPr.isSetLatin() ? rPr.getLatin().getTypeface() : null)
                .underline(rPr.isSetU() ? rPr.getU().toString() : null)
                .color(color)
                .build();
    }

    @Override
    public void replaceRuns(String text, RunStyle style) {
        List<XSLFTextRun> snapshot = List.copyOf(paragraph.getTextRuns());
        for (XSLFTextRun run : snapshot) {
            paragraph.removeTextRun(run);
        }

        // Line breaks read back as "\n" become a:br elements again.
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                paragraph.addLineBreak();
            }
            XSLFTextRun run = paragraph.addNewTextRun();
            run.setText(lines[i]);
            applyStyle(run, style);
        }
    }

    private static void applyStyle(XSLFTextRun run, RunStyle style) {
        if (style.getFontSize() != null) run.setFontSize(style.getFontSize());
        if (style.getBold() != null) run.setBold(style.getBold());
        if (style.getItalic() != null) run.setItalic(style.getItalic());
        if (style.getFontName() != null) run.setFontFamily(style.getFontName());
        if (style.getUnderline() != null) run.setUnderlined(!NO_UNDERLINE.equals(style.getUnderline()));
        if (style.getColor() != null) run.setFontColor(Color.decode("#" + style.getColor()));
    }

    private static CTTextCharacterProperties characterProperties(XmlObject xml) {
        if (xml instanceof CTRegularTextRun) {
            return ((CTRegularTextRun) xml).getRPr();
        }
        if (xml instanceof CTTextField) {
            return ((CTTextField) xml).getRPr();
        }
        if (xml instanceof CTTextLineBreak) {
            return ((CTTextLineBreak) xml).getRPr();
        }
        return null;
    }

    private static String toHex(byte[] rgb) {
        StringBuilder sb = new StringBuilder();
        for (byte b : rgb) {
            sb.append(String.format("%02X", b));
        }
        return sb.toString();
    }
}
