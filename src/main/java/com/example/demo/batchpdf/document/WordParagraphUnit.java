package com.example.demo.batchpdf.document;

import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link TextUnit} over a DOCX paragraph.
 */
class WordParagraphUnit implements TextUnit {
    private final XWPFParagraph paragraph;

    WordParagraphUnit(XWPFParagraph paragraph) {
        this.paragraph = paragraph;
    }

    @Override
    public String getText() {
        return paragraph.getRuns().stream()
                .map(XWPFRun::text)
                .collect(Collectors.joining());
    }

    @Override
    public int getRunCount() {
        return paragraph.getRuns().size();
    }

    @Override
    public RunStyle captureFirstRunStyle() {
        List<XWPFRun> runs = paragraph.getRuns();
        if (runs.isEmpty()) {
            return RunStyle.UNSET;
        }
        XWPFRun first = runs.get(0);
        CTRPr rPr = first.getCTR().getRPr();
        boolean hasProps = rPr != null;

        return RunStyle.builder()
                .fontSize(first.getFontSizeAsDouble())
                .bold(hasProps && rPr.sizeOfBArray() > 0 ? first.isBold() : null)
                .italic(hasProps && rPr.sizeOfIArray() > 0 ? first.isItalic() : null)
                .fontName(first.getFontFamily())
                .underline(hasProps && rPr.sizeOfUArray() > 0 ? first.getUnderline().name() : null)
                .color(first.getColor())
                .build();
    }

    @Override
    public void replaceRuns(String text, RunStyle style) {
        // Snapshot first: removeRun mutates the live run list.
        List<XWPFRun> snapshot = List.copyOf(paragraph.getRuns());
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            int position = paragraph.getRuns().indexOf(snapshot.get(i));
            if (position >= 0) {
                paragraph.removeRun(position);
            }
        }

        XWPFRun run = paragraph.createRun();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                run.addBreak();
            }
            run.setText(lines[i]);
        }

        if (style.getFontSize() != null) run.setFontSize(style.getFontSize());
        if (style.getBold() != null) run.setBold(style.getBold());
        if (style.getItalic() != null) run.setItalic(style.getItalic());
        if (style.getFontName() != null) run.setFontFamily(style.getFontName());
        if (style.getUnderline() != null) run.setUnderline(UnderlinePatterns.valueOf(style.getUnderline()));
        if (style.getColor() != null) run.setColor(style.getColor());
    }
}
