package com.eainde.docexport.engine.pdf;

import com.eainde.docexport.registry.TextAlignment;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Flows text blocks top to bottom across as many pages as needed, wrapping lines to the
 * content width and starting a new page when the bottom margin is reached.
 */
final class PdfPageWriter implements Closeable {

    private final PDDocument document;
    private final PdfPageLayout layout;

    private PDPageContentStream stream;
    private float cursorY;
    private boolean pageEmpty;

    PdfPageWriter(PDDocument document, PdfPageLayout layout) throws IOException {
        this.document = document;
        this.layout = layout;
        newPage();
    }

    void writeBlock(String text, PdfTextStyle style) throws IOException {
        if (!pageEmpty) {
            cursorY -= style.getSpaceBefore();
        }
        List<Line> lines = wrap(encodable(text, style.getFont()), style);
        for (Line line : lines) {
            if (cursorY - style.getLeading() < layout.getBottomMargin() && !pageEmpty) {
                newPage();
            }
            cursorY -= style.getLeading();
            drawLine(line, style);
            pageEmpty = false;
        }
        cursorY -= style.getSpaceAfter();
    }

    int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public void close() throws IOException {
        if (stream != null) {
            stream.close();
            stream = null;
        }
    }

    private void newPage() throws IOException {
        close();
        PDPage page = new PDPage(layout.getPageSize());
        document.addPage(page);
        stream = new PDPageContentStream(document, page);
        cursorY = layout.contentTop();
        pageEmpty = true;
    }

    private void drawLine(Line line, PdfTextStyle style) throws IOException {
        float available = layout.contentWidth();
        float width = textWidth(line.text(), style);
        float x = layout.getLeftMargin();
        float wordSpacing = 0;

        switch (style.getAlignment()) {
            case CENTER -> x += Math.max(0, (available - width) / 2);
            case RIGHT -> x += Math.max(0, available - width);
            case JUSTIFY -> {
                int gaps = countSpaces(line.text());
                if (!line.lastOfParagraph() && gaps > 0 && width < available) {
                    wordSpacing = (available - width) / gaps;
                }
            }
            case LEFT -> {
            }
        }

        int rgb = style.getRgb();
        stream.beginText();
        stream.setFont(style.getFont(), style.getFontSize());
        stream.setNonStrokingColor(((rgb >> 16) & 0xFF) / 255f, ((rgb >> 8) & 0xFF) / 255f, (rgb & 0xFF) / 255f);
        stream.setWordSpacing(wordSpacing);
        stream.newLineAtOffset(x, cursorY);
        stream.showText(line.text());
        stream.endText();
    }

    private List<Line> wrap(String text, PdfTextStyle style) throws IOException {
        float available = layout.contentWidth();
        List<Line> lines = new ArrayList<>();
        for (String hardLine : text.split("\n", -1)) {
            List<String> wrapped = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (String word : hardLine.strip().split(" +")) {
                if (word.isEmpty()) {
                    continue;
                }
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (textWidth(candidate, style) <= available) {
                    current.setLength(0);
                    current.append(candidate);
                    continue;
                }
                if (current.length() > 0) {
                    wrapped.add(current.toString());
                    current.setLength(0);
                }
                for (String piece : splitLongWord(word, style, available)) {
                    if (current.length() > 0) {
                        wrapped.add(current.toString());
                        current.setLength(0);
                    }
                    current.append(piece);
                }
            }
            wrapped.add(current.toString());
            for (int i = 0; i < wrapped.size(); i++) {
                lines.add(new Line(wrapped.get(i), i == wrapped.size() - 1));
            }
        }
        return lines;
    }

    private List<String> splitLongWord(String word, PdfTextStyle style, float available) throws IOException {
        List<String> pieces = new ArrayList<>();
        int start = 0;
        while (start < word.length()) {
            int end = start + 1;
            while (end < word.length() && textWidth(word.substring(start, end + 1), style) <= available) {
                end++;
            }
            pieces.add(word.substring(start, end));
            start = end;
        }
        return pieces;
    }

    private static float textWidth(String text, PdfTextStyle style) throws IOException {
        return style.getFont().getStringWidth(text) / 1000f * style.getFontSize();
    }

    private static int countSpaces(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ' ') {
                count++;
            }
        }
        return count;
    }

    /**
     * Replaces characters the font cannot encode with {@code ?} and tabs with spaces.
     */
    static String encodable(String text, PDFont font) {
        StringBuilder out = new StringBuilder(text.length());
        text.replace('\t', ' ').codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            if (cp == '\n') {
                out.append(ch);
                return;
            }
            try {
                font.encode(ch);
                out.append(ch);
            } catch (IOException | IllegalArgumentException e) {
                out.append('?');
            }
        });
        return out.toString();
    }

    private record Line(String text, boolean lastOfParagraph) {
    }
}
