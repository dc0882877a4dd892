package com.eainde.docexport.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits source text into a title (first non-empty line, truncated to a number of code points)
 * and body paragraphs
 * separated by blank lines. Single line breaks inside a paragraph are kept.
 */
public class SourceTextParser {

    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t]*\\n");

    private final int titleMaxLength;

    public SourceTextParser(int titleMaxLength) {
        if (titleMaxLength < 1) {
            throw new IllegalArgumentException("titleMaxLength must be positive: " + titleMaxLength);
        }
        this.titleMaxLength = titleMaxLength;
    }

    public ParsedText parse(String sourceText) {
        if (sourceText == null || sourceText.isBlank()) {
            return new ParsedText("", List.of());
        }
        String text = sourceText.replace("\r\n", "\n").replace('\r', '\n');

        int start = 0;
        String title = "";
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                end = text.length();
            }
            String line = text.substring(start, end).trim();
            start = Math.min(end + 1, text.length());
            if (!line.isEmpty()) {
                title = line.codePointCount(0, line.length()) > titleMaxLength
                        ? line.substring(0, line.offsetByCodePoints(0, titleMaxLength))
                        : line;
                break;
            }
        }

        List<String> paragraphs = new ArrayList<>();
        for (String block : BLANK_LINE.split(text.substring(start))) {
            String paragraph = block.strip();
            if (!paragraph.isEmpty()) {
                paragraphs.add(paragraph);
            }
        }
        return new ParsedText(title, paragraphs);
    }
}
