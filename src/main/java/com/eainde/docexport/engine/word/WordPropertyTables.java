package com.eainde.docexport.engine.word;

import com.eainde.docexport.engine.NamedColors;
import com.eainde.docexport.engine.PropertyTable;
import com.eainde.docexport.registry.TextAlignment;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

/**
 * Setters for Word body and title properties. Font properties go to runs, layout properties to
 * paragraphs; both scopes share these tables.
 */
final class WordPropertyTables {

    static final PropertyTable<XWPFRun> RUN = PropertyTable.<XWPFRun>builder()
            .string("name", XWPFRun::setFontFamily)
            .integer("size", (run, size) -> run.setFontSize(size.intValue()))
            .bool("bold", XWPFRun::setBold)
            .bool("italic", XWPFRun::setItalic)
            .bool("underline", (run, underline) ->
                    run.setUnderline(underline ? UnderlinePatterns.SINGLE : UnderlinePatterns.NONE))
            .string("color", (run, color) -> run.setColor(NamedColors.toHex(color)))
            .build();

    static final PropertyTable<XWPFParagraph> PARAGRAPH = PropertyTable.<XWPFParagraph>builder()
            .typed("alignment", TextAlignment.class, (paragraph, alignment) ->
                    paragraph.setAlignment(toParagraphAlignment(alignment)))
            .number("line_spacing", (paragraph, spacing) -> paragraph.setSpacingBetween(spacing))
            .build();

    private WordPropertyTables() {
    }

    static ParagraphAlignment toParagraphAlignment(TextAlignment alignment) {
        return switch (alignment) {
            case LEFT -> ParagraphAlignment.LEFT;
            case CENTER -> ParagraphAlignment.CENTER;
            case RIGHT -> ParagraphAlignment.RIGHT;
            case JUSTIFY -> ParagraphAlignment.BOTH;
        };
    }
}
