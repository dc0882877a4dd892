package com.eainde.docexport.engine.pdf;

import com.eainde.docexport.registry.TextAlignment;
import org.apache.pdfbox.pdmodel.font.PDFont;

/**
 * Mutable text style a {@link PdfPageWriter} draws a block with.
 */
final class PdfTextStyle {

    private PDFont font = PdfFonts.resolve("Helvetica");
    private float fontSize = 12;
    private int rgb = 0x000000;
    private TextAlignment alignment = TextAlignment.LEFT;
    private float spaceBefore;
    private float spaceAfter;

    PDFont getFont() {
        return font;
    }

    void setFont(PDFont font) {
        this.font = font;
    }

    float getFontSize() {
        return fontSize;
    }

    void setFontSize(float fontSize) {
        if (fontSize <= 0) {
            throw new IllegalArgumentException("Font size must be positive: " + fontSize);
        }
        this.fontSize = fontSize;
    }

    float getLeading() {
        return fontSize * 1.2f;
    }

    int getRgb() {
        return rgb;
    }

    void setRgb(int rgb) {
        this.rgb = rgb;
    }

    TextAlignment getAlignment() {
        return alignment;
    }

    void setAlignment(TextAlignment alignment) {
        this.alignment = alignment;
    }

    float getSpaceBefore() {
        return spaceBefore;
    }

    void setSpaceBefore(float spaceBefore) {
        this.spaceBefore = spaceBefore;
    }

    float getSpaceAfter() {
        return spaceAfter;
    }

    void setSpaceAfter(float spaceAfter) {
        this.spaceAfter = spaceAfter;
    }
}
