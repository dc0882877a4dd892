package com.eainde.docexport.engine.pdf;

import com.eainde.docexport.engine.NamedColors;
import com.eainde.docexport.engine.PropertyTable;
import com.eainde.docexport.registry.TextAlignment;

/**
 * Setters for PDF text blocks (title and body) and page geometry.
 */
final class PdfPropertyTables {

    static final PropertyTable<PdfTextStyle> TEXT = PropertyTable.<PdfTextStyle>builder()
            .string("fontName", (style, name) -> style.setFont(PdfFonts.resolve(name)))
            .integer("fontSize", PdfTextStyle::setFontSize)
            .string("textColor", (style, color) -> style.setRgb(NamedColors.parseRgb(color)))
            .typed("alignment", TextAlignment.class, PdfTextStyle::setAlignment)
            .integer("spaceBefore", PdfTextStyle::setSpaceBefore)
            .integer("spaceAfter", PdfTextStyle::setSpaceAfter)
            .build();

    static final PropertyTable<PdfPageLayout> PAGE = PropertyTable.<PdfPageLayout>builder()
            .integer("leftMargin", PdfPageLayout::setLeftMargin)
            .integer("rightMargin", PdfPageLayout::setRightMargin)
            .integer("topMargin", PdfPageLayout::setTopMargin)
            .integer("bottomMargin", PdfPageLayout::setBottomMargin)
            .string("pageSize", PdfPageLayout::setPageSize)
            .build();

    private PdfPropertyTables() {
    }
}
