package com.eainde.docexport.engine.pdf;

import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.util.Locale;

/**
 * Page size and margins, resolved before the first page exists.
 */
final class PdfPageLayout {

    private PDRectangle pageSize = PDRectangle.LETTER;
    private float leftMargin = 72;
    private float rightMargin = 72;
    private float topMargin = 72;
    private float bottomMargin = 18;

    PDRectangle getPageSize() {
        return pageSize;
    }

    void setPageSize(String name) {
        this.pageSize = switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "letter" -> PDRectangle.LETTER;
            case "a4" -> PDRectangle.A4;
            case "legal" -> PDRectangle.LEGAL;
            default -> throw new IllegalArgumentException("Unsupported page size: " + name);
        };
    }

    float getLeftMargin() {
        return leftMargin;
    }

    void setLeftMargin(float leftMargin) {
        this.leftMargin = leftMargin;
    }

    void setRightMargin(float rightMargin) {
        this.rightMargin = rightMargin;
    }

    float getTopMargin() {
        return topMargin;
    }

    void setTopMargin(float topMargin) {
        this.topMargin = topMargin;
    }

    float getBottomMargin() {
        return bottomMargin;
    }

    void setBottomMargin(float bottomMargin) {
        this.bottomMargin = bottomMargin;
    }

    float contentWidth() {
        return pageSize.getWidth() - leftMargin - rightMargin;
    }

    float contentTop() {
        return pageSize.getHeight() - topMargin;
    }

    boolean fitsHorizontally() {
        return contentWidth() > 0;
    }

    boolean fitsVertically() {
        return contentTop() > bottomMargin;
    }

    String describe() {
        return String.format(Locale.ROOT,
                "margins (left %.0f, right %.0f, top %.0f, bottom %.0f) on a %.0fx%.0f page",
                leftMargin, rightMargin, topMargin, bottomMargin, pageSize.getWidth(), pageSize.getHeight());
    }

    /**
     * @throws IllegalStateException if the margins leave no room to draw text
     */
    void checkPrintableArea() {
        if (!fitsHorizontally() || !fitsVertically()) {
            throw new IllegalStateException("No printable area left by " + describe());
        }
    }
}
