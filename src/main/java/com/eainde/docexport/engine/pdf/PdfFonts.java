package com.eainde.docexport.engine.pdf;

import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves font preferences to the PDF standard 14 fonts, which need no embedding.
 * Common desktop names are mapped to their closest standard equivalent.
 */
final class PdfFonts {

    private static final Map<String, String> ALIASES = Map.of(
            "arial", "helvetica",
            "arialbold", "helveticabold",
            "timesnewroman", "timesroman",
            "times", "timesroman",
            "timesnewromanbold", "timesbold",
            "couriernew", "courier",
            "couriernewbold", "courierbold");

    private PdfFonts() {
    }

    /**
     * @throws IllegalArgumentException if the name matches no standard font
     */
    static PDType1Font resolve(String name) {
        String wanted = normalize(name);
        wanted = ALIASES.getOrDefault(wanted, wanted);
        for (Standard14Fonts.FontName fontName : Standard14Fonts.FontName.values()) {
            if (normalize(fontName.getName()).equals(wanted)) {
                return new PDType1Font(fontName);
            }
        }
        throw new IllegalArgumentException("Unsupported PDF font: " + name);
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
    }
}
