package com.eainde.docexport.registry;

import java.util.Locale;

/**
 * Horizontal alignment shared by the Word and PDF renderers.
 */
public enum TextAlignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    /**
     * Parses names such as {@code "center"}, {@code "centered"}, {@code "centre"},
     * {@code "justified"}, and the numeric codes 0-3 (left, center, right, justify).
     *
     * @throws IllegalArgumentException when the value names no alignment
     */
    public static TextAlignment parse(Object value) {
        if (value instanceof TextAlignment alignment) {
            return alignment;
        }
        if (value instanceof Number number) {
            int code = number.intValue();
            if (code < 0 || code >= values().length || number.doubleValue() != code) {
                throw new IllegalArgumentException("Unknown alignment code: " + value);
            }
            return values()[code];
        }
        if (value == null) {
            throw new IllegalArgumentException("Alignment must not be null");
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "left", "start", "0" -> LEFT;
            case "center", "centre", "centered", "centred", "middle", "1" -> CENTER;
            case "right", "end", "2" -> RIGHT;
            case "justify", "justified", "both", "3" -> JUSTIFY;
            default -> throw new IllegalArgumentException("Unknown alignment: " + value);
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
