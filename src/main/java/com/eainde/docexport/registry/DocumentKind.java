package com.eainde.docexport.registry;

import java.util.Locale;

/**
 * Target output format of an export.
 */
public enum DocumentKind {

    WORD("word", "docx"),
    PDF("pdf", "pdf");

    private final String label;
    private final String extension;

    DocumentKind(String label, String extension) {
        this.label = label;
        this.extension = extension;
    }

    public String label() {
        return label;
    }

    public String extension() {
        return extension;
    }

    /**
     * Resolves a label returned by the classifier. Anything that is not exactly
     * {@code word} or {@code pdf} (after trimming and lower-casing) resolves to {@link #WORD}.
     */
    public static DocumentKind fromLabel(String label) {
        if (label == null) {
            return WORD;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return PDF.label.equals(normalized) ? PDF : WORD;
    }

    public static boolean isKnownLabel(String label) {
        if (label == null) {
            return false;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return WORD.label.equals(normalized) || PDF.label.equals(normalized);
    }
}
