package com.eainde.docexport.engine;

import java.util.List;

/**
 * Source text split into a title line and body paragraphs.
 */
public record ParsedText(String title, List<String> paragraphs) {

    public ParsedText {
        title = title == null ? "" : title;
        paragraphs = List.copyOf(paragraphs);
    }

    public boolean hasTitle() {
        return !title.isEmpty();
    }
}
