package com.eainde.docexport.engine;

import com.eainde.docexport.registry.DocumentKind;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes one document kind from parsed text and a resolved plan.
 */
public interface DocumentRenderer {

    DocumentKind kind();

    /**
     * Renders the document into {@code target}, overwriting whatever the allocator reserved there.
     *
     * @throws IOException if the document cannot be constructed or written
     */
    RenderReport render(ParsedText text, FormattingPlan plan, Path target) throws IOException;
}
