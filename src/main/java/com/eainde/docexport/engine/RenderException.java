package com.eainde.docexport.engine;

import com.eainde.docexport.registry.DocumentKind;

/**
 * The document could not be constructed or written at all. This is the only failure that
 * aborts an export; no artifact path is published when it is thrown.
 */
public class RenderException extends RuntimeException {

    private final DocumentKind kind;

    public RenderException(DocumentKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public DocumentKind getKind() {
        return kind;
    }

    /**
     * Message suitable for showing to whoever requested the export.
     */
    public String getUserMessage() {
        return "Could not create the " + kind.label().toUpperCase() + " document: "
                + (getCause() != null ? getCause().getMessage() : getMessage());
    }
}
