package com.eainde.docexport.files;

import com.eainde.docexport.registry.DocumentKind;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Hands out unique, writable destinations for produced documents.
 */
public interface ArtifactPathAllocator {

    /**
     * Reserves a path for a new artifact. Two calls never return the same path, even when made
     * concurrently.
     *
     * @param kind       decides the file extension
     * @param customName optional base name; {@code null} or blank selects the configured default
     * @throws IOException if the export directory cannot be created or written
     */
    Path allocatePath(DocumentKind kind, String customName) throws IOException;
}
