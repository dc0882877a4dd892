package com.eainde.docexport.files;

import java.nio.file.Path;

/**
 * Best-effort "open this file" side effect after an export.
 */
public interface ArtifactOpener {

    /**
     * @return {@code true} if the artifact was handed to the platform viewer
     */
    boolean openArtifact(Path path);
}
