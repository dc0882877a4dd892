package com.eainde.docexport.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens artifacts with the platform's default application through {@link Desktop}.
 * Returns {@code false} on headless hosts and where the OPEN action is unsupported.
 */
public class DesktopArtifactOpener implements ArtifactOpener {

    private static final Logger log = LoggerFactory.getLogger(DesktopArtifactOpener.class);

    @Override
    public boolean openArtifact(Path path) {
        if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()) {
            log.info("Desktop integration unavailable, not opening {}", path);
            return false;
        }
        Desktop desktop = Desktop.getDesktop();
        if (!desktop.isSupported(Desktop.Action.OPEN)) {
            log.info("Desktop OPEN action unsupported, not opening {}", path);
            return false;
        }
        try {
            desktop.open(path.toFile());
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Could not open {}: {}", path, e.getMessage());
            return false;
        }
    }
}
