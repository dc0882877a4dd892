package com.eainde.docexport.engine;

import com.eainde.docexport.files.ArtifactPathAllocator;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.registry.PropertyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw text and a sparse preference mapping into a finished artifact.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>split the text into title and body paragraphs</li>
 *   <li>resolve a {@link FormattingPlan} against the kind's {@link PropertyRegistry}</li>
 *   <li>reserve an output path and let the kind's {@link DocumentRenderer} write it</li>
 * </ol>
 *
 * <p>Unknown preference keys and per-property failures never abort a render. Only a document
 * that cannot be built or written at all raises {@link RenderException}, and in that case the
 * reserved file is deleted so no partial artifact is left behind.</p>
 */
public class DocumentFormattingEngine {

    private static final Logger log = LoggerFactory.getLogger(DocumentFormattingEngine.class);

    private final SourceTextParser parser;
    private final FormattingPlanner planner;
    private final ArtifactPathAllocator pathAllocator;
    private final Map<DocumentKind, DocumentRenderer> renderers = new EnumMap<>(DocumentKind.class);

    public DocumentFormattingEngine(SourceTextParser parser,
                                    FormattingPlanner planner,
                                    ArtifactPathAllocator pathAllocator,
                                    List<DocumentRenderer> renderers) {
        this.parser = parser;
        this.planner = planner;
        this.pathAllocator = pathAllocator;
        for (DocumentRenderer renderer : renderers) {
            this.renderers.put(renderer.kind(), renderer);
        }
        for (DocumentKind kind : DocumentKind.values()) {
            if (!this.renderers.containsKey(kind)) {
                throw new IllegalArgumentException("No renderer registered for " + kind);
            }
        }
    }

    public RenderResult render(String sourceText, Map<String, ?> preferences, DocumentKind kind) {
        return render(sourceText, preferences, kind, null);
    }

    /**
     * @param customName optional artifact base name
     * @throws RenderException if the document cannot be constructed or written
     */
    public RenderResult render(String sourceText, Map<String, ?> preferences, DocumentKind kind, String customName) {
        DocumentKind target = kind != null ? kind : DocumentKind.WORD;
        ParsedText text = parser.parse(sourceText);
        FormattingPlan plan = planner.plan(PropertyRegistry.forKind(target), preferences);

        Path path;
        try {
            path = pathAllocator.allocatePath(target, customName);
        } catch (IOException | RuntimeException e) {
            log.error("Could not allocate an output path for {} export", target.label(), e);
            throw new RenderException(target, "Could not allocate output file", e);
        }

        try {
            RenderReport report = renderers.get(target).render(text, plan, path);
            RenderResult result = RenderResult.of(path, plan, report);
            log.info("{} document created: {} ({} paragraphs, {} ignored keys, {} property failures)",
                    target.label(), path, text.paragraphs().size(),
                    result.ignoredKeys().size(), result.propertyFailures().size());
            return result;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to create {} document at {}", target.label(), path, e);
            deletePartialArtifact(path);
            throw new RenderException(target, "Failed to create " + target.label() + " document", e);
        }
    }

    private void deletePartialArtifact(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Deleted partial artifact {}", path);
            }
        } catch (IOException e) {
            log.warn("Could not delete partial artifact {}: {}", path, e.getMessage());
        }
    }
}
