package com.eainde.docexport.nodes;

import com.eainde.docexport.files.ArtifactOpener;
import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.FailureKind;
import com.eainde.docexport.state.StageFailure;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Logs the outcome and, when enabled, asks the opener to show the artifact. Opening is best
 * effort: a failure is recorded as {@link FailureKind#NOTIFICATION} and nothing else changes.
 */
@Log4j2
public class FinalizeNode implements AsyncNodeAction<ExportState> {

    private final ArtifactOpener opener;
    private final boolean autoOpen;

    public FinalizeNode(ArtifactOpener opener, boolean autoOpen) {
        this.opener = opener;
        this.autoOpen = autoOpen;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExportState state) {
        Optional<Path> artifact = state.getArtifactPath();
        if (artifact.isEmpty()) {
            log.warn("Finalizing without an artifact");
            return CompletableFuture.completedFuture(Map.of());
        }

        Path path = artifact.get();
        log.info("Export complete: {}", path);
        log.info("   Format: {}", state.getDocumentKind().label());
        log.info("   Formatting requested: {}", state.getPreferences());

        if (!autoOpen) {
            return CompletableFuture.completedFuture(Map.of());
        }

        String problem;
        try {
            if (opener.openArtifact(path)) {
                log.info("File opened successfully");
                return CompletableFuture.completedFuture(Map.of());
            }
            problem = "Artifact could not be opened: " + path;
        } catch (RuntimeException e) {
            problem = "Opening artifact failed: " + e.getMessage();
        }
        log.warn(problem);
        return CompletableFuture.completedFuture(state.withFailures(List.of(
                new StageFailure(FailureKind.NOTIFICATION, NodeNames.FINALIZE, problem))));
    }
}
