package com.eainde.docexport.nodes;

import com.eainde.docexport.engine.DocumentFormattingEngine;
import com.eainde.docexport.engine.PropertyFailure;
import com.eainde.docexport.engine.RenderException;
import com.eainde.docexport.engine.RenderResult;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.FailureKind;
import com.eainde.docexport.state.StageFailure;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Renders the current text and preferences as one fixed document kind. The router picks which
 * instance runs. A {@link RenderException} fails the node and therefore the whole run.
 */
@Log4j2
public class RenderDocumentNode implements AsyncNodeAction<ExportState> {

    private final DocumentFormattingEngine engine;
    private final DocumentKind kind;
    private final String nodeName;
    private final String customName;

    public RenderDocumentNode(DocumentFormattingEngine engine, DocumentKind kind, String nodeName, String customName) {
        this.engine = engine;
        this.kind = kind;
        this.nodeName = nodeName;
        this.customName = customName;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExportState state) {
        log.info("Executing {} export...", kind.label());
        RenderResult result;
        try {
            result = engine.render(state.getSourceText(), state.getPreferences(), kind, customName);
        } catch (RenderException e) {
            return CompletableFuture.failedFuture(e);
        }

        List<StageFailure> failures = result.propertyFailures().stream()
                .map(this::toStageFailure)
                .toList();
        if (!result.ignoredKeys().isEmpty()) {
            log.info("Ignored unsupported {} preferences: {}", kind.label(), result.ignoredKeys());
        }

        Map<String, Object> update = new HashMap<>();
        update.put(ExportState.ARTIFACT_PATH, result.path().toString());
        if (!failures.isEmpty()) {
            update.putAll(state.withFailures(failures));
        }
        return CompletableFuture.completedFuture(update);
    }

    private StageFailure toStageFailure(PropertyFailure failure) {
        return new StageFailure(FailureKind.PROPERTY_APPLICATION, nodeName, failure.describe());
    }
}
