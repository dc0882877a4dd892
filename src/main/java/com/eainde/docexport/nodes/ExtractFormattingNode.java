package com.eainde.docexport.nodes;

import com.eainde.docexport.analysis.FormattingExtractor;
import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.StageResult;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Extracts preferences for the kind the analyze step resolved.
 */
public class ExtractFormattingNode implements AsyncNodeAction<ExportState> {

    private final FormattingExtractor extractor;

    public ExtractFormattingNode(FormattingExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExportState state) {
        StageResult<Map<String, Object>> result = extractor.extract(state.getInstruction(), state.getDocumentKind());

        Map<String, Object> update = new HashMap<>();
        update.put(ExportState.PREFERENCES, new LinkedHashMap<>(result.value()));
        result.failure().ifPresent(failure -> update.putAll(state.withFailures(List.of(failure))));
        return CompletableFuture.completedFuture(update);
    }
}
