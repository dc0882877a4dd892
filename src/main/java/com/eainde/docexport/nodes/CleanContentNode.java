package com.eainde.docexport.nodes;

import com.eainde.docexport.analysis.ContentCleaner;
import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.StageResult;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class CleanContentNode implements AsyncNodeAction<ExportState> {

    private final ContentCleaner cleaner;

    public CleanContentNode(ContentCleaner cleaner) {
        this.cleaner = cleaner;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExportState state) {
        StageResult<String> result = cleaner.clean(state.getSourceText());

        Map<String, Object> update = new HashMap<>();
        update.put(ExportState.SOURCE_TEXT, result.value());
        result.failure().ifPresent(failure -> update.putAll(state.withFailures(List.of(failure))));
        return CompletableFuture.completedFuture(update);
    }
}
