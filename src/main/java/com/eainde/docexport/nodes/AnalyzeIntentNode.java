package com.eainde.docexport.nodes;

import com.eainde.docexport.analysis.IntentAnalysis;
import com.eainde.docexport.analysis.IntentClassifier;
import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.StageResult;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class AnalyzeIntentNode implements AsyncNodeAction<ExportState> {

    private final IntentClassifier classifier;

    public AnalyzeIntentNode(IntentClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(ExportState state) {
        StageResult<IntentAnalysis> result = classifier.classify(state.getInstruction());
        IntentAnalysis analysis = result.value();

        Map<String, Object> update = new HashMap<>();
        update.put(ExportState.EXPORT_INTENT, analysis.exportIntent());
        update.put(ExportState.DOCUMENT_KIND, analysis.documentKind());
        update.put(ExportState.REASONING, analysis.reasoning());
        result.failure().ifPresent(failure -> update.putAll(state.withFailures(List.of(failure))));
        return CompletableFuture.completedFuture(update);
    }
}
