package com.eainde.docexport.controller;

import com.eainde.docexport.state.ExportState;
import com.eainde.docexport.state.StageFailure;

import java.util.List;
import java.util.Map;

public record ExportResponse(boolean exported,
                             String artifactPath,
                             String format,
                             boolean exportIntent,
                             String reasoning,
                             Map<String, Object> preferences,
                             List<StageFailure> failures) {

    static ExportResponse from(ExportState state) {
        String path = state.getArtifactPath().map(Object::toString).orElse(null);
        return new ExportResponse(path != null, path, state.getDocumentKind().label(), state.isExportIntent(),
                state.getReasoning(), state.getPreferences(), state.getFailures());
    }

    static ExportResponse notRequested(String reasoning) {
        return new ExportResponse(false, null, null, false, reasoning, Map.of(), List.of());
    }
}
