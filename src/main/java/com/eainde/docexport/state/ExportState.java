package com.eainde.docexport.state;

import com.eainde.docexport.registry.DocumentKind;
import org.bsc.langgraph4j.state.AgentState;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request record threaded through one export run. Nodes never mutate it; they return partial
 * updates built with the static helpers below.
 */
public class ExportState extends AgentState {

    public static final String SOURCE_TEXT = "sourceText";
    public static final String INSTRUCTION = "instruction";
    public static final String EXPORT_INTENT = "exportIntent";
    public static final String DOCUMENT_KIND = "documentKind";
    public static final String REASONING = "reasoning";
    public static final String PREFERENCES = "preferences";
    public static final String ARTIFACT_PATH = "artifactPath";
    public static final String FAILURES = "failures";

    public ExportState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Input map for a fresh run.
     */
    public static Map<String, Object> initial(String sourceText, String instruction) {
        Map<String, Object> data = new HashMap<>();
        data.put(SOURCE_TEXT, sourceText != null ? sourceText : "");
        data.put(INSTRUCTION, instruction != null ? instruction : "");
        data.put(EXPORT_INTENT, false);
        data.put(DOCUMENT_KIND, DocumentKind.WORD);
        data.put(REASONING, "");
        data.put(PREFERENCES, new LinkedHashMap<String, Object>());
        data.put(FAILURES, new ArrayList<StageFailure>());
        return data;
    }

    public String getSourceText() {
        return (String) this.data().getOrDefault(SOURCE_TEXT, "");
    }

    public String getInstruction() {
        return (String) this.data().getOrDefault(INSTRUCTION, "");
    }

    public boolean isExportIntent() {
        return Boolean.TRUE.equals(this.data().get(EXPORT_INTENT));
    }

    public DocumentKind getDocumentKind() {
        Object kind = this.data().get(DOCUMENT_KIND);
        return kind instanceof DocumentKind documentKind ? documentKind : DocumentKind.WORD;
    }

    public String getReasoning() {
        return (String) this.data().getOrDefault(REASONING, "");
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getPreferences() {
        Object preferences = this.data().get(PREFERENCES);
        return preferences instanceof Map<?, ?> ? (Map<String, Object>) preferences : Map.of();
    }

    public Optional<Path> getArtifactPath() {
        return Optional.ofNullable((String) this.data().get(ARTIFACT_PATH)).map(Path::of);
    }

    @SuppressWarnings("unchecked")
    public List<StageFailure> getFailures() {
        Object failures = this.data().get(FAILURES);
        return failures instanceof List<?> ? List.copyOf((List<StageFailure>) failures) : List.of();
    }

    public boolean hasFailure(FailureKind kind) {
        return getFailures().stream().anyMatch(f -> f.kind() == kind);
    }

    /**
     * Update that appends {@code added} to the failures recorded so far.
     */
    public Map<String, Object> withFailures(Collection<StageFailure> added) {
        List<StageFailure> failures = new ArrayList<>(getFailures());
        failures.addAll(added);
        Map<String, Object> update = new HashMap<>();
        update.put(FAILURES, failures);
        return update;
    }
}
