package com.eainde.docexport.workflow;

/**
 * Per-run switches.
 *
 * @param cleanContent run the content cleaner before extraction
 * @param customName   artifact base name, or {@code null} for the configured default
 */
public record WorkflowOptions(boolean cleanContent, String customName) {

    public static WorkflowOptions defaults() {
        return new WorkflowOptions(false, null);
    }

    public WorkflowOptions withCleaning(boolean clean) {
        return new WorkflowOptions(clean, customName);
    }

    public WorkflowOptions withCustomName(String name) {
        return new WorkflowOptions(cleanContent, name);
    }
}
