package com.eainde.docexport.analysis;

import com.eainde.docexport.registry.DocumentKind;

import java.io.Serializable;

/**
 * Classifier verdict for one instruction.
 */
public record IntentAnalysis(boolean exportIntent, DocumentKind documentKind, String reasoning) implements Serializable {

    public IntentAnalysis {
        documentKind = documentKind != null ? documentKind : DocumentKind.WORD;
        reasoning = reasoning != null ? reasoning : "";
    }

    /**
     * Safe default used whenever classification is unavailable.
     */
    public static IntentAnalysis noExport() {
        return new IntentAnalysis(false, DocumentKind.WORD, "");
    }
}
