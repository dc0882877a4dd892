package com.eainde.docexport.controller;

import com.eainde.docexport.analysis.IntentAnalysis;

public record ReviewResponse(boolean exportIntent, String format, String reasoning) {

    static ReviewResponse from(IntentAnalysis analysis) {
        return new ReviewResponse(analysis.exportIntent(), analysis.documentKind().label(), analysis.reasoning());
    }
}
