package com.eainde.docexport.engine;

import com.eainde.docexport.registry.Scope;

import java.util.List;
import java.util.Map;

/**
 * What a renderer actually applied while writing a document.
 */
public record RenderReport(Map<Scope, Map<String, Object>> applied, List<PropertyFailure> failures) {

    public static RenderReport from(PropertyApplier applier) {
        return new RenderReport(applier.applied(), applier.failures());
    }
}
