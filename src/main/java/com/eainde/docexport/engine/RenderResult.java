package com.eainde.docexport.engine;

import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.registry.Scope;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a successful render.
 *
 * @param path               the written artifact
 * @param kind               document kind that was rendered
 * @param appliedProperties  values that were actually set, per scope (defaults included)
 * @param ignoredKeys        preference keys the registry did not recognize
 * @param propertyFailures   recognized properties that were rejected or failed to apply
 */
public record RenderResult(Path path,
                           DocumentKind kind,
                           Map<Scope, Map<String, Object>> appliedProperties,
                           Set<String> ignoredKeys,
                           List<PropertyFailure> propertyFailures) {

    static RenderResult of(Path path, FormattingPlan plan, RenderReport report) {
        List<PropertyFailure> failures = new ArrayList<>(plan.rejected());
        failures.addAll(report.failures());
        return new RenderResult(path, plan.kind(), report.applied(), plan.ignoredKeys(), List.copyOf(failures));
    }

    public Map<String, Object> applied(Scope scope) {
        return appliedProperties.getOrDefault(scope, Map.of());
    }
}
