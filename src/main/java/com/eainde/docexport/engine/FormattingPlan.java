package com.eainde.docexport.engine;

import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.registry.Scope;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fully resolved properties for one render call: registry defaults, then bare preferences,
 * then scope-prefixed preferences, per scope.
 *
 * @param kind         document kind the plan was resolved against
 * @param scopes       resolved, already-coerced values per scope
 * @param ignoredKeys  preference keys no scope of the active registry recognizes
 * @param rejected     recognized keys whose values failed coercion or range checks
 */
public record FormattingPlan(DocumentKind kind,
                             Map<Scope, Map<String, Object>> scopes,
                             Set<String> ignoredKeys,
                             List<PropertyFailure> rejected) {

    public FormattingPlan {
        Map<Scope, Map<String, Object>> copy = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            copy.put(scope, Collections.unmodifiableMap(new LinkedHashMap<>(scopes.getOrDefault(scope, Map.of()))));
        }
        scopes = Collections.unmodifiableMap(copy);
        ignoredKeys = Collections.unmodifiableSet(new LinkedHashSet<>(ignoredKeys));
        rejected = List.copyOf(rejected);
    }

    public Map<String, Object> scope(Scope scope) {
        return scopes.get(scope);
    }
}
