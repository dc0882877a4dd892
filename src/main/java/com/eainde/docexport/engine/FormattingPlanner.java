package com.eainde.docexport.engine;

import com.eainde.docexport.registry.PropertyDescriptor;
import com.eainde.docexport.registry.PropertyRegistry;
import com.eainde.docexport.registry.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a sparse preference mapping into a {@link FormattingPlan}.
 *
 * <h3>Layering, per scope</h3>
 * <ol>
 *   <li>registry defaults</li>
 *   <li>bare keys ({@code fontSize}), only for scopes that accept them</li>
 *   <li>scope-prefixed keys ({@code title_fontSize}), which always win over bare keys</li>
 * </ol>
 * The title never inherits bare keys, so {@code fontSize} styles the body only.
 * Keys that no scope recognizes are collected as ignored; they never raise.
 */
public class FormattingPlanner {

    private static final Logger log = LoggerFactory.getLogger(FormattingPlanner.class);

    public FormattingPlan plan(PropertyRegistry registry, Map<String, ?> preferences) {
        Map<Scope, Map<String, Object>> bare = emptyScopeMap();
        Map<Scope, Map<String, Object>> prefixed = emptyScopeMap();
        Set<String> ignored = new LinkedHashSet<>();

        if (preferences != null) {
            for (Map.Entry<String, ?> entry : preferences.entrySet()) {
                String key = entry.getKey();
                Object raw = entry.getValue();
                if (key == null || raw == null) {
                    continue;
                }
                if (!route(registry, key, raw, bare, prefixed)) {
                    ignored.add(key);
                }
            }
        }
        if (!ignored.isEmpty()) {
            log.debug("Ignoring preferences not recognized by {}: {}", registry, ignored);
        }

        Map<Scope, Map<String, Object>> resolved = new EnumMap<>(Scope.class);
        List<PropertyFailure> rejected = new ArrayList<>();
        for (Scope scope : Scope.values()) {
            Map<String, Object> values = new LinkedHashMap<>(registry.defaults(scope));
            if (scope.acceptsBareKeys()) {
                layer(registry, scope, bare.get(scope), values, rejected);
            }
            layer(registry, scope, prefixed.get(scope), values, rejected);
            resolved.put(scope, values);
        }
        return new FormattingPlan(registry.kind(), resolved, ignored, rejected);
    }

    private boolean route(PropertyRegistry registry, String key, Object raw,
                          Map<Scope, Map<String, Object>> bare,
                          Map<Scope, Map<String, Object>> prefixed) {
        Optional<Scope> prefixScope = Scope.ofPrefixedKey(key);
        if (prefixScope.isPresent()) {
            Scope scope = prefixScope.get();
            String stripped = key.substring(scope.prefix().length());
            if (registry.recognizes(scope, stripped)) {
                prefixed.get(scope).put(stripped, raw);
                return true;
            }
        }
        boolean matched = false;
        for (Scope scope : Scope.values()) {
            if (scope.acceptsBareKeys() && registry.recognizes(scope, key)) {
                bare.get(scope).put(key, raw);
                matched = true;
            }
        }
        return matched;
    }

    private void layer(PropertyRegistry registry, Scope scope, Map<String, Object> overrides,
                       Map<String, Object> target, List<PropertyFailure> rejected) {
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            PropertyDescriptor descriptor = registry.descriptor(scope, entry.getKey()).orElseThrow();
            try {
                target.put(entry.getKey(), descriptor.validate(entry.getValue()));
            } catch (IllegalArgumentException e) {
                log.warn("Rejected {} property {}={}: {}", scope, entry.getKey(), entry.getValue(), e.getMessage());
                rejected.add(new PropertyFailure(scope, entry.getKey(), entry.getValue(), e.getMessage()));
            }
        }
    }

    private static Map<Scope, Map<String, Object>> emptyScopeMap() {
        Map<Scope, Map<String, Object>> map = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            map.put(scope, new LinkedHashMap<>());
        }
        return map;
    }
}
