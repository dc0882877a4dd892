package com.eainde.docexport.engine;

import com.eainde.docexport.registry.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs property tables against rendering targets for a single render call.
 *
 * <p>Each setter is invoked in its own try block: a failing property is logged, recorded once
 * (even when the same table is applied to many paragraphs) and skipped, and the remaining
 * properties still apply. Keys without a setter in the given table are left for other tables.</p>
 */
public class PropertyApplier {

    private static final Logger log = LoggerFactory.getLogger(PropertyApplier.class);

    private final Map<Scope, Map<String, Object>> applied = new EnumMap<>(Scope.class);
    private final Map<String, PropertyFailure> failures = new LinkedHashMap<>();

    public <T> T apply(Scope scope, Map<String, Object> properties, T target, PropertyTable<T> table) {
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            String key = entry.getKey();
            if (!table.handles(key)) {
                continue;
            }
            String failureKey = scope + "." + key;
            if (failures.containsKey(failureKey)) {
                continue;
            }
            try {
                table.setter(key).apply(target, entry.getValue());
                applied.computeIfAbsent(scope, s -> new LinkedHashMap<>()).put(key, entry.getValue());
                log.debug("Applied {}.{} = {}", scope, key, entry.getValue());
            } catch (RuntimeException e) {
                log.warn("Failed to apply {}.{} = {}: {}", scope, key, entry.getValue(), e.getMessage());
                failures.put(failureKey, new PropertyFailure(scope, key, entry.getValue(), e.getMessage()));
                Map<String, Object> scopeApplied = applied.get(scope);
                if (scopeApplied != null) {
                    scopeApplied.remove(key);
                }
            }
        }
        return target;
    }

    /**
     * Withdraws a property that applied on its own but cannot be used together with the others.
     * The caller is responsible for restoring the target's previous value.
     */
    public void reject(Scope scope, String key, Object value, String reason) {
        log.warn("Reverted {}.{} = {}: {}", scope, key, value, reason);
        failures.put(scope + "." + key, new PropertyFailure(scope, key, value, reason));
        Map<String, Object> scopeApplied = applied.get(scope);
        if (scopeApplied != null) {
            scopeApplied.remove(key);
        }
    }

    public Map<Scope, Map<String, Object>> applied() {
        Map<Scope, Map<String, Object>> copy = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            copy.put(scope, Collections.unmodifiableMap(new LinkedHashMap<>(applied.getOrDefault(scope, Map.of()))));
        }
        return Collections.unmodifiableMap(copy);
    }

    public List<PropertyFailure> failures() {
        return List.copyOf(new ArrayList<>(failures.values()));
    }
}
