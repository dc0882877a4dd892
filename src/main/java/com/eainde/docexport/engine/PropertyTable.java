package com.eainde.docexport.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Enumerated setters for one target type. A renderer keeps one table per
 * (document kind, scope, target) and only keys listed here are ever applied to that target.
 *
 * <pre>
 * PropertyTable&lt;XWPFRun&gt; RUN = PropertyTable.&lt;XWPFRun&gt;builder()
 *         .bool("bold", XWPFRun::setBold)
 *         .integer("size", XWPFRun::setFontSize)
 *         .build();
 * </pre>
 */
public final class PropertyTable<T> {

    private final Map<String, PropertySetter<T>> setters;

    private PropertyTable(Map<String, PropertySetter<T>> setters) {
        this.setters = Collections.unmodifiableMap(setters);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public PropertySetter<T> setter(String key) {
        return setters.get(key);
    }

    public boolean handles(String key) {
        return setters.containsKey(key);
    }

    public Set<String> keys() {
        return setters.keySet();
    }

    public static final class Builder<T> {

        private final Map<String, PropertySetter<T>> setters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<T> string(String key, BiConsumer<T, String> setter) {
            return put(key, (target, value) -> setter.accept(target, (String) value));
        }

        public Builder<T> integer(String key, BiConsumer<T, Integer> setter) {
            return put(key, (target, value) -> setter.accept(target, ((Number) value).intValue()));
        }

        public Builder<T> number(String key, BiConsumer<T, Double> setter) {
            return put(key, (target, value) -> setter.accept(target, ((Number) value).doubleValue()));
        }

        public Builder<T> bool(String key, BiConsumer<T, Boolean> setter) {
            return put(key, (target, value) -> setter.accept(target, (Boolean) value));
        }

        public <V> Builder<T> typed(String key, Class<V> type, BiConsumer<T, V> setter) {
            return put(key, (target, value) -> setter.accept(target, type.cast(value)));
        }

        public Builder<T> put(String key, PropertySetter<T> setter) {
            if (setters.put(key, setter) != null) {
                throw new IllegalStateException("Duplicate setter for " + key);
            }
            return this;
        }

        public PropertyTable<T> build() {
            return new PropertyTable<>(setters);
        }
    }
}
