package com.eainde.docexport.registry;

import java.util.Objects;
import java.util.Optional;

/**
 * One legal preference key within a scope.
 *
 * @param key          bare key, e.g. {@code fontSize}
 * @param type         value type used for coercion and for the extraction schema
 * @param description  human-readable hint, also sent to the extractor
 * @param defaultValue built-in default, or {@code null} when the property is only applied on request
 * @param min          inclusive lower bound for numeric types, or {@code null}
 * @param max          inclusive upper bound for numeric types, or {@code null}
 */
public record PropertyDescriptor(String key,
                                 PropertyType type,
                                 String description,
                                 Object defaultValue,
                                 Double min,
                                 Double max) {

    public PropertyDescriptor {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
    }

    public static PropertyDescriptor of(String key, PropertyType type, String description) {
        return new PropertyDescriptor(key, type, description, null, null, null);
    }

    public PropertyDescriptor withDefault(Object value) {
        return new PropertyDescriptor(key, type, description, type.coerce(value), min, max);
    }

    public PropertyDescriptor withRange(double lower, double upper) {
        return new PropertyDescriptor(key, type, description, defaultValue, lower, upper);
    }

    public Optional<Object> defaultValueOptional() {
        return Optional.ofNullable(defaultValue);
    }

    /**
     * Coerces the raw value and checks its range.
     *
     * @throws IllegalArgumentException if the value has the wrong type or is out of range
     */
    public Object validate(Object raw) {
        Object value = type.coerce(raw);
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException(key + " must be a finite number but was " + raw);
            }
            if ((min != null && d < min) || (max != null && d > max)) {
                throw new IllegalArgumentException(
                        key + " must be between " + min + " and " + max + " but was " + raw);
            }
        }
        return value;
    }
}
