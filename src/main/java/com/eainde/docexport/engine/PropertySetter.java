package com.eainde.docexport.engine;

/**
 * Applies one already-coerced property value to a rendering target.
 *
 * @param <T> the target, e.g. a POI run or a PDF text style
 */
@FunctionalInterface
public interface PropertySetter<T> {

    void apply(T target, Object value);
}
