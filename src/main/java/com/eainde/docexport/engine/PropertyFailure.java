package com.eainde.docexport.engine;

import com.eainde.docexport.registry.Scope;

import java.io.Serializable;
import java.util.Locale;

/**
 * A recognized property whose value could not be applied. The render continues without it.
 */
public record PropertyFailure(Scope scope, String key, Object value, String reason) implements Serializable {

    public String describe() {
        return scope.name().toLowerCase(Locale.ROOT) + "." + key + "=" + value + ": " + reason;
    }
}
