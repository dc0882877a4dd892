package com.eainde.docexport.registry;

import java.util.Optional;

/**
 * Region of a document that styling properties apply to independently.
 */
public enum Scope {

    /** Body paragraphs. Accepts bare keys and {@code body_} keys. */
    BODY("body_", true),

    /** The title line. Only {@code title_} keys reach it. */
    TITLE("title_", false),

    /** Page geometry. Accepts bare keys and {@code page_} keys. */
    PAGE("page_", true);

    private final String prefix;
    private final boolean acceptsBareKeys;

    Scope(String prefix, boolean acceptsBareKeys) {
        this.prefix = prefix;
        this.acceptsBareKeys = acceptsBareKeys;
    }

    public String prefix() {
        return prefix;
    }

    public boolean acceptsBareKeys() {
        return acceptsBareKeys;
    }

    public String qualify(String key) {
        return prefix + key;
    }

    /**
     * Returns the scope whose prefix starts the given preference key, if any.
     */
    public static Optional<Scope> ofPrefixedKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (Scope scope : values()) {
            if (key.startsWith(scope.prefix) && key.length() > scope.prefix.length()) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
