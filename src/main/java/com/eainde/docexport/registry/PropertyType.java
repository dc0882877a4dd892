package com.eainde.docexport.registry;

import java.util.Locale;

/**
 * Value type of a registered property, with the coercion applied to raw preference values
 * before any setter sees them. LLM output is loosely typed, so numbers may arrive as
 * strings ({@code "14pt"}) and booleans as words ({@code "yes"}).
 */
public enum PropertyType {

    STRING {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof String text && !text.isBlank()) {
                return text.trim();
            }
            throw new IllegalArgumentException("Expected a non-empty string but got: " + raw);
        }
    },

    INTEGER {
        @Override
        public Object coerce(Object raw) {
            double value = toNumber(raw);
            if (value != Math.rint(value)) {
                throw new IllegalArgumentException("Expected a whole number but got: " + raw);
            }
            return (int) value;
        }
    },

    NUMBER {
        @Override
        public Object coerce(Object raw) {
            return toNumber(raw);
        }
    },

    BOOLEAN {
        @Override
        public Object coerce(Object raw) {
            if (raw instanceof Boolean flag) {
                return flag;
            }
            if (raw instanceof String text) {
                switch (text.trim().toLowerCase(Locale.ROOT)) {
                    case "true", "yes", "on", "1":
                        return Boolean.TRUE;
                    case "false", "no", "off", "0":
                        return Boolean.FALSE;
                    default:
                        break;
                }
            }
            throw new IllegalArgumentException("Expected a boolean but got: " + raw);
        }
    },

    ALIGNMENT {
        @Override
        public Object coerce(Object raw) {
            return TextAlignment.parse(raw);
        }
    };

    /**
     * Converts a raw preference value to this type's canonical Java representation.
     *
     * @throws IllegalArgumentException if the value cannot be represented
     */
    public abstract Object coerce(Object raw);

    private static double toNumber(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            String cleaned = text.trim().toLowerCase(Locale.ROOT);
            if (cleaned.endsWith("pt")) {
                cleaned = cleaned.substring(0, cleaned.length() - 2).trim();
            }
            try {
                return Double.parseDouble(cleaned);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected a number but got: " + raw, e);
            }
        }
        throw new IllegalArgumentException("Expected a number but got: " + raw);
    }
}
