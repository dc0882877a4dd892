package com.eainde.docexport.engine;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses color preferences: {@code #RRGGBB}, {@code RRGGBB} or a basic color name.
 */
public final class NamedColors {

    private static final Pattern HEX = Pattern.compile("#?([0-9a-fA-F]{6})");

    private static final Map<String, Integer> NAMES = Map.ofEntries(
            Map.entry("black", 0x000000),
            Map.entry("white", 0xFFFFFF),
            Map.entry("red", 0xFF0000),
            Map.entry("green", 0x008000),
            Map.entry("blue", 0x0000FF),
            Map.entry("navy", 0x000080),
            Map.entry("gray", 0x808080),
            Map.entry("grey", 0x808080),
            Map.entry("darkgray", 0x404040),
            Map.entry("darkgrey", 0x404040),
            Map.entry("orange", 0xFFA500),
            Map.entry("purple", 0x800080),
            Map.entry("maroon", 0x800000),
            Map.entry("teal", 0x008080),
            Map.entry("yellow", 0xFFFF00));

    private NamedColors() {
    }

    /**
     * @return the color as a 24-bit RGB integer
     * @throws IllegalArgumentException for anything that is neither a hex code nor a known name
     */
    public static int parseRgb(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Color must not be null");
        }
        String text = value.trim();
        var matcher = HEX.matcher(text);
        if (matcher.matches()) {
            return Integer.parseInt(matcher.group(1), 16);
        }
        Integer named = NAMES.get(text.toLowerCase(Locale.ROOT).replace(" ", ""));
        if (named == null) {
            throw new IllegalArgumentException("Unknown color: " + value);
        }
        return named;
    }

    public static String toHex(String value) {
        return String.format("%06X", parseRgb(value));
    }
}
