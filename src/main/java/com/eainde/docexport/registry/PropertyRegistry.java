package com.eainde.docexport.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.eainde.docexport.registry.PropertyType.ALIGNMENT;
import static com.eainde.docexport.registry.PropertyType.BOOLEAN;
import static com.eainde.docexport.registry.PropertyType.INTEGER;
import static com.eainde.docexport.registry.PropertyType.NUMBER;
import static com.eainde.docexport.registry.PropertyType.STRING;

/**
 * Read-only table of the preference keys a document kind understands, per scope.
 *
 * <p>Registries are built once as constants and never mutated. Anything not listed here is
 * ignored by the formatting engine, so adding support for a new property means adding a
 * descriptor here and a setter in the matching renderer's property table.</p>
 */
public final class PropertyRegistry {

    public static final PropertyRegistry WORD = builder(DocumentKind.WORD)
            .add(Scope.BODY, PropertyDescriptor.of("name", STRING,
                    "Font name (e.g. Arial, Calibri, Times New Roman)").withDefault("Calibri"))
            .add(Scope.BODY, PropertyDescriptor.of("size", INTEGER,
                    "Font size in points").withRange(1, 1638).withDefault(11))
            .add(Scope.BODY, PropertyDescriptor.of("bold", BOOLEAN, "Bold body text"))
            .add(Scope.BODY, PropertyDescriptor.of("italic", BOOLEAN, "Italic body text"))
            .add(Scope.BODY, PropertyDescriptor.of("underline", BOOLEAN, "Underlined body text"))
            .add(Scope.BODY, PropertyDescriptor.of("color", STRING,
                    "Text color as a hex code (e.g. 1F4E79) or a basic color name"))
            .add(Scope.BODY, PropertyDescriptor.of("alignment", ALIGNMENT,
                    "Paragraph alignment: left, center, right or justify").withDefault(TextAlignment.LEFT))
            .add(Scope.BODY, PropertyDescriptor.of("line_spacing", NUMBER,
                    "Line spacing multiplier (1.0 = single, 2.0 = double)").withRange(0.5, 10))
            .add(Scope.TITLE, PropertyDescriptor.of("alignment", ALIGNMENT,
                    "Title alignment: left, center, right or justify").withDefault(TextAlignment.LEFT))
            .add(Scope.TITLE, PropertyDescriptor.of("name", STRING, "Title font name"))
            .add(Scope.TITLE, PropertyDescriptor.of("size", INTEGER,
                    "Title font size in points").withRange(1, 1638).withDefault(16))
            .add(Scope.TITLE, PropertyDescriptor.of("bold", BOOLEAN, "Bold title").withDefault(true))
            .add(Scope.TITLE, PropertyDescriptor.of("italic", BOOLEAN, "Italic title"))
            .add(Scope.TITLE, PropertyDescriptor.of("underline", BOOLEAN, "Underlined title"))
            .add(Scope.TITLE, PropertyDescriptor.of("color", STRING, "Title color as a hex code or color name"))
            .build();

    public static final PropertyRegistry PDF = builder(DocumentKind.PDF)
            .add(Scope.BODY, PropertyDescriptor.of("fontName", STRING,
                    "PDF font name (Helvetica, Times-Roman, Courier and their Bold/Oblique variants)")
                    .withDefault("Helvetica"))
            .add(Scope.BODY, PropertyDescriptor.of("fontSize", INTEGER,
                    "Font size in points").withRange(1, 400).withDefault(12))
            .add(Scope.BODY, PropertyDescriptor.of("textColor", STRING,
                    "Text color as a hex code (e.g. #333333) or a basic color name"))
            .add(Scope.BODY, PropertyDescriptor.of("alignment", ALIGNMENT,
                    "Paragraph alignment: left, center, right or justify").withDefault(TextAlignment.LEFT))
            .add(Scope.BODY, PropertyDescriptor.of("spaceBefore", INTEGER,
                    "Space before each paragraph in points").withRange(0, 720).withDefault(0))
            .add(Scope.BODY, PropertyDescriptor.of("spaceAfter", INTEGER,
                    "Space after each paragraph in points").withRange(0, 720).withDefault(12))
            .add(Scope.TITLE, PropertyDescriptor.of("fontName", STRING, "Title font name")
                    .withDefault("Helvetica-Bold"))
            .add(Scope.TITLE, PropertyDescriptor.of("fontSize", INTEGER,
                    "Title font size in points").withRange(1, 400).withDefault(18))
            .add(Scope.TITLE, PropertyDescriptor.of("textColor", STRING, "Title color as a hex code or color name"))
            .add(Scope.TITLE, PropertyDescriptor.of("alignment", ALIGNMENT,
                    "Title alignment: left, center, right or justify").withDefault(TextAlignment.LEFT))
            .add(Scope.TITLE, PropertyDescriptor.of("spaceAfter", INTEGER,
                    "Space after the title in points").withRange(0, 720).withDefault(12))
            .add(Scope.PAGE, PropertyDescriptor.of("leftMargin", INTEGER,
                    "Left margin in points (72 points = 1 inch)").withRange(0, 720).withDefault(72))
            .add(Scope.PAGE, PropertyDescriptor.of("rightMargin", INTEGER,
                    "Right margin in points").withRange(0, 720).withDefault(72))
            .add(Scope.PAGE, PropertyDescriptor.of("topMargin", INTEGER,
                    "Top margin in points").withRange(0, 720).withDefault(72))
            .add(Scope.PAGE, PropertyDescriptor.of("bottomMargin", INTEGER,
                    "Bottom margin in points").withRange(0, 720).withDefault(18))
            .add(Scope.PAGE, PropertyDescriptor.of("pageSize", STRING,
                    "Paper size: letter, a4 or legal").withDefault("letter"))
            .build();

    private final DocumentKind kind;
    private final Map<Scope, Map<String, PropertyDescriptor>> scopes;

    private PropertyRegistry(DocumentKind kind, Map<Scope, Map<String, PropertyDescriptor>> scopes) {
        this.kind = kind;
        this.scopes = scopes;
    }

    public static PropertyRegistry forKind(DocumentKind kind) {
        return kind == DocumentKind.PDF ? PDF : WORD;
    }

    public DocumentKind kind() {
        return kind;
    }

    public Optional<PropertyDescriptor> descriptor(Scope scope, String key) {
        return Optional.ofNullable(scopes.get(scope).get(key));
    }

    public boolean recognizes(Scope scope, String key) {
        return scopes.get(scope).containsKey(key);
    }

    public Collection<PropertyDescriptor> descriptors(Scope scope) {
        return scopes.get(scope).values();
    }

    /**
     * Defaults of the given scope, in registration order. Properties without a default are absent.
     */
    public Map<String, Object> defaults(Scope scope) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (PropertyDescriptor descriptor : descriptors(scope)) {
            descriptor.defaultValueOptional().ifPresent(v -> defaults.put(descriptor.key(), v));
        }
        return defaults;
    }

    @Override
    public String toString() {
        return "PropertyRegistry[" + kind.label() + "]";
    }

    private static Builder builder(DocumentKind kind) {
        return new Builder(kind);
    }

    private static final class Builder {

        private final DocumentKind kind;
        private final Map<Scope, Map<String, PropertyDescriptor>> scopes = new EnumMap<>(Scope.class);

        private Builder(DocumentKind kind) {
            this.kind = kind;
            for (Scope scope : Scope.values()) {
                scopes.put(scope, new LinkedHashMap<>());
            }
        }

        private Builder add(Scope scope, PropertyDescriptor descriptor) {
            if (scopes.get(scope).put(descriptor.key(), descriptor) != null) {
                throw new IllegalStateException("Duplicate " + scope + " property: " + descriptor.key());
            }
            return this;
        }

        private PropertyRegistry build() {
            Map<Scope, Map<String, PropertyDescriptor>> frozen = new EnumMap<>(Scope.class);
            scopes.forEach((scope, entries) -> frozen.put(scope, Collections.unmodifiableMap(entries)));
            return new PropertyRegistry(kind, Collections.unmodifiableMap(frozen));
        }
    }
}
