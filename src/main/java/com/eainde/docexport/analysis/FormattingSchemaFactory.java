package com.eainde.docexport.analysis;

import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.registry.PropertyDescriptor;
import com.eainde.docexport.registry.PropertyRegistry;
import com.eainde.docexport.registry.Scope;
import com.eainde.docexport.registry.TextAlignment;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Derives the extraction schema and the prompt's property list from a {@link PropertyRegistry}.
 *
 * <p>Body and page keys are offered bare, title keys with the {@code title_} prefix, so the
 * extracted mapping can be fed to the formatting engine as-is. Nothing is required: a property
 * the instruction does not mention must stay absent.</p>
 */
public class FormattingSchemaFactory {

    private final Map<DocumentKind, JsonSchema> schemas = new EnumMap<>(DocumentKind.class);

    public FormattingSchemaFactory() {
        for (DocumentKind kind : DocumentKind.values()) {
            schemas.put(kind, buildSchema(PropertyRegistry.forKind(kind)));
        }
    }

    public JsonSchema schemaFor(DocumentKind kind) {
        return schemas.get(kind);
    }

    /**
     * One line per offered key, e.g. {@code - title_alignment (left|center|right|justify): Title alignment}.
     */
    public String describeProperties(DocumentKind kind) {
        StringJoiner lines = new StringJoiner("\n");
        offeredKeys(PropertyRegistry.forKind(kind)).forEach((key, descriptor) ->
                lines.add("- " + key + " (" + typeHint(descriptor) + "): " + descriptor.description()));
        return lines.toString();
    }

    static Map<String, PropertyDescriptor> offeredKeys(PropertyRegistry registry) {
        Map<String, PropertyDescriptor> keys = new LinkedHashMap<>();
        for (Scope scope : Scope.values()) {
            for (PropertyDescriptor descriptor : registry.descriptors(scope)) {
                String key = scope.acceptsBareKeys() ? descriptor.key() : scope.qualify(descriptor.key());
                keys.putIfAbsent(key, descriptor);
            }
        }
        return keys;
    }

    private JsonSchema buildSchema(PropertyRegistry registry) {
        JsonObjectSchema.Builder root = JsonObjectSchema.builder()
                .description("Formatting preferences explicitly requested for a "
                        + registry.kind().label().toUpperCase(Locale.ROOT) + " export");
        offeredKeys(registry).forEach((key, descriptor) -> root.addProperty(key, element(descriptor)));
        return JsonSchema.builder()
                .name(capitalize(registry.kind().label()) + "FormattingPreferences")
                .rootElement(root.build())
                .build();
    }

    private static JsonSchemaElement element(PropertyDescriptor descriptor) {
        String description = descriptor.description() + rangeHint(descriptor);
        return switch (descriptor.type()) {
            case STRING -> JsonStringSchema.builder().description(description).build();
            case INTEGER -> JsonIntegerSchema.builder().description(description).build();
            case NUMBER -> JsonNumberSchema.builder().description(description).build();
            case BOOLEAN -> JsonBooleanSchema.builder().description(description).build();
            case ALIGNMENT -> JsonEnumSchema.builder()
                    .description(description)
                    .enumValues(Arrays.stream(TextAlignment.values()).map(TextAlignment::label).toList())
                    .build();
        };
    }

    private static String typeHint(PropertyDescriptor descriptor) {
        return switch (descriptor.type()) {
            case ALIGNMENT -> String.join("|", Arrays.stream(TextAlignment.values()).map(TextAlignment::label).toList());
            case INTEGER, NUMBER -> "number" + rangeHint(descriptor);
            default -> descriptor.type().name().toLowerCase(Locale.ROOT);
        };
    }

    private static String rangeHint(PropertyDescriptor descriptor) {
        if (descriptor.min() == null || descriptor.max() == null) {
            return "";
        }
        return String.format(Locale.ROOT, " (%s to %s)", trim(descriptor.min()), trim(descriptor.max()));
    }

    private static String trim(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }

    private static String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
