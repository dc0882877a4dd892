package com.eainde.docexport.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts plain JSON Schema documents into LangChain4j {@link JsonSchema} objects, and renders
 * a schema back to a prompt-friendly field list for models without native structured output.
 */
public final class JsonSchemaConverter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        try {
            JsonNode rootNode = objectMapper.readTree(jsonSchemaString);
            return JsonSchema.builder()
                    .name(name != null ? name : "Schema")
                    .rootElement(parseElement(rootNode))
                    .build();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse JSON Schema " + name, e);
        }
    }

    /**
     * Loads a schema document from the classpath, e.g. {@code schemas/export-intent.schema.json}.
     */
    public static JsonSchema fromResource(String name, String resourcePath) {
        try (InputStream in = JsonSchemaConverter.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Schema resource not found: " + resourcePath);
            }
            return toLangChainSchema(name, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read schema resource " + resourcePath, e);
        }
    }

    /**
     * Describes the top-level fields of an object schema as an instruction block.
     */
    public static String describe(JsonSchema schema) {
        StringBuilder out = new StringBuilder("Respond with a single JSON object and nothing else.");
        if (!(schema.rootElement() instanceof JsonObjectSchema root)) {
            return out.toString();
        }
        List<String> required = root.required() != null ? root.required() : List.of();
        out.append(" Fields:");
        for (Map.Entry<String, JsonSchemaElement> property : root.properties().entrySet()) {
            JsonSchemaElement element = property.getValue();
            out.append("\n- ").append(property.getKey()).append(" (").append(typeName(element));
            if (required.contains(property.getKey())) {
                out.append(", required");
            }
            out.append(")");
            if (element.description() != null) {
                out.append(": ").append(element.description());
            }
            if (element instanceof JsonEnumSchema enumSchema) {
                out.append(" One of: ").append(String.join(", ", enumSchema.enumValues())).append('.');
            }
        }
        if (required.size() < root.properties().size()) {
            out.append("\nOmit fields that do not apply.");
        }
        return out.toString();
    }

    private static String typeName(JsonSchemaElement element) {
        if (element instanceof JsonBooleanSchema) {
            return "boolean";
        } else if (element instanceof JsonIntegerSchema) {
            return "integer";
        } else if (element instanceof JsonNumberSchema) {
            return "number";
        } else if (element instanceof JsonArraySchema) {
            return "array";
        } else if (element instanceof JsonObjectSchema) {
            return "object";
        }
        return "string";
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) return parseObject(node);
            if (node.has("enum")) return parseString(node);
            return JsonStringSchema.builder().build();
        }

        String type = node.get("type").asText();

        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> parseInteger(node);
            case "number" -> parseNumber(node);
            case "boolean" -> parseBoolean(node);
            default -> parseString(node);
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();

        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }

        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> requiredFields = new ArrayList<>();
            node.get("required").forEach(n -> requiredFields.add(n.asText()));
            builder.required(requiredFields);
        }

        if (node.has("additionalProperties") && node.get("additionalProperties").isBoolean()) {
            builder.additionalProperties(node.get("additionalProperties").asBoolean());
        }

        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder();
        if (node.has("description")) builder.description(node.get("description").asText());
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> enumValues = new ArrayList<>();
            node.get("enum").forEach(n -> enumValues.add(n.asText()));
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(enumValues)
                    .build();
        }

        return JsonStringSchema.builder()
                .description(description(node))
                .build();
    }

    private static JsonIntegerSchema parseInteger(JsonNode node) {
        return JsonIntegerSchema.builder()
                .description(description(node))
                .build();
    }

    private static JsonNumberSchema parseNumber(JsonNode node) {
        return JsonNumberSchema.builder()
                .description(description(node))
                .build();
    }

    private static JsonBooleanSchema parseBoolean(JsonNode node) {
        return JsonBooleanSchema.builder()
                .description(description(node))
                .build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
