package com.eainde.docexport.llm;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    // --- Tests for toLangChainSchema ---

    @Test
    void toLangChainSchema_shouldParseSimpleObjectWithPrimitives() {
        // Arrange
        String json = "{\n" +
                "  \"type\": \"object\",\n" +
                "  \"properties\": {\n" +
                "    \"title\": { \"type\": \"string\", \"description\": \"Document title\" },\n" +
                "    \"pages\": { \"type\": \"integer\" },\n" +
                "    \"draft\": { \"type\": \"boolean\" }\n" +
                "  },\n" +
                "  \"required\": [\"title\"]\n" +
                "}";

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("Document", json);

        // Assert
        assertThat(result.name()).isEqualTo("Document");
        assertThat(result.rootElement()).isInstanceOf(JsonObjectSchema.class);
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();

        assertThat(root.properties()).containsOnlyKeys("title", "pages", "draft");
        JsonSchemaElement titleElement = root.properties().get("title");
        assertThat(titleElement).isInstanceOf(JsonStringSchema.class);
        assertThat(titleElement.description()).isEqualTo("Document title");
        assertThat(root.properties().get("draft")).isInstanceOf(JsonBooleanSchema.class);
        assertThat(root.required()).containsExactly("title");
    }

    @Test
    void toLangChainSchema_shouldParseArraysAndNestedObjects() {
        // Arrange
        String json = "{\n" +
                "  \"type\": \"object\",\n" +
                "  \"properties\": {\n" +
                "    \"sections\": { \"type\": \"array\", \"items\": { \"type\": \"string\" } },\n" +
                "    \"page\": { \"type\": \"object\", \"properties\": { \"size\": { \"type\": \"string\" } } }\n" +
                "  }\n" +
                "}";

        // Act
        JsonObjectSchema root = (JsonObjectSchema) JsonSchemaConverter.toLangChainSchema("Nested", json).rootElement();

        // Assert
        assertThat(root.properties().get("sections")).isInstanceOf(JsonArraySchema.class);
        assertThat(((JsonArraySchema) root.properties().get("sections")).items()).isInstanceOf(JsonStringSchema.class);
        assertThat(((JsonObjectSchema) root.properties().get("page")).properties()).containsKey("size");
    }

    @Test
    void toLangChainSchema_shouldParseEnums() {
        // Arrange
        String json = "{ \"type\": \"object\", \"properties\": {" +
                " \"format\": { \"type\": \"string\", \"enum\": [\"word\", \"pdf\"] } } }";

        // Act
        JsonObjectSchema root = (JsonObjectSchema) JsonSchemaConverter.toLangChainSchema("EnumTest", json).rootElement();

        // Assert
        assertThat(root.properties().get("format")).isInstanceOf(JsonEnumSchema.class);
        assertThat(((JsonEnumSchema) root.properties().get("format")).enumValues()).containsExactly("word", "pdf");
    }

    @Test
    void toLangChainSchema_shouldThrowException_whenJsonIsInvalid() {
        // Arrange
        String invalidJson = "{ \"type\": \"object\", ... INVALID SYNTAX ... }";

        // Act & Assert
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("FailTest", invalidJson))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON Schema FailTest");
    }

    // --- Tests for fromResource ---

    @Test
    void fromResource_shouldLoadExportIntentSchema() {
        // Act
        JsonSchema schema = JsonSchemaConverter.fromResource("ExportIntent", "schemas/export-intent.schema.json");

        // Assert
        JsonObjectSchema root = (JsonObjectSchema) schema.rootElement();
        assertThat(root.properties()).containsOnlyKeys("export_intent", "format", "reasoning");
        assertThat(root.required()).contains("export_intent", "format");
    }

    @Test
    void fromResource_shouldFailForMissingResource() {
        assertThatThrownBy(() -> JsonSchemaConverter.fromResource("Missing", "schemas/missing.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // --- Tests for describe ---

    @Test
    void describe_shouldListFieldsWithTypesAndEnumValues() {
        // Arrange
        JsonSchema schema = JsonSchemaConverter.fromResource("ExportIntent", "schemas/export-intent.schema.json");

        // Act
        String description = JsonSchemaConverter.describe(schema);

        // Assert
        assertThat(description)
                .startsWith("Respond with a single JSON object")
                .contains("- export_intent (boolean, required)")
                .contains("- format (string, required)")
                .contains("One of: word, pdf.");
    }

    @Test
    void describe_shouldMentionOptionalFields() {
        // Arrange
        JsonSchema schema = JsonSchemaConverter.toLangChainSchema("Prefs",
                "{ \"type\": \"object\", \"properties\": { \"size\": { \"type\": \"integer\" } } }");

        // Act & Assert
        assertThat(JsonSchemaConverter.describe(schema))
                .contains("- size (integer)")
                .contains("Omit fields that do not apply.");
    }
}
