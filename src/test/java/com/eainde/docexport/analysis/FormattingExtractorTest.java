package com.eainde.docexport.analysis;

import com.eainde.docexport.llm.LlmClient;
import com.eainde.docexport.llm.LlmServiceException;
import com.eainde.docexport.llm.PromptTemplates;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.FailureKind;
import com.eainde.docexport.state.StageResult;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormattingExtractorTest {

    @Mock private LlmClient llmClient;

    private final FormattingSchemaFactory schemaFactory = new FormattingSchemaFactory();
    private FormattingExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FormattingExtractor(llmClient, new PromptTemplates(), schemaFactory);
    }

    @Test
    @DisplayName("keeps mentioned properties and drops explicit nulls")
    void dropsNulls() {
        Map<String, Object> answer = new HashMap<>();
        answer.put("name", "Arial");
        answer.put("size", 14);
        answer.put("bold", true);
        answer.put("title_alignment", "center");
        answer.put("italic", null);
        when(llmClient.invokeStructured(any(), any(), eq(Map.class))).thenReturn(answer);

        StageResult<Map<String, Object>> result =
                extractor.extract("Export as Word with Arial 14pt bold, centered title", DocumentKind.WORD);

        assertThat(result.value()).containsOnly(
                Map.entry("name", "Arial"),
                Map.entry("size", 14),
                Map.entry("bold", true),
                Map.entry("title_alignment", "center"));
        assertThat(result.failure()).isEmpty();
    }

    @Test
    @DisplayName("the prompt and schema are biased by the document kind")
    void biasedByKind() {
        when(llmClient.invokeStructured(any(), any(), eq(Map.class))).thenReturn(Map.of());

        extractor.extract("Save as PDF with 1 inch margins", DocumentKind.PDF);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<JsonSchema> schema = ArgumentCaptor.forClass(JsonSchema.class);
        verify(llmClient).invokeStructured(prompt.capture(), schema.capture(), eq(Map.class));
        assertThat(prompt.getValue())
                .contains("PDF export")
                .contains("- leftMargin")
                .contains("- title_fontSize")
                .doesNotContain("- line_spacing");
        assertThat(schema.getValue()).isSameAs(schemaFactory.schemaFor(DocumentKind.PDF));
    }

    @Test
    void failureYieldsEmptyPreferences() {
        when(llmClient.invokeStructured(any(), any(), eq(Map.class))).thenThrow(new LlmServiceException("bad json"));

        StageResult<Map<String, Object>> result = extractor.extract("make it pretty", DocumentKind.WORD);

        assertThat(result.value()).isEmpty();
        assertThat(result.failure()).hasValueSatisfying(f -> {
            assertThat(f.kind()).isEqualTo(FailureKind.EXTRACTION);
            assertThat(f.stage()).isEqualTo("extract_format");
        });
    }

    @Test
    void blankInstructionSkipsTheModel() {
        assertThat(extractor.extract("", DocumentKind.PDF).value()).isEmpty();
        verifyNoInteractions(llmClient);
    }

    @Nested
    @DisplayName("FormattingSchemaFactory")
    class Schemas {

        @Test
        @DisplayName("title keys are prefixed, body and page keys bare, nothing required")
        void pdfSchemaKeys() {
            JsonObjectSchema root = (JsonObjectSchema) schemaFactory.schemaFor(DocumentKind.PDF).rootElement();

            assertThat(root.properties()).containsKeys("fontName", "fontSize", "leftMargin", "pageSize",
                    "title_fontName", "title_fontSize", "title_alignment");
            assertThat(root.properties()).doesNotContainKeys("page_leftMargin", "body_fontSize", "name");
            assertThat(root.required()).isNullOrEmpty();
        }

        @Test
        void wordSchemaKeys() {
            JsonObjectSchema root = (JsonObjectSchema) schemaFactory.schemaFor(DocumentKind.WORD).rootElement();

            assertThat(root.properties()).containsKeys("name", "size", "bold", "line_spacing", "title_alignment", "title_size");
            assertThat(root.properties()).doesNotContainKeys("fontName", "leftMargin");
        }

        @Test
        void describesAlignmentChoicesAndRanges() {
            assertThat(schemaFactory.describeProperties(DocumentKind.WORD))
                    .contains("- title_alignment (left|center|right|justify)")
                    .contains("- size (number (1 to 1638))");
        }
    }
}
