package com.eainde.docexport.analysis;

import com.eainde.docexport.llm.LlmClient;
import com.eainde.docexport.llm.PromptTemplates;
import com.eainde.docexport.nodes.NodeNames;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.FailureKind;
import com.eainde.docexport.state.StageFailure;
import com.eainde.docexport.state.StageResult;
import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns an instruction into a sparse preference mapping for the given document kind.
 *
 * <p>Only mentioned properties end up in the mapping. Keys the model answers with {@code null}
 * are dropped so the engine's defaults stay in charge. On failure the mapping is empty and an
 * {@link FailureKind#EXTRACTION} failure is attached.</p>
 */
@Log4j2
public class FormattingExtractor {

    private final LlmClient llmClient;
    private final PromptTemplates prompts;
    private final FormattingSchemaFactory schemaFactory;

    public FormattingExtractor(LlmClient llmClient, PromptTemplates prompts, FormattingSchemaFactory schemaFactory) {
        this.llmClient = llmClient;
        this.prompts = prompts;
        this.schemaFactory = schemaFactory;
    }

    public StageResult<Map<String, Object>> extract(String instruction, DocumentKind kind) {
        DocumentKind target = kind != null ? kind : DocumentKind.WORD;
        if (instruction == null || instruction.isBlank()) {
            return StageResult.success(new LinkedHashMap<>());
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("format", target.label().toUpperCase(Locale.ROOT));
        variables.put("instruction", instruction);
        variables.put("properties", schemaFactory.describeProperties(target));
        variables.put("pageNote", target == DocumentKind.PDF ? ", margins and page size apply to every page" : "");

        try {
            Map<?, ?> answer = llmClient.invokeStructured(prompts.render("extract-formatting", variables),
                    schemaFactory.schemaFor(target), Map.class);
            Map<String, Object> preferences = new LinkedHashMap<>();
            if (answer != null) {
                answer.forEach((key, value) -> {
                    if (key != null && value != null) {
                        preferences.put(key.toString(), value);
                    }
                });
            }
            log.info("Extracted {} formatting: {}", target.label(), preferences);
            return StageResult.success(preferences);
        } catch (RuntimeException e) {
            log.warn("Failed to extract formatting: {}. Using defaults.", e.getMessage());
            return StageResult.degraded(new LinkedHashMap<>(),
                    StageFailure.of(FailureKind.EXTRACTION, NodeNames.EXTRACT_FORMAT, e));
        }
    }
}
