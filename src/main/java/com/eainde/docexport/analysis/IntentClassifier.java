package com.eainde.docexport.analysis;

import com.eainde.docexport.llm.JsonSchemaConverter;
import com.eainde.docexport.llm.LlmClient;
import com.eainde.docexport.llm.PromptTemplates;
import com.eainde.docexport.nodes.NodeNames;
import com.eainde.docexport.registry.DocumentKind;
import com.eainde.docexport.state.FailureKind;
import com.eainde.docexport.state.StageFailure;
import com.eainde.docexport.state.StageResult;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import lombok.extern.log4j.Log4j2;

import java.util.Map;

/**
 * Decides whether an instruction asks for an export and which document kind it wants.
 *
 * <p>Any kind label other than {@code word} or {@code pdf} becomes {@link DocumentKind#WORD}.
 * If the model call fails the result degrades to {@link IntentAnalysis#noExport()} with a
 * {@link FailureKind#CLASSIFICATION} failure.</p>
 */
@Log4j2
public class IntentClassifier {

    static final String SCHEMA_RESOURCE = "schemas/export-intent.schema.json";

    private final LlmClient llmClient;
    private final PromptTemplates prompts;
    private final JsonSchema schema;

    public IntentClassifier(LlmClient llmClient, PromptTemplates prompts) {
        this.llmClient = llmClient;
        this.prompts = prompts;
        this.schema = JsonSchemaConverter.fromResource("ExportIntent", SCHEMA_RESOURCE);
    }

    public StageResult<IntentAnalysis> classify(String instruction) {
        String prompt = prompts.render("classify-intent", Map.of("instruction", instruction != null ? instruction : ""));
        try {
            ExportIntentResponse response = llmClient.invokeStructured(prompt, schema, ExportIntentResponse.class);
            if (response == null) {
                throw new IllegalStateException("Classifier returned no answer");
            }

            if (response.format() != null && !DocumentKind.isKnownLabel(response.format())) {
                log.warn("Invalid format detected: {}. Defaulting to word.", response.format());
            }
            IntentAnalysis analysis = new IntentAnalysis(
                    Boolean.TRUE.equals(response.exportIntent()),
                    DocumentKind.fromLabel(response.format()),
                    response.reasoning());
            log.info("Export intent: {}, format: {}", analysis.exportIntent(), analysis.documentKind().label());
            return StageResult.success(analysis);
        } catch (RuntimeException e) {
            log.warn("Failed to classify export request: {}. Defaulting to no export, word.", e.getMessage());
            return StageResult.degraded(IntentAnalysis.noExport(),
                    StageFailure.of(FailureKind.CLASSIFICATION, NodeNames.ANALYZE, e));
        }
    }
}
