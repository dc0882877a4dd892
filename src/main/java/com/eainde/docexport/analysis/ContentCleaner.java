package com.eainde.docexport.analysis;

import com.eainde.docexport.llm.LlmClient;
import com.eainde.docexport.llm.PromptTemplates;
import com.eainde.docexport.nodes.NodeNames;
import com.eainde.docexport.state.FailureKind;
import com.eainde.docexport.state.StageFailure;
import com.eainde.docexport.state.StageResult;
import lombok.extern.log4j.Log4j2;

import java.util.Map;

/**
 * Strips chat-style meta-commentary (follow-up questions, offers of help, pleasantries) from
 * text before it is exported. Never drops content: on failure the original text is returned.
 */
@Log4j2
public class ContentCleaner {

    private final LlmClient llmClient;
    private final PromptTemplates prompts;

    public ContentCleaner(LlmClient llmClient, PromptTemplates prompts) {
        this.llmClient = llmClient;
        this.prompts = prompts;
    }

    public StageResult<String> clean(String sourceText) {
        if (sourceText == null || sourceText.isBlank()) {
            return StageResult.success(sourceText == null ? "" : sourceText);
        }
        try {
            String cleaned = llmClient.invoke(prompts.render("clean-content", Map.of("text", sourceText)));
            if (cleaned == null || cleaned.isBlank()) {
                throw new IllegalStateException("Cleaner returned an empty text");
            }
            cleaned = cleaned.strip();
            log.info("Cleaned content: {} -> {} characters", sourceText.length(), cleaned.length());
            return StageResult.success(cleaned);
        } catch (RuntimeException e) {
            log.warn("Content cleaning failed: {}. Keeping original text.", e.getMessage());
            return StageResult.degraded(sourceText, StageFailure.of(FailureKind.CLEANING, NodeNames.CLEAN, e));
        }
    }
}
