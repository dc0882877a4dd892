package com.eainde.docexport.llm;

import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Single-prompt access to the configured language model.
 */
public interface LlmClient {

    /**
     * @return the model's plain-text answer
     * @throws LlmServiceException if the model cannot be reached or returns nothing
     */
    String invoke(String prompt);

    /**
     * Asks for a JSON answer matching {@code schema} and binds it to {@code type}.
     *
     * @throws LlmServiceException if the call fails or the answer is not valid JSON for {@code type}
     */
    <T> T invokeStructured(String prompt, JsonSchema schema, Class<T> type);
}
