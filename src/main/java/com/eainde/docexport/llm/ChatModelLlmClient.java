package com.eainde.docexport.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link LlmClient} over a LangChain4j {@link ChatModel}.
 *
 * <p>Structured calls use the native JSON-schema response format when the model advertises
 * {@link Capability#RESPONSE_FORMAT_JSON_SCHEMA}. Other models get the expected fields appended
 * to the prompt instead. Either way the answer is parsed with Jackson after stripping any
 * Markdown code fence the model wrapped it in.</p>
 */
@Log4j2
@RequiredArgsConstructor
public class ChatModelLlmClient implements LlmClient {

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    @Override
    public String invoke(String prompt) {
        return call(ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .build());
    }

    @Override
    public <T> T invokeStructured(String prompt, JsonSchema schema, Class<T> type) {
        ChatRequest request;
        if (supportsJsonSchema()) {
            request = ChatRequest.builder()
                    .messages(UserMessage.from(prompt))
                    .responseFormat(ResponseFormat.builder()
                            .type(ResponseFormatType.JSON)
                            .jsonSchema(schema)
                            .build())
                    .build();
        } else {
            log.debug("Model does not support JSON schema output, describing {} in the prompt", schema.name());
            request = ChatRequest.builder()
                    .messages(UserMessage.from(prompt + "\n\n" + JsonSchemaConverter.describe(schema)))
                    .build();
        }

        String raw = call(request);
        try {
            return objectMapper.readValue(stripCodeFence(raw), type);
        } catch (JsonProcessingException e) {
            throw new LlmServiceException("Model answer is not valid JSON for " + schema.name() + ": " + e.getOriginalMessage(), e);
        }
    }

    private boolean supportsJsonSchema() {
        return chatModel.supportedCapabilities().contains(Capability.RESPONSE_FORMAT_JSON_SCHEMA);
    }

    private String call(ChatRequest request) {
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new LlmServiceException("LLM call failed: " + e.getMessage(), e);
        }
        AiMessage message = response != null ? response.aiMessage() : null;
        if (message == null || message.text() == null || message.text().isBlank()) {
            throw new LlmServiceException("LLM returned an empty answer");
        }
        return message.text();
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        Matcher matcher = CODE_FENCE.matcher(trimmed);
        return matcher.matches() ? matcher.group(1) : trimmed;
    }
}
