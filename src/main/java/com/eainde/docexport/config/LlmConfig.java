package com.eainde.docexport.config;

import com.eainde.docexport.llm.ChatModelLlmClient;
import com.eainde.docexport.llm.LlmCallLoggingListener;
import com.eainde.docexport.llm.LlmClient;
import com.eainde.docexport.llm.PromptTemplates;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Wires the chat model the export stages talk to. The provider is taken from
 * {@code export.llm.provider} or, when unset, from whichever API key is configured
 * (OpenAI first, then Anthropic).
 */
@Log4j2
@Configuration
public class LlmConfig {

    static final String DEFAULT_OPENAI_MODEL = "gpt-3.5-turbo";
    static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-5-sonnet-20241022";

    @Bean
    public ChatModelListener llmCallLoggingListener() {
        return new LlmCallLoggingListener();
    }

    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel chatModel(ExportProperties properties, List<ChatModelListener> listeners) {
        ExportProperties.Llm llm = properties.getLlm();
        String provider = resolveProvider(llm);
        log.info("Using {} chat model", provider);

        if ("anthropic".equals(provider)) {
            return AnthropicChatModel.builder()
                    .apiKey(llm.getAnthropicApiKey())
                    .modelName(hasText(llm.getModelName()) ? llm.getModelName() : DEFAULT_ANTHROPIC_MODEL)
                    .temperature(llm.getTemperature())
                    .timeout(llm.getTimeout())
                    .maxRetries(llm.getMaxRetries())
                    .listeners(listeners)
                    .build();
        }
        return OpenAiChatModel.builder()
                .apiKey(llm.getOpenaiApiKey())
                .modelName(hasText(llm.getModelName()) ? llm.getModelName() : DEFAULT_OPENAI_MODEL)
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout())
                .maxRetries(llm.getMaxRetries())
                .supportedCapabilities(Set.of(Capability.RESPONSE_FORMAT_JSON_SCHEMA))
                .strictJsonSchema(false)
                .listeners(listeners)
                .build();
    }

    @Bean
    public LlmClient llmClient(ChatModel chatModel, ObjectMapper objectMapper) {
        return new ChatModelLlmClient(chatModel, objectMapper);
    }

    @Bean
    public PromptTemplates promptTemplates() {
        return new PromptTemplates();
    }

    /**
     * @throws IllegalStateException if no provider is named and no API key is configured
     */
    static String resolveProvider(ExportProperties.Llm llm) {
        if (hasText(llm.getProvider())) {
            String provider = llm.getProvider().trim().toLowerCase(Locale.ROOT);
            if (!provider.equals("openai") && !provider.equals("anthropic")) {
                throw new IllegalStateException("Unsupported LLM provider: " + llm.getProvider());
            }
            return provider;
        }
        if (hasText(llm.getOpenaiApiKey())) {
            return "openai";
        }
        if (hasText(llm.getAnthropicApiKey())) {
            return "anthropic";
        }
        throw new IllegalStateException(
                "No LLM API key configured. Set export.llm.openai-api-key or export.llm.anthropic-api-key.");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
