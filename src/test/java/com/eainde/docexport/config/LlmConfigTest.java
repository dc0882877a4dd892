package com.eainde.docexport.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmConfigTest {

    @Test
    void explicitProviderWins() {
        ExportProperties.Llm llm = new ExportProperties.Llm();
        llm.setProvider(" Anthropic ");
        llm.setOpenaiApiKey("sk-test");

        assertThat(LlmConfig.resolveProvider(llm)).isEqualTo("anthropic");
    }

    @Test
    void providerFollowsConfiguredKey() {
        ExportProperties.Llm llm = new ExportProperties.Llm();
        llm.setAnthropicApiKey("ak-test");
        assertThat(LlmConfig.resolveProvider(llm)).isEqualTo("anthropic");

        llm.setOpenaiApiKey("sk-test");
        assertThat(LlmConfig.resolveProvider(llm)).isEqualTo("openai");
    }

    @Test
    void unknownProviderOrNoKeyFails() {
        ExportProperties.Llm llm = new ExportProperties.Llm();
        assertThatThrownBy(() -> LlmConfig.resolveProvider(llm))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No LLM API key");

        llm.setProvider("gemini");
        assertThatThrownBy(() -> LlmConfig.resolveProvider(llm))
                .hasMessage("Unsupported LLM provider: gemini");
    }
}
