package com.eainde.docexport.llm;

import dev.langchain4j.model.input.PromptTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt texts kept under {@code prompts/} on the classpath, rendered with LangChain4j
 * {@code {{variable}}} placeholders.
 */
public class PromptTemplates {

    private final String basePath;
    private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

    public PromptTemplates() {
        this("prompts/");
    }

    public PromptTemplates(String basePath) {
        this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
    }

    public String render(String name, Map<String, Object> variables) {
        return cache.computeIfAbsent(name, this::load).apply(variables).text();
    }

    private PromptTemplate load(String name) {
        String path = basePath + name + ".txt";
        try (InputStream in = PromptTemplates.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Prompt template not found: " + path);
            }
            return PromptTemplate.from(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template " + path, e);
        }
    }
}
