package com.eainde.docexport.config;

import com.eainde.docexport.analysis.ContentCleaner;
import com.eainde.docexport.analysis.FormattingExtractor;
import com.eainde.docexport.analysis.FormattingSchemaFactory;
import com.eainde.docexport.analysis.IntentClassifier;
import com.eainde.docexport.engine.DocumentFormattingEngine;
import com.eainde.docexport.engine.FormattingPlanner;
import com.eainde.docexport.engine.SourceTextParser;
import com.eainde.docexport.engine.pdf.PdfDocumentRenderer;
import com.eainde.docexport.engine.word.WordDocumentRenderer;
import com.eainde.docexport.files.ArtifactOpener;
import com.eainde.docexport.files.ArtifactPathAllocator;
import com.eainde.docexport.files.DesktopArtifactOpener;
import com.eainde.docexport.files.TimestampedArtifactPathAllocator;
import com.eainde.docexport.llm.LlmClient;
import com.eainde.docexport.llm.PromptTemplates;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

@Configuration
@EnableConfigurationProperties(ExportProperties.class)
public class ExportConfig {

    @Bean
    public DocumentFormattingEngine documentFormattingEngine(ExportProperties properties,
                                                             ArtifactPathAllocator artifactPathAllocator) {
        return new DocumentFormattingEngine(
                new SourceTextParser(properties.getTitleMaxLength()),
                new FormattingPlanner(),
                artifactPathAllocator,
                List.of(new WordDocumentRenderer(), new PdfDocumentRenderer()));
    }

    @Bean
    @ConditionalOnMissingBean(ArtifactPathAllocator.class)
    public ArtifactPathAllocator artifactPathAllocator(ExportProperties properties) {
        return new TimestampedArtifactPathAllocator(Path.of(properties.getDirectory()), properties.getDefaultBaseName());
    }

    @Bean
    @ConditionalOnMissingBean(ArtifactOpener.class)
    public ArtifactOpener artifactOpener() {
        return new DesktopArtifactOpener();
    }

    @Bean
    public IntentClassifier intentClassifier(LlmClient llmClient, PromptTemplates promptTemplates) {
        return new IntentClassifier(llmClient, promptTemplates);
    }

    @Bean
    public ContentCleaner contentCleaner(LlmClient llmClient, PromptTemplates promptTemplates) {
        return new ContentCleaner(llmClient, promptTemplates);
    }

    @Bean
    public FormattingExtractor formattingExtractor(LlmClient llmClient, PromptTemplates promptTemplates) {
        return new FormattingExtractor(llmClient, promptTemplates, new FormattingSchemaFactory());
    }
}
