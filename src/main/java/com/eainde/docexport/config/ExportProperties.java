package com.eainde.docexport.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/** Configuration properties for document export. */
@ConfigurationProperties(prefix = "export")
@Getter
@Setter
public class ExportProperties {

    /** Directory artifacts are written to. Created on first use. */
    private String directory = System.getProperty("user.home") + "/Documents/Exports";

    /** Open each finished artifact with the desktop's default application. */
    private boolean autoOpen = false;

    /** File name stem used when a request gives no custom name. */
    private String defaultBaseName = "export";

    private int titleMaxLength = 100;

    private Llm llm = new Llm();

    @Getter
    @Setter
    public static class Llm {

        /** {@code openai}, {@code anthropic} or empty to pick from whichever API key is set. */
        private String provider;
        private String openaiApiKey;
        private String anthropicApiKey;

        /** Empty uses the provider's default model. */
        private String modelName;
        private Double temperature = 0.0;
        private Duration timeout = Duration.ofSeconds(60);
        private Integer maxRetries = 2;
    }
}
