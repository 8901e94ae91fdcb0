package com.queryforge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryforge.provider.CompletionProvider;
import com.queryforge.provider.OpenAiCompletionProvider;
import com.queryforge.provider.OpenAiSettings;
import com.queryforge.schema.FileSchemaStore;
import com.queryforge.schema.SchemaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Paths;
import java.util.List;

/**
 * Wires the generator's collaborators from the Spring environment.
 */
@Configuration
public class QueryForgeConfig {

    private static final Logger log = LoggerFactory.getLogger(QueryForgeConfig.class);

    @Bean
    public GenerationSettings generationSettings(Environment environment) {
        GenerationSettings settings = GenerationSettings.fromEnvironment(environment);
        List<String> issues = settings.validate();
        if (issues.isEmpty()) {
            log.info("Generation settings loaded (dialects={}, default_model={}, row_limit_default={}, row_limit_max={})",
                    settings.supportedDialects(), settings.defaultModel(),
                    settings.defaultRowLimit(), settings.rowLimitMax());
        } else {
            issues.forEach(issue -> log.warn("Configuration issue: {}", issue));
        }
        return settings;
    }

    @Bean
    public OpenAiSettings openAiSettings(Environment environment) {
        return OpenAiSettings.fromEnvironment(environment);
    }

    @Bean
    public CompletionProvider completionProvider(ObjectMapper objectMapper, OpenAiSettings openAiSettings,
                                                 GenerationSettings generationSettings) {
        return new OpenAiCompletionProvider(objectMapper, openAiSettings, generationSettings);
    }

    @Bean
    public SchemaStore schemaStore(ObjectMapper objectMapper, Environment environment) {
        String dir = EnvironmentValues.getString(environment,
                "queryforge.storage.dir", "QUERYFORGE_STORAGE_DIR", "storage");
        return new FileSchemaStore(objectMapper, Paths.get(dir));
    }
}
