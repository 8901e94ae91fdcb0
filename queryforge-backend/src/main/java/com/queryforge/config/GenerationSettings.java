package com.queryforge.config;

import com.queryforge.model.Dialect;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only generation settings resolved from properties or environment variables.
 *
 * @param supportedDialects dialect labels accepted by the generator (case-sensitive)
 * @param rowLimitMax upper bound for a caller-supplied row limit
 * @param defaultRowLimit row limit used when the caller supplies none
 * @param defaultModel model used when the caller supplies none
 * @param availableModels models offered to clients
 * @param temperature sampling temperature passed to the provider
 */
public record GenerationSettings(
        List<String> supportedDialects,
        int rowLimitMax,
        int defaultRowLimit,
        String defaultModel,
        List<String> availableModels,
        double temperature
) {

    public static final int DEFAULT_ROW_LIMIT_MAX = 50000;
    public static final int DEFAULT_ROW_LIMIT = 1000;
    public static final String DEFAULT_MODEL = "gpt-3.5-turbo";
    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final List<String> DEFAULT_MODELS = List.of(
            "gpt-3.5-turbo",
            "gpt-3.5-turbo-16k",
            "gpt-4",
            "gpt-4-turbo-preview",
            "gpt-4o",
            "gpt-4o-mini"
    );

    public GenerationSettings {
        supportedDialects = List.copyOf(supportedDialects);
        availableModels = List.copyOf(availableModels);
    }

    /**
     * Settings with every built-in default.
     */
    public static GenerationSettings defaults() {
        return new GenerationSettings(
                Dialect.labels(),
                DEFAULT_ROW_LIMIT_MAX,
                DEFAULT_ROW_LIMIT,
                DEFAULT_MODEL,
                DEFAULT_MODELS,
                DEFAULT_TEMPERATURE
        );
    }

    public static GenerationSettings fromEnvironment(Environment environment) {
        return new GenerationSettings(
                EnvironmentValues.getList(environment,
                        "queryforge.generation.supported-dialects", "QUERYFORGE_SUPPORTED_DIALECTS", Dialect.labels()),
                EnvironmentValues.getInt(environment,
                        "queryforge.generation.row-limit-max", "ROW_LIMIT_MAX", DEFAULT_ROW_LIMIT_MAX),
                EnvironmentValues.getInt(environment,
                        "queryforge.generation.row-limit-default", "ROW_LIMIT_DEFAULT", DEFAULT_ROW_LIMIT),
                EnvironmentValues.getString(environment,
                        "queryforge.generation.default-model", "QUERYFORGE_DEFAULT_MODEL", DEFAULT_MODEL),
                EnvironmentValues.getList(environment,
                        "queryforge.generation.models", "QUERYFORGE_MODELS", DEFAULT_MODELS),
                EnvironmentValues.getDouble(environment,
                        "queryforge.generation.temperature", "QUERYFORGE_TEMPERATURE", DEFAULT_TEMPERATURE)
        );
    }

    /**
     * Configuration problems worth reporting at startup. Dialect labels no rule set knows about are flagged
     * too, since they would silently fall back to relational rules.
     *
     * @return issues, empty when the settings are consistent
     */
    public List<String> validate() {
        List<String> issues = new ArrayList<>();
        if (defaultRowLimit <= 0) {
            issues.add("Row limit default must be positive");
        }
        if (defaultRowLimit > rowLimitMax) {
            issues.add("Row limit default cannot exceed maximum (" + rowLimitMax + ")");
        }
        for (String label : supportedDialects) {
            if (Dialect.fromLabel(label).isEmpty()) {
                issues.add("Supported dialect has no known family: " + label);
            }
        }
        return issues;
    }
}
