package com.queryforge.service;

import com.queryforge.config.GenerationSettings;
import com.queryforge.model.GenerationRequest;
import com.queryforge.model.RenderedPrompt;
import com.queryforge.model.SafetyVerdict;
import com.queryforge.model.StoredSchema;
import com.queryforge.provider.CompletionProvider;
import com.queryforge.provider.ProviderException;
import com.queryforge.safety.SafetyValidator;
import com.queryforge.schema.SchemaStore;
import com.queryforge.util.InputSanitizer;
import com.queryforge.util.ResponseCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Turns a natural-language question into a query for the requested dialect.
 *
 * Pipeline: sanitize, validate input, check dialect and provider, check row limit, resolve schema, build the
 * prompt, call the provider, clean the response and, in strict mode, run the safety validator. The first
 * failing step ends the request.
 */
@Service
public class QueryGenerationService {

    private static final Logger log = LoggerFactory.getLogger(QueryGenerationService.class);

    private final CompletionProvider provider;
    private final SchemaStore schemaStore;
    private final GenerationSettings settings;
    private final InputShapeValidator inputValidator;
    private final PromptBuilder promptBuilder;
    private final SafetyValidator safetyValidator;

    public QueryGenerationService(
            CompletionProvider provider,
            SchemaStore schemaStore,
            GenerationSettings settings,
            InputShapeValidator inputValidator,
            PromptBuilder promptBuilder,
            SafetyValidator safetyValidator
    ) {
        this.provider = provider;
        this.schemaStore = schemaStore;
        this.settings = settings;
        this.inputValidator = inputValidator;
        this.promptBuilder = promptBuilder;
        this.safetyValidator = safetyValidator;
    }

    /**
     * Generate a query.
     *
     * @param request generation request
     * @return the query, or the reason no query was produced
     */
    public GenerationResult generate(GenerationRequest request) {
        try {
            GenerationResult result = runPipeline(request);
            if (!result.isSuccess()) {
                log.warn("Query generation rejected (kind={}, dialect={}): {}",
                        result.getErrorKind(), request.getDialect(), result.getError());
            }
            return result;
        } catch (Exception e) {
            log.error("Query generation error", e);
            return GenerationResult.failure(GenerationErrorKind.UNKNOWN, "Generation error: " + e.getMessage());
        }
    }

    private GenerationResult runPipeline(GenerationRequest request) {
        String question = InputSanitizer.sanitize(request.getQuestion());
        String dialect = request.getDialect();

        InputCheck check = inputValidator.validate(question, dialect);
        if (!check.valid()) {
            return GenerationResult.failure(GenerationErrorKind.INPUT_SHAPE, check.reason());
        }

        if (!settings.supportedDialects().contains(dialect)) {
            return GenerationResult.failure(GenerationErrorKind.UNSUPPORTED_DIALECT,
                    "Unsupported database type: " + dialect + ". Supported: "
                            + String.join(", ", settings.supportedDialects()));
        }

        if (!provider.isConfigured()) {
            return GenerationResult.failure(GenerationErrorKind.PROVIDER_NOT_CONFIGURED,
                    provider.name() + " API key not configured or invalid");
        }

        Integer rowLimit = request.getRowLimit();
        if (rowLimit != null) {
            if (rowLimit < 1) {
                return GenerationResult.failure(GenerationErrorKind.ROW_LIMIT_OUT_OF_RANGE,
                        "Row limit must be at least 1");
            }
            if (rowLimit > settings.rowLimitMax()) {
                return GenerationResult.failure(GenerationErrorKind.ROW_LIMIT_OUT_OF_RANGE,
                        "Row limit cannot exceed " + settings.rowLimitMax());
            }
        }

        String model = request.getModel();
        if (model == null || model.isBlank()) {
            model = settings.defaultModel();
        }

        String schemaContent = request.getSchemaText();
        if ((schemaContent == null || schemaContent.isBlank())
                && request.getSchemaId() != null && !request.getSchemaId().isBlank()) {
            Optional<StoredSchema> stored = schemaStore.lookup(request.getSchemaId());
            if (stored.isEmpty()) {
                return GenerationResult.failure(GenerationErrorKind.SCHEMA_NOT_FOUND,
                        "Schema with ID " + request.getSchemaId() + " not found");
            }
            schemaContent = stored.get().getContent();
        }

        int resolvedRowLimit = rowLimit != null ? rowLimit : settings.defaultRowLimit();
        RenderedPrompt prompt = promptBuilder.build(
                question, dialect, schemaContent, request.isStrict(), resolvedRowLimit);

        String raw;
        try {
            raw = provider.complete(model, prompt.toMessages(), settings.temperature());
        } catch (ProviderException e) {
            return GenerationResult.failure(GenerationErrorKind.PROVIDER_CALL, e.getMessage());
        }

        String query = ResponseCleaner.clean(raw);

        if (request.isStrict()) {
            SafetyVerdict verdict = safetyValidator.validate(query, dialect, true);
            if (!verdict.safe()) {
                return GenerationResult.unsafe(
                        "Query contains unsafe operations: " + String.join("; ", verdict.violations()),
                        verdict.violations());
            }
        }

        log.info("Generated query (dialect={}, model={}, strict={}, row_limit={})",
                dialect, model, request.isStrict(), resolvedRowLimit);
        return GenerationResult.success(query);
    }

    /**
     * @return models clients may choose from
     */
    public List<String> availableModels() {
        return provider.availableModels();
    }

    public boolean isConfigured() {
        return provider.isConfigured();
    }

    public String providerName() {
        return provider.name();
    }

    public List<String> supportedDialects() {
        return settings.supportedDialects();
    }
}
