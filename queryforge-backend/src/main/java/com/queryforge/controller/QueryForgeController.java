package com.queryforge.controller;

import com.queryforge.api.ErrorResponse;
import com.queryforge.api.GenerateQueryRequest;
import com.queryforge.api.GenerateQueryResponse;
import com.queryforge.api.HealthResponse;
import com.queryforge.api.ModelsResponse;
import com.queryforge.api.SchemaCreateRequest;
import com.queryforge.model.GenerationRequest;
import com.queryforge.model.StoredSchema;
import com.queryforge.schema.SchemaStore;
import com.queryforge.service.GenerationErrorKind;
import com.queryforge.service.GenerationResult;
import com.queryforge.service.QueryGenerationService;
import com.queryforge.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class QueryForgeController {

    private final QueryGenerationService generationService;
    private final SchemaStore schemaStore;

    public QueryForgeController(QueryGenerationService generationService, SchemaStore schemaStore) {
        this.generationService = generationService;
        this.schemaStore = schemaStore;
    }

    /**
     * Generate a query from natural language.
     *
     * POST /v1/generate
     *
     * @param request question, database type and generation options
     * @return generated query, or an error naming the failing step
     */
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerateQueryRequest request) {
        boolean strict = request.getStrict() == null || request.getStrict();
        GenerationResult result = generationService.generate(GenerationRequest.builder()
                .question(request.getQuestion())
                .dialect(request.getDatabaseType())
                .model(request.getModel())
                .schemaText(request.getSchemaText())
                .schemaId(request.getSchemaId())
                .strict(strict)
                .rowLimit(request.getRowLimit())
                .build());

        if (!result.isSuccess()) {
            GenerationErrorKind kind = result.getErrorKind();
            return ResponseEntity.status(statusFor(kind)).body(ErrorResponse.builder()
                    .code(kind.getCode())
                    .message(result.getError())
                    .violations(result.getViolations().isEmpty() ? null : result.getViolations())
                    .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                    .build());
        }

        return ResponseEntity.ok(GenerateQueryResponse.builder()
                .sql(result.getQuery())
                .databaseType(request.getDatabaseType())
                .model(request.getModel())
                .strict(strict)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build());
    }

    /**
     * Health check endpoint.
     *
     * GET /v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
                .ok(true)
                .provider(generationService.providerName())
                .apiKeyConfigured(generationService.isConfigured())
                .timestamp(OffsetDateTime.now())
                .build());
    }

    /**
     * List models and database types clients can choose from.
     *
     * GET /v1/models
     */
    @GetMapping("/models")
    public ResponseEntity<ModelsResponse> models() {
        return ResponseEntity.ok(ModelsResponse.builder()
                .models(generationService.availableModels())
                .databaseTypes(generationService.supportedDialects())
                .build());
    }

    /**
     * GET /v1/schemas
     *
     * @return saved schemas, most recently updated first
     */
    @GetMapping("/schemas")
    public ResponseEntity<List<StoredSchema>> listSchemas() {
        return ResponseEntity.ok(schemaStore.list());
    }

    /**
     * GET /v1/schemas/{id}
     */
    @GetMapping("/schemas/{id}")
    public ResponseEntity<?> getSchema(@PathVariable("id") String id) {
        return schemaStore.lookup(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> schemaNotFound(id));
    }

    /**
     * Save a schema definition.
     *
     * POST /v1/schemas
     */
    @PostMapping("/schemas")
    public ResponseEntity<StoredSchema> createSchema(@Valid @RequestBody SchemaCreateRequest request) {
        StoredSchema saved = schemaStore.save(StoredSchema.builder()
                .id(request.getId())
                .name(request.getName().trim())
                .databaseType(request.getDatabaseType().trim())
                .content(request.getContent())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    /**
     * DELETE /v1/schemas/{id}
     */
    @DeleteMapping("/schemas/{id}")
    public ResponseEntity<?> deleteSchema(@PathVariable("id") String id) {
        if (!schemaStore.delete(id)) {
            return schemaNotFound(id);
        }
        return ResponseEntity.ok(Map.of("message", "Schema deleted successfully"));
    }

    private ResponseEntity<?> schemaNotFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                .code(GenerationErrorKind.SCHEMA_NOT_FOUND.getCode())
                .message("Schema with ID " + id + " not found")
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build());
    }

    static HttpStatus statusFor(GenerationErrorKind kind) {
        return switch (kind) {
            case INPUT_SHAPE, UNSUPPORTED_DIALECT, ROW_LIMIT_OUT_OF_RANGE, SAFETY_VIOLATION -> HttpStatus.BAD_REQUEST;
            case SCHEMA_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PROVIDER_NOT_CONFIGURED -> HttpStatus.SERVICE_UNAVAILABLE;
            case PROVIDER_CALL -> HttpStatus.BAD_GATEWAY;
            case UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
