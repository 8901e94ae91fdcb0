package com.queryforge.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.queryforge.model.GenerationRequest;
import com.queryforge.model.StoredSchema;
import com.queryforge.schema.SchemaStore;
import com.queryforge.service.GenerationErrorKind;
import com.queryforge.service.GenerationResult;
import com.queryforge.service.QueryGenerationService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(QueryForgeController.class)
@DisplayName("QueryForgeController")
class QueryForgeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueryGenerationService generationService;

    @MockBean
    private SchemaStore schemaStore;

    @Nested
    @DisplayName("POST /v1/generate")
    class Generate {

        @Test
        @DisplayName("returns the generated query with a trace id")
        void success() throws Exception {
            when(generationService.generate(any())).thenReturn(GenerationResult.success("SELECT * FROM users LIMIT 1000"));

            mockMvc.perform(post("/v1/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\":\"List users\",\"database_type\":\"PostgreSQL\"}"))
                    .andExpect(status().isOk())
                    .andExpect(header().exists("X-Request-Id"))
                    .andExpect(jsonPath("$.sql").value("SELECT * FROM users LIMIT 1000"))
                    .andExpect(jsonPath("$.database_type").value("PostgreSQL"))
                    .andExpect(jsonPath("$.strict").value(true))
                    .andExpect(jsonPath("$.trace_id").isNotEmpty());
        }

        @Test
        @DisplayName("maps request fields and defaults strict to true")
        void mapsRequest() throws Exception {
            when(generationService.generate(any())).thenReturn(GenerationResult.success("[]"));

            mockMvc.perform(post("/v1/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\":\"Top products\",\"database_type\":\"MongoDB\","
                                    + "\"model\":\"gpt-4o\",\"schema_id\":\"s-1\",\"row_limit\":25}"))
                    .andExpect(status().isOk());

            ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
            verify(generationService).generate(captor.capture());
            GenerationRequest sent = captor.getValue();
            assertThat(sent.getQuestion()).isEqualTo("Top products");
            assertThat(sent.getDialect()).isEqualTo("MongoDB");
            assertThat(sent.getModel()).isEqualTo("gpt-4o");
            assertThat(sent.getSchemaId()).isEqualTo("s-1");
            assertThat(sent.getRowLimit()).isEqualTo(25);
            assertThat(sent.isStrict()).isTrue();
        }

        @Test
        @DisplayName("echoes a client supplied request id")
        void echoesRequestId() throws Exception {
            when(generationService.generate(any())).thenReturn(GenerationResult.success("SELECT 1"));

            mockMvc.perform(post("/v1/generate")
                            .header("X-Request-Id", "req-42")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\":\"q\",\"database_type\":\"MySQL\",\"strict\":false}"))
                    .andExpect(header().string("X-Request-Id", "req-42"))
                    .andExpect(jsonPath("$.trace_id").value("req-42"))
                    .andExpect(jsonPath("$.strict").value(false));
        }

        @Test
        @DisplayName("replaces a request id carrying unsafe characters")
        void replacesUnsafeRequestId() throws Exception {
            when(generationService.generate(any())).thenReturn(GenerationResult.success("SELECT 1"));

            mockMvc.perform(post("/v1/generate")
                            .header("X-Request-Id", "bad id with spaces")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\":\"q\",\"database_type\":\"MySQL\"}"))
                    .andExpect(header().string("X-Request-Id", matchesPattern("[0-9a-f-]{36}")));
        }

        @Test
        @DisplayName("safety violations are listed in the error body")
        void safetyViolation() throws Exception {
            when(generationService.generate(any())).thenReturn(GenerationResult.unsafe(
                    "Query contains unsafe operations: Unsafe SQL keyword detected: DELETE",
                    List.of("Unsafe SQL keyword detected: DELETE")));

            mockMvc.perform(post("/v1/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\":\"Delete all inactive users\",\"database_type\":\"PostgreSQL\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("UNSAFE_QUERY"))
                    .andExpect(jsonPath("$.message").value(
                            "Query contains unsafe operations: Unsafe SQL keyword detected: DELETE"))
                    .andExpect(jsonPath("$.violations[0]").value("Unsafe SQL keyword detected: DELETE"));
        }

        @Test
        @DisplayName("unsupported dialect is a bad request")
        void unsupportedDialect() throws Exception {
            when(generationService.generate(any())).thenReturn(GenerationResult.failure(
                    GenerationErrorKind.UNSUPPORTED_DIALECT, "Unsupported database type: Redis"));

            mockMvc.perform(post("/v1/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\":\"List keys\",\"database_type\":\"Redis\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("UNSUPPORTED_DIALECT"))
                    .andExpect(jsonPath("$.violations").doesNotExist());
        }

        @Test
        @DisplayName("malformed body is rejected without calling the generator")
        void malformedBody() throws Exception {
            mockMvc.perform(post("/v1/generate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));

            verify(generationService, never()).generate(any());
        }
    }

    @Test
    @DisplayName("every error kind maps to an HTTP status")
    void statusMapping() {
        assertThat(QueryForgeController.statusFor(GenerationErrorKind.INPUT_SHAPE)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(QueryForgeController.statusFor(GenerationErrorKind.ROW_LIMIT_OUT_OF_RANGE))
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(QueryForgeController.statusFor(GenerationErrorKind.SCHEMA_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(QueryForgeController.statusFor(GenerationErrorKind.PROVIDER_NOT_CONFIGURED))
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(QueryForgeController.statusFor(GenerationErrorKind.PROVIDER_CALL)).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(QueryForgeController.statusFor(GenerationErrorKind.UNKNOWN))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    @DisplayName("answers CORS preflight requests from browser clients")
    void corsPreflight() throws Exception {
        mockMvc.perform(options("/v1/generate")
                        .header("Origin", "http://localhost:8501")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:8501"))
                .andExpect(header().string("Access-Control-Allow-Methods", "GET,POST,DELETE"));
    }

    @Test
    @DisplayName("GET /v1/health reports provider status")
    void health() throws Exception {
        when(generationService.providerName()).thenReturn("OpenAI");
        when(generationService.isConfigured()).thenReturn(false);

        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.provider").value("OpenAI"))
                .andExpect(jsonPath("$.api_key_configured").value(false))
                .andExpect(jsonPath("$.timestamp").isNotEmpty());
    }

    @Test
    @DisplayName("GET /v1/models lists models and database types")
    void models() throws Exception {
        when(generationService.availableModels()).thenReturn(List.of("gpt-4o", "gpt-4o-mini"));
        when(generationService.supportedDialects()).thenReturn(List.of("PostgreSQL", "MongoDB"));

        mockMvc.perform(get("/v1/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.models[0]").value("gpt-4o"))
                .andExpect(jsonPath("$.database_types[1]").value("MongoDB"));
    }

    @Nested
    @DisplayName("/v1/schemas")
    class Schemas {

        @Test
        @DisplayName("creates a schema")
        void create() throws Exception {
            when(schemaStore.save(any())).thenAnswer(invocation -> {
                StoredSchema schema = invocation.getArgument(0);
                schema.setId("generated-id");
                return schema;
            });

            mockMvc.perform(post("/v1/schemas")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\" shop \",\"database_type\":\"MySQL\","
                                    + "\"content\":\"CREATE TABLE orders (id INT)\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value("generated-id"))
                    .andExpect(jsonPath("$.name").value("shop"))
                    .andExpect(jsonPath("$.database_type").value("MySQL"));
        }

        @Test
        @DisplayName("rejects a schema without content")
        void createInvalid() throws Exception {
            mockMvc.perform(post("/v1/schemas")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"shop\",\"database_type\":\"MySQL\",\"content\":\" \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.details").value("content: Schema content is required"));

            verify(schemaStore, never()).save(any());
        }

        @Test
        @DisplayName("lists schemas")
        void list() throws Exception {
            when(schemaStore.list()).thenReturn(List.of(
                    StoredSchema.builder().id("a").name("alpha").build(),
                    StoredSchema.builder().id("b").name("beta").build()));

            mockMvc.perform(get("/v1/schemas"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].name").value("alpha"))
                    .andExpect(jsonPath("$[1].id").value("b"));
        }

        @Test
        @DisplayName("returns 404 for an unknown schema")
        void getMissing() throws Exception {
            when(schemaStore.lookup("nope")).thenReturn(Optional.empty());

            mockMvc.perform(get("/v1/schemas/nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("SCHEMA_NOT_FOUND"));
        }

        @Test
        @DisplayName("deletes a schema")
        void deleteSchema() throws Exception {
            when(schemaStore.delete("a")).thenReturn(true);
            when(schemaStore.delete("nope")).thenReturn(false);

            mockMvc.perform(delete("/v1/schemas/a"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Schema deleted successfully"));
            mockMvc.perform(delete("/v1/schemas/nope"))
                    .andExpect(status().isNotFound());
        }
    }
}
