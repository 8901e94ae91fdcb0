package com.queryforge.service;

import com.queryforge.model.Dialect;
import com.queryforge.model.DialectFamily;
import com.queryforge.model.RenderedPrompt;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders the system and user instruction blocks sent to the model.
 *
 * Line order and wording of the user block are what the model is tuned against; keep them stable.
 */
@Component
public class PromptBuilder {

    public static final int DEFAULT_ROW_LIMIT = 1000;

    static final String SYSTEM_PROMPT = """
            You are QueryForge, a professional SQL/NoSQL query generator.

            CRITICAL RULES:
            1. Generate ONLY the requested query - no explanations, markdown, or extra text
            2. Return valid, executable SQL/MongoDB aggregation pipelines
            3. Use proper syntax for the specified database type
            4. Include appropriate JOINs for related tables when needed
            5. Always add LIMIT clauses to prevent excessive data retrieval
            6. Use parameterized query patterns when possible
            7. Optimize for performance and readability

            SAFETY REQUIREMENTS:
            - In strict mode, generate ONLY SELECT statements
            - Never generate DDL (CREATE, DROP, ALTER) or DML (INSERT, UPDATE, DELETE) unless explicitly requested
            - Avoid system functions and administrative operations
            - Use proper escaping for string literals

            QUALITY STANDARDS:
            - Use consistent formatting and indentation
            - Include meaningful column aliases
            - Use appropriate aggregate functions
            - Handle NULL values appropriately
            - Follow database-specific best practices""";

    /**
     * Build both prompt blocks.
     *
     * @param question sanitized question
     * @param dialect dialect label as supplied by the caller
     * @param schemaContent schema definition, may be null or blank
     * @param strict whether strict (SELECT-only) mode applies
     * @param rowLimit row limit, {@value #DEFAULT_ROW_LIMIT} when null
     * @return rendered prompt
     */
    public RenderedPrompt build(String question, String dialect, String schemaContent, boolean strict, Integer rowLimit) {
        return new RenderedPrompt(SYSTEM_PROMPT, buildUserPrompt(question, dialect, schemaContent, strict, rowLimit));
    }

    String buildUserPrompt(String question, String dialect, String schemaContent, boolean strict, Integer rowLimit) {
        int limit = rowLimit != null ? rowLimit : DEFAULT_ROW_LIMIT;

        List<String> lines = new ArrayList<>();
        lines.add("Database Type: " + dialect);
        lines.add("Question: " + question);

        if (schemaContent != null && !schemaContent.isBlank()) {
            lines.add("");
            lines.add("Database Schema:");
            lines.add(schemaContent.trim());
        }

        lines.add("");
        lines.add("Mode: " + (strict ? "strict mode (SELECT-only)" : "flexible mode"));
        lines.add("Row Limit: " + limit);

        Optional<DialectFamily> family = Dialect.fromLabel(dialect).map(Dialect::getFamily);
        if (family.isPresent()) {
            lines.add("");
            if (family.get() == DialectFamily.DOCUMENT) {
                lines.add("Generate a MongoDB aggregation pipeline as a JSON array.");
                lines.add("Use proper MongoDB operators and syntax.");
                lines.add("Include $limit stage at the end.");
            } else {
                lines.add("Generate a " + dialect + " query.");
                lines.add("Use appropriate SQL dialect features.");
                lines.add("Include LIMIT/TOP clause for row limiting.");
                lines.add("Use proper JOIN syntax when accessing multiple tables.");
            }
        }

        lines.add("");
        lines.add("Return ONLY the query without any explanation or formatting.");

        return String.join("\n", lines);
    }
}
