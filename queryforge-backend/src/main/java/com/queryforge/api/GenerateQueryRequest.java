package com.queryforge.api;

import lombok.Data;

/**
 * Request DTO for query generation.
 *
 * JSON fields (snake_case):
 * - question: natural-language question
 * - database_type: target dialect label, e.g. "PostgreSQL" or "MongoDB"
 * - model: optional model name
 * - schema_text / schema_id: optional schema, inline or by reference
 * - strict: SELECT-only mode, defaults to true
 * - row_limit: optional row limit
 *
 * Field contents are checked by the generator itself so that its specific rejection reasons reach the client.
 */
@Data
public class GenerateQueryRequest {

    /**
     * Example: "Find all users who registered in the last 30 days"
     */
    private String question;

    private String databaseType;

    private String model;

    private String schemaText;

    private String schemaId;

    private Boolean strict;

    private Integer rowLimit;
}
