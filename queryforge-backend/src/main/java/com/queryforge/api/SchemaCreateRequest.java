package com.queryforge.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Request DTO for saving a schema definition.
 */
@Data
public class SchemaCreateRequest {

    /**
     * Optional id; a new one is generated when absent. Saving with an existing id replaces that schema.
     */
    private String id;

    @NotBlank(message = "Schema name is required")
    @Size(max = 100, message = "Schema name must be at most 100 characters")
    private String name;

    @NotBlank(message = "Database type is required")
    private String databaseType;

    /**
     * Table definitions, column names, relationships; passed to the model verbatim.
     */
    @NotBlank(message = "Schema content is required")
    private String content;
}
