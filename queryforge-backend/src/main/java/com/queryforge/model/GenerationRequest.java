package com.queryforge.model;

import lombok.Builder;
import lombok.Data;

/**
 * Core input of the generation pipeline, independent of the transport it arrived on.
 */
@Data
@Builder
public class GenerationRequest {

    private String question;

    /**
     * Dialect label, e.g. "PostgreSQL" or "MongoDB". Matched case-sensitively against the supported list.
     */
    private String dialect;

    /**
     * Model name; the configured default is used when blank.
     */
    private String model;

    private String schemaText;

    /**
     * Identifier of a stored schema. Ignored when {@link #schemaText} is present.
     */
    private String schemaId;

    @Builder.Default
    private boolean strict = true;

    private Integer rowLimit;
}
