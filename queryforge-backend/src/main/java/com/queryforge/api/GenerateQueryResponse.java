package com.queryforge.api;

import lombok.Builder;
import lombok.Data;

/**
 * Response DTO for a successfully generated query.
 */
@Data
@Builder
public class GenerateQueryResponse {

    /**
     * Generated query: SQL text, or a JSON aggregation pipeline for MongoDB.
     */
    private String sql;

    private String databaseType;
    private String model;
    private boolean strict;

    /**
     * Trace ID for request correlation. Matches the X-Request-Id header value.
     */
    private String traceId;
}
