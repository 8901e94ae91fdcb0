package com.queryforge.api;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class HealthResponse {
    private boolean ok;
    private String provider;
    private boolean apiKeyConfigured;
    private OffsetDateTime timestamp;
}
