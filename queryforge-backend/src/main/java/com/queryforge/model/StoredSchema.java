package com.queryforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A saved database schema definition that generation requests can reference by id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredSchema {
    private String id;
    private String name;
    private String databaseType;
    private String content;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
