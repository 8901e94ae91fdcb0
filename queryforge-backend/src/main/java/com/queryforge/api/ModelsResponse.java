package com.queryforge.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ModelsResponse {
    private List<String> models;
    private List<String> databaseTypes;
}
