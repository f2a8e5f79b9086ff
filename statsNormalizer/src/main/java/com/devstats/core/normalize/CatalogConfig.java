package com.devstats.core.normalize;

import com.devstats.core.model.NormalizationOptions;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogConfig(Map<String, StatDefinition> stats) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StatDefinition(
        String endpoint,                      // p.ej. "/mgmt/tm/sys/tmm-info"
        NormalizationOptions normalization    // opcional
    ){}
}
