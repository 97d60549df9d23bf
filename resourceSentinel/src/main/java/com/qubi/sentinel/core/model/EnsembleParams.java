package com.qubi.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EnsembleParams(
        @JsonProperty("estimators") int estimators,
        @JsonProperty("subsample_size") int subsampleSize,   // efectivo: min(configurado, n)
        @JsonProperty("max_depth") int maxDepth,
        @JsonProperty("seed") long seed
) {}
