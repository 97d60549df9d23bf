package com.qubi.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Resultado de puntuar una muestra. {@code score} está en (0,1]; más alto = más anómalo.
 */
public record AnomalyScore(
        @JsonProperty("sample_timestamp") Instant sampleTimestamp,
        @JsonProperty("score") double score,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("anomaly") boolean anomaly,
        @JsonProperty("model_version") long modelVersion
) {}
