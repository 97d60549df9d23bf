package com.qubi.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AnomalySummary(
        @JsonProperty("from") Instant from,
        @JsonProperty("to") Instant to,
        @JsonProperty("samples") int samples,
        @JsonProperty("anomalies") int anomalies,
        @JsonProperty("model_version") long modelVersion
) {
    public double anomalyFraction() {
        return samples == 0 ? 0.0 : (double) anomalies / samples;
    }
}
