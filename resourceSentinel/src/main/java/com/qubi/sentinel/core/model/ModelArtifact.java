package com.qubi.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qubi.sentinel.ml.IsolationTree;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Salida versionada de un entrenamiento: scaler + ensemble + umbral. Inmutable; una
 * versión nueva la reemplaza, nunca se modifica en el lugar.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelArtifact {
    public static final int FORMAT_VERSION = 1;

    private final int formatVersion;
    private final long version;
    private final Instant trainedAt;
    private final int trainingSamples;
    private final List<String> featureSchema;
    private final ScalerParams scaler;
    private final EnsembleParams ensemble;
    private final double contamination;
    private final double scoreThreshold;
    private final List<IsolationTree> trees;

    @JsonCreator
    public ModelArtifact(
            @JsonProperty(value = "format_version", required = true) int formatVersion,
            @JsonProperty(value = "version", required = true) long version,
            @JsonProperty(value = "trained_at", required = true) Instant trainedAt,
            @JsonProperty("training_samples") int trainingSamples,
            @JsonProperty(value = "feature_schema", required = true) List<String> featureSchema,
            @JsonProperty(value = "scaler", required = true) ScalerParams scaler,
            @JsonProperty(value = "ensemble", required = true) EnsembleParams ensemble,
            @JsonProperty("contamination") double contamination,
            @JsonProperty("score_threshold") double scoreThreshold,
            @JsonProperty(value = "trees", required = true) List<IsolationTree> trees
    ) {
        this.formatVersion = formatVersion;
        this.version = version;
        this.trainedAt = Objects.requireNonNull(trainedAt, "trainedAt");
        this.trainingSamples = trainingSamples;
        this.featureSchema = List.copyOf(Objects.requireNonNull(featureSchema, "featureSchema"));
        this.scaler = Objects.requireNonNull(scaler, "scaler");
        this.ensemble = Objects.requireNonNull(ensemble, "ensemble");
        this.contamination = contamination;
        this.scoreThreshold = scoreThreshold;
        this.trees = List.copyOf(Objects.requireNonNull(trees, "trees"));
    }

    @JsonProperty("format_version") public int formatVersion() { return formatVersion; }
    @JsonProperty("version") public long version() { return version; }
    @JsonProperty("trained_at") public Instant trainedAt() { return trainedAt; }
    @JsonProperty("training_samples") public int trainingSamples() { return trainingSamples; }
    @JsonProperty("feature_schema") public List<String> featureSchema() { return featureSchema; }
    @JsonProperty("scaler") public ScalerParams scaler() { return scaler; }
    @JsonProperty("ensemble") public EnsembleParams ensemble() { return ensemble; }
    @JsonProperty("contamination") public double contamination() { return contamination; }
    @JsonProperty("score_threshold") public double scoreThreshold() { return scoreThreshold; }
    @JsonProperty("trees") public List<IsolationTree> trees() { return trees; }

    @Override
    public String toString() {
        return "ModelArtifact{version=" + version + ", trainedAt=" + trainedAt
                + ", samples=" + trainingSamples + ", schema=" + featureSchema
                + ", trees=" + trees.size() + ", threshold=" + scoreThreshold + '}';
    }
}
