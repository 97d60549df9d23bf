package com.qubi.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Media y desvío estándar poblacional por feature, en el orden del feature schema.
 * Los arrays se copian al entrar y al salir: un artefacto publicado no cambia.
 */
public record ScalerParams(
        @JsonProperty("mean") double[] mean,
        @JsonProperty("std") double[] std
) {
    public ScalerParams {
        mean = Objects.requireNonNull(mean, "mean").clone();
        std = Objects.requireNonNull(std, "std").clone();
    }

    @Override public double[] mean() { return mean.clone(); }
    @Override public double[] std() { return std.clone(); }

    public int dimensions() { return mean.length; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalerParams)) return false;
        ScalerParams p = (ScalerParams) o;
        return Arrays.equals(mean, p.mean) && Arrays.equals(std, p.std);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(mean) + Arrays.hashCode(std);
    }

    @Override
    public String toString() {
        return "ScalerParams{mean=" + Arrays.toString(mean) + ", std=" + Arrays.toString(std) + '}';
    }
}
