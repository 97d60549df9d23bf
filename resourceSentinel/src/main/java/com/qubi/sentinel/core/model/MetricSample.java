package com.qubi.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Una muestra de utilización del host. Inmutable; el store la valida al hacer append.
 * El timestamp se trunca a milisegundos, que es la resolución de la columna en disco.
 */
public record MetricSample(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("cpu_percent") double cpuPercent,
        @JsonProperty("mem_percent") double memPercent,
        @JsonProperty("disk_percent") double diskPercent
) {
    public static final String CPU = "cpu_percent";
    public static final String MEM = "mem_percent";
    public static final String DISK = "disk_percent";

    /** Orden canónico de features de una muestra. */
    public static final List<String> FEATURES = List.of(CPU, MEM, DISK);

    public MetricSample {
        Objects.requireNonNull(timestamp, "timestamp");
        timestamp = timestamp.truncatedTo(ChronoUnit.MILLIS);
    }

    public static MetricSample of(Instant ts, ResourceReading reading) {
        return new MetricSample(ts, reading.cpuPercent(), reading.memPercent(), reading.diskPercent());
    }

    public Map<String, Double> features() {
        Map<String, Double> out = new LinkedHashMap<>(4);
        out.put(CPU, cpuPercent);
        out.put(MEM, memPercent);
        out.put(DISK, diskPercent);
        return out;
    }
}
