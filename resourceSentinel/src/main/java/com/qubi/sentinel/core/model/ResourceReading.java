package com.qubi.sentinel.core.model;

public record ResourceReading(
        double cpuPercent,    // 0..100
        double memPercent,    // memoria física usada
        double diskPercent    // espacio usado del path configurado
) {}
