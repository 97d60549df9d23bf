package com.qubi.sentinel.core.spi;

import com.qubi.sentinel.core.model.ResourceReading;

/**
 * Fuente de utilización del sistema operativo. Cualquier excepción se trata como
 * transitoria: el tick se saltea.
 */
@FunctionalInterface
public interface MetricsProvider {
    ResourceReading sample() throws Exception;
}
