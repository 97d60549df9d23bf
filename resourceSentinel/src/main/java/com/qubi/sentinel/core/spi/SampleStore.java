package com.qubi.sentinel.core.spi;

import com.qubi.sentinel.core.errors.OrderingException;
import com.qubi.sentinel.core.errors.ValidationException;
import com.qubi.sentinel.core.model.MetricSample;

import java.io.Closeable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Serie temporal append-only. Un único writer, múltiples lectores; los lectores nunca
 * ven una fila a medio escribir. Los errores de I/O salen como
 * {@link com.qubi.sentinel.core.errors.StoreException}.
 */
public interface SampleStore extends Closeable {

    void append(MetricSample sample) throws ValidationException, OrderingException;

    /** Muestras con {@code start <= ts <= end}, ascendente. Vacío si no hay. */
    List<MetricSample> query(Instant start, Instant end);

    /** Las últimas {@code limit} muestras, ascendente. */
    List<MetricSample> latest(int limit);

    long count();

    Optional<Instant> lastTimestamp();

    @Override
    void close();
}
