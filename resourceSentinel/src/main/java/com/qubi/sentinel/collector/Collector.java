package com.qubi.sentinel.collector;

import com.qubi.sentinel.config.AppConfig;
import com.qubi.sentinel.core.errors.OrderingException;
import com.qubi.sentinel.core.errors.StoreException;
import com.qubi.sentinel.core.errors.ValidationException;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.model.ResourceReading;
import com.qubi.sentinel.core.spi.MetricsProvider;
import com.qubi.sentinel.core.spi.SampleListener;
import com.qubi.sentinel.core.spi.SampleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Muestrea el provider cada {@code intervalMs} y hace append al store.
 *
 * <p>Fallos del provider (error o timeout) y muestras rechazadas por el store se loguean y
 * el loop sigue. Un {@link StoreException} detiene el collector y se reporta al fatal handler.
 */
public class Collector implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Collector.class);

    // --- Config
    private final MetricsProvider provider;
    private final SampleStore store;
    private final AppConfig.CollectorConfig cfg;
    private final Clock clock;

    // --- Runtime
    private volatile SampleListener listener = s -> {};
    private volatile Consumer<Throwable> fatalHandler = t -> {};

    private volatile ScheduledExecutorService scheduler;
    private volatile ExecutorService sampler;
    private volatile boolean stopped;

    private final AtomicLong collected = new AtomicLong();
    private final AtomicLong skipped   = new AtomicLong();
    private final AtomicLong rejected  = new AtomicLong();

    public Collector(MetricsProvider provider, SampleStore store, AppConfig.CollectorConfig cfg, Clock clock) {
        this.provider = provider;
        this.store = store;
        this.cfg = cfg;
        this.clock = clock;
        this.sampler = newSampler();
    }

    // --- Setters
    public Collector setListener(SampleListener l) { this.listener = (l != null) ? l : (s -> {}); return this; }
    public Collector setFatalHandler(Consumer<Throwable> h) { this.fatalHandler = (h != null) ? h : (t -> {}); return this; }

    // --- Lifecycle
    public synchronized void start() {
        if (stopped) throw new IllegalStateException("collector already stopped");
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sentinel-collector");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::tick, 0, cfg.intervalMs, TimeUnit.MILLISECONDS);
        log.info("[start] collector interval={}ms providerTimeout={}ms", cfg.intervalMs, cfg.providerTimeoutMs);
    }

    /**
     * Deja de agendar ticks, espera hasta {@code shutdownGraceMs} el tick en vuelo y después
     * lo interrumpe. El store no se cierra acá: es de quien lo abrió.
     */
    @Override
    public synchronized void close() {
        if (stopped) return;
        stopped = true;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(cfg.shutdownGraceMs, TimeUnit.MILLISECONDS)) {
                    log.warn("[stop] in-flight tick did not finish within {}ms, abandoning it", cfg.shutdownGraceMs);
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        sampler.shutdownNow();
        log.info("[stop] collected={} skipped={} rejected={}", collected.get(), skipped.get(), rejected.get());
    }

    public boolean isRunning() {
        return scheduler != null && !stopped;
    }

    // --- Tick

    /**
     * Un tick nunca deja escapar una excepción: el scheduler cancelaría las ejecuciones
     * siguientes sin avisar. Sólo un {@link StoreException} detiene el loop.
     */
    void tick() {
        if (stopped) return;
        try {
            collectOnce();
        } catch (StoreException e) {
            log.error("[tick] store failure, stopping collector", e);
            stopped = true;
            if (scheduler != null) scheduler.shutdown();
            sampler.shutdownNow();
            fatalHandler.accept(e);
        } catch (RuntimeException e) {
            skipped.incrementAndGet();
            log.warn("[tick] unexpected failure, skipping: {}", e.toString());
        }
    }

    private void collectOnce() {
        ResourceReading reading;
        try {
            reading = sampleWithTimeout();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (TimeoutException e) {
            skipped.incrementAndGet();
            log.warn("[tick] provider did not answer within {}ms, skipping", cfg.providerTimeoutMs);
            return;
        } catch (Exception e) {
            skipped.incrementAndGet();
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[tick] provider failed, skipping: {}", cause.toString());
            return;
        }
        if (reading == null) {
            skipped.incrementAndGet();
            log.warn("[tick] provider returned no reading, skipping");
            return;
        }

        MetricSample sample = MetricSample.of(clock.instant(), reading);
        try {
            store.append(sample);
            collected.incrementAndGet();
        } catch (ValidationException | OrderingException e) {
            rejected.incrementAndGet();
            log.warn("[tick] sample discarded: {}", e.getMessage());
            return;
        }

        try {
            listener.onSample(sample);
        } catch (RuntimeException e) {
            log.warn("[tick] listener failed for sample at {}: {}", sample.timestamp(), e.toString());
        }
    }

    private ResourceReading sampleWithTimeout() throws Exception {
        Future<ResourceReading> f;
        try {
            f = sampler.submit(provider::sample);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("sampler is shut down", e);
        }
        try {
            return f.get(cfg.providerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            // el provider colgado ocupa el hilo: se descarta y se crea otro
            sampler.shutdownNow();
            if (!stopped) sampler = newSampler();
            throw e;
        }
    }

    private static ExecutorService newSampler() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sentinel-sampler");
            t.setDaemon(true);
            return t;
        });
    }

    // --- Métricas
    public long getCollected(){ return collected.get(); }
    public long getSkipped(){ return skipped.get(); }
    public long getRejected(){ return rejected.get(); }
}
