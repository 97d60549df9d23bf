package com.qubi.sentinel.core.runtime;

import com.qubi.sentinel.artifact.FileArtifactRepository;
import com.qubi.sentinel.collector.Collector;
import com.qubi.sentinel.config.AppConfig;
import com.qubi.sentinel.core.errors.InsufficientDataException;
import com.qubi.sentinel.core.errors.ModelNotReadyException;
import com.qubi.sentinel.core.errors.SchemaMismatchException;
import com.qubi.sentinel.core.errors.StoreException;
import com.qubi.sentinel.core.model.AnomalyScore;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.model.ModelArtifact;
import com.qubi.sentinel.core.spi.AnomalyListener;
import com.qubi.sentinel.core.spi.ArtifactRepository;
import com.qubi.sentinel.core.spi.MetricsProvider;
import com.qubi.sentinel.core.spi.SampleStore;
import com.qubi.sentinel.scoring.Scorer;
import com.qubi.sentinel.store.SqliteSampleStore;
import com.qubi.sentinel.training.Trainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Arma el pipeline completo a partir de una {@link AppConfig} validada: store, repositorio de
 * modelos, handle, trainer, scorer y collector. Cada muestra nueva se puntúa al llegar.
 */
public class SentinelRuntime implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(SentinelRuntime.class);

    private final AppConfig config;
    private final SampleStore store;
    private final ModelHandle handle;
    private final Trainer trainer;
    private final Scorer scorer;
    private final Collector collector;

    private volatile AnomalyListener anomalyListener = (s, a) -> {};
    private volatile Consumer<Throwable> fatalHandler = t -> {};
    private ScheduledExecutorService retrainScheduler;
    private volatile boolean closed;

    SentinelRuntime(AppConfig config, SampleStore store, ArtifactRepository repository, ModelHandle handle,
                    MetricsProvider provider, Clock clock) {
        this.config = config;
        this.store = store;
        this.handle = handle;
        this.trainer = new Trainer(store, repository, handle, config.training, clock);
        this.scorer = new Scorer(handle, store);
        this.collector = new Collector(provider, store, config.collector, clock)
                .setListener(this::scoreIncoming)
                .setFatalHandler(this::onFatal);
    }

    /**
     * Abre store y repositorio y carga el último artefacto persistido, si hay.
     */
    public static SentinelRuntime create(AppConfig config, MetricsProvider provider, Clock clock) {
        config.validate();
        ArtifactRepository repository = new FileArtifactRepository(Path.of(config.training.modelDir));
        Optional<ModelArtifact> latest;
        try {
            latest = repository.latest();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot load model from " + config.training.modelDir, e);
        }
        ModelHandle handle = latest.map(ModelHandle::new).orElseGet(ModelHandle::new);
        latest.ifPresent(a -> log.info("[start] loaded {}", a));

        SampleStore store = SqliteSampleStore.open(config.store);
        return new SentinelRuntime(config, store, repository, handle, provider, clock);
    }

    public SentinelRuntime setAnomalyListener(AnomalyListener l) { this.anomalyListener = (l != null) ? l : ((s, a) -> {}); return this; }
    public SentinelRuntime setFatalHandler(Consumer<Throwable> h) { this.fatalHandler = (h != null) ? h : (t -> {}); return this; }

    // --- Lifecycle
    public synchronized void start() {
        if (closed) throw new IllegalStateException("runtime already closed");
        collector.start();
        retrainScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sentinel-retrain");
            t.setDaemon(true);
            return t;
        });
        long interval = config.training.retrainIntervalMs;
        long firstDelay = handle.current().isPresent() ? interval : 0;
        retrainScheduler.scheduleWithFixedDelay(this::retrain, firstDelay, interval, TimeUnit.MILLISECONDS);
        log.info("[start] retrain every {}ms, first in {}ms", interval, firstDelay);
    }

    /**
     * Detiene collector y retrain, espera el reentrenamiento en vuelo y recién después
     * cierra el store.
     */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        collector.close();
        if (retrainScheduler != null) {
            retrainScheduler.shutdownNow();
            try {
                if (!retrainScheduler.awaitTermination(config.collector.shutdownGraceMs, TimeUnit.MILLISECONDS))
                    log.warn("[stop] retrain did not finish within {}ms", config.collector.shutdownGraceMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        trainer.close();
        store.close();
        log.info("[stop] runtime closed");
    }

    // --- Jobs
    void retrain() {
        try {
            trainer.train();
        } catch (InsufficientDataException e) {
            log.info("[train] skipped: {}", e.getMessage());
        } catch (IOException e) {
            log.error("[train] cannot persist model", e);
        } catch (StoreException e) {
            if (closed) log.debug("[train] aborted by shutdown: {}", e.getMessage());
            else onFatal(e);
        } catch (RuntimeException e) {
            log.error("[train] failed", e);
        }
    }

    private void scoreIncoming(MetricSample sample) {
        try {
            AnomalyScore score = scorer.score(sample);
            if (score.anomaly()) {
                log.warn("[anomaly] {} score={} threshold={} model=v{} cpu={} mem={} disk={}",
                        sample.timestamp(), score.score(), score.threshold(), score.modelVersion(),
                        sample.cpuPercent(), sample.memPercent(), sample.diskPercent());
                anomalyListener.onAnomaly(sample, score);
            }
        } catch (ModelNotReadyException e) {
            log.debug("[score] no model yet, sample at {} not scored", sample.timestamp());
        } catch (SchemaMismatchException e) {
            log.error("[score] active model is incompatible with collected samples, retrain required: {}", e.getMessage());
        }
    }

    private void onFatal(Throwable t) {
        log.error("[fatal] {}", t.toString());
        fatalHandler.accept(t);
    }

    // --- Accessors
    public SampleStore store() { return store; }
    public Scorer scorer() { return scorer; }
    public Trainer trainer() { return trainer; }
    public Collector collector() { return collector; }
    public ModelHandle handle() { return handle; }
}
