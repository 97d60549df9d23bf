package com.qubi.sentinel.training;

import com.qubi.sentinel.config.AppConfig;
import com.qubi.sentinel.core.errors.InsufficientDataException;
import com.qubi.sentinel.core.model.EnsembleParams;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.model.ModelArtifact;
import com.qubi.sentinel.core.model.ScalerParams;
import com.qubi.sentinel.core.runtime.ModelHandle;
import com.qubi.sentinel.core.spi.ArtifactRepository;
import com.qubi.sentinel.core.spi.SampleStore;
import com.qubi.sentinel.ml.IsolationForest;
import com.qubi.sentinel.ml.StandardScaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.*;

/**
 * Entrena un modelo nuevo sobre la ventana más reciente del store, lo persiste y lo publica
 * en el {@link ModelHandle}. Si algo falla, el artefacto activo queda como estaba.
 */
public class Trainer implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Trainer.class);

    private final SampleStore store;
    private final ArtifactRepository repository;
    private final ModelHandle handle;
    private final AppConfig.TrainingConfig cfg;
    private final Clock clock;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "sentinel-trainer");
        t.setDaemon(true);
        return t;
    });

    public Trainer(SampleStore store, ArtifactRepository repository, ModelHandle handle,
                   AppConfig.TrainingConfig cfg, Clock clock) {
        this.store = store;
        this.repository = repository;
        this.handle = handle;
        this.cfg = cfg;
        this.clock = clock;
    }

    /**
     * Corre un entrenamiento completo. Las llamadas concurrentes se serializan.
     *
     * @throws InsufficientDataException si hay menos de {@code minSamples} muestras o el fit
     *                                   excede {@code budgetMs}
     * @throws IOException               si no se puede persistir el artefacto
     */
    public synchronized ModelArtifact train() throws InsufficientDataException, IOException {
        long available = store.count();
        if (available < cfg.minSamples) throw new InsufficientDataException(available, cfg.minSamples);

        Instant now = clock.instant();
        List<MetricSample> window = cfg.windowMs != null
                ? store.query(now.minusMillis(cfg.windowMs), now)
                : store.latest(cfg.windowSize);
        if (window.size() < cfg.minSamples) throw new InsufficientDataException(window.size(), cfg.minSamples);

        long version = repository.latestVersion() + 1;
        Future<ModelArtifact> job = worker.submit(() -> fit(window, cfg, version, now));
        ModelArtifact artifact;
        try {
            artifact = job.get(cfg.budgetMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            job.cancel(true);
            log.warn("[train] v{} aborted: exceeded budget of {}ms on {} samples", version, cfg.budgetMs, window.size());
            throw new InsufficientDataException("training exceeded budget of " + cfg.budgetMs + "ms");
        } catch (InterruptedException e) {
            job.cancel(true);
            Thread.currentThread().interrupt();
            throw new InsufficientDataException("training interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("training v" + version + " failed", e.getCause());
        }

        repository.save(artifact);
        handle.publish(artifact);
        log.info("[train] published {}", artifact);
        return artifact;
    }

    /**
     * Fit puro: misma ventana + misma semilla = mismo scaler, mismos árboles, mismo umbral.
     */
    static ModelArtifact fit(List<MetricSample> window, AppConfig.TrainingConfig cfg, long version, Instant trainedAt) {
        List<String> schema = MetricSample.FEATURES;
        double[][] raw = new double[window.size()][];
        for (int i = 0; i < raw.length; i++) {
            MetricSample s = window.get(i);
            raw[i] = new double[] { s.cpuPercent(), s.memPercent(), s.diskPercent() };
        }

        ScalerParams scaler = StandardScaler.fit(raw);
        double[][] scaled = StandardScaler.transform(scaler, raw);

        int psi = Math.min(cfg.subsampleSize, scaled.length);
        int maxDepth = cfg.maxDepth != null ? cfg.maxDepth : IsolationForest.defaultMaxDepth(psi);
        IsolationForest forest = IsolationForest.fit(scaled, cfg.estimators, psi, maxDepth, new Random(cfg.seed));

        double threshold = quantile(forest.scoreAll(scaled), 1.0 - cfg.contamination);

        return new ModelArtifact(
                ModelArtifact.FORMAT_VERSION,
                version,
                trainedAt,
                window.size(),
                schema,
                scaler,
                new EnsembleParams(cfg.estimators, psi, maxDepth, cfg.seed),
                cfg.contamination,
                threshold,
                forest.trees());
    }

    /** Cuantil con interpolación lineal entre vecinos. */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
