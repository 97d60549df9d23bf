package com.qubi.sentinel.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.regex.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public CollectorConfig collector = new CollectorConfig();
    public StoreConfig store = new StoreConfig();
    public TrainingConfig training = new TrainingConfig();

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CollectorConfig {
        /** Intervalo entre ticks (ms). */
        public long intervalMs = 10_000;
        /** Timeout de la llamada al provider del SO (ms). */
        public long providerTimeoutMs = 2_000;
        /** Path cuyo filesystem se mide para disk_percent. */
        public String diskPath = "/";
        /** Espera máxima del tick en vuelo al hacer stop (ms). */
        public long shutdownGraceMs = 5_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        public String path = "data/system_stats.db";
        public String table = "system_stats";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrainingConfig {
        public String modelDir = "models";
        /** Ventana = últimas N muestras. */
        public int windowSize = 10_000;
        /** Si está seteado, ventana = muestras en [now - windowMs, now]; pisa windowSize. */
        public Long windowMs;
        /** Piso de muestras para entrenar. */
        public int minSamples = 300;
        /** Fracción esperada de anomalías, 0 < c < 0.5. */
        public double contamination = 0.05;
        public int estimators = 100;
        public int subsampleSize = 256;
        /** default: ceil(log2(subsample)) */
        public Integer maxDepth;
        public long seed = 42;
        /** Presupuesto de wall-clock para el fit (ms). */
        public long budgetMs = 60_000;
        public long retrainIntervalMs = 3_600_000;
    }

    /**
     * Valida una sola vez al arrancar. Falla con {@link IllegalArgumentException} en el primer
     * valor inválido.
     */
    public AppConfig validate() {
        require(collector != null && store != null && training != null, "collector, store and training sections are required");
        require(collector.intervalMs > 0, "collector.intervalMs must be > 0");
        require(collector.providerTimeoutMs > 0, "collector.providerTimeoutMs must be > 0");
        require(collector.shutdownGraceMs >= 0, "collector.shutdownGraceMs must be >= 0");
        require(notBlank(collector.diskPath), "collector.diskPath is required");

        require(notBlank(store.path), "store.path is required");
        require(store.table != null && TABLE_NAME.matcher(store.table).matches(),
                "store.table must match " + TABLE_NAME.pattern());

        require(notBlank(training.modelDir), "training.modelDir is required");
        require(training.windowSize > 0, "training.windowSize must be > 0");
        require(training.windowMs == null || training.windowMs > 0, "training.windowMs must be > 0");
        require(training.minSamples >= 2, "training.minSamples must be >= 2");
        require(training.contamination > 0 && training.contamination < 0.5,
                "training.contamination must be in (0, 0.5)");
        require(training.estimators > 0, "training.estimators must be > 0");
        require(training.subsampleSize >= 2, "training.subsampleSize must be >= 2");
        require(training.maxDepth == null || training.maxDepth > 0, "training.maxDepth must be > 0");
        require(training.budgetMs > 0, "training.budgetMs must be > 0");
        require(training.retrainIntervalMs > 0, "training.retrainIntervalMs must be > 0");
        return this;
    }

    private static boolean notBlank(String s) { return s != null && !s.isBlank(); }

    private static void require(boolean ok, String message) {
        if (!ok) throw new IllegalArgumentException("invalid configuration: " + message);
    }
}
