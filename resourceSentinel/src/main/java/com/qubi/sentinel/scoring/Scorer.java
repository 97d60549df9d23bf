package com.qubi.sentinel.scoring;

import com.qubi.sentinel.core.errors.ModelNotReadyException;
import com.qubi.sentinel.core.errors.SchemaMismatchException;
import com.qubi.sentinel.core.model.AnomalyScore;
import com.qubi.sentinel.core.model.AnomalySummary;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.model.ModelArtifact;
import com.qubi.sentinel.core.runtime.ModelHandle;
import com.qubi.sentinel.core.spi.SampleStore;
import com.qubi.sentinel.ml.IsolationForest;
import com.qubi.sentinel.ml.StandardScaler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Clasifica muestras contra el artefacto activo del {@link ModelHandle}. Sin estado propio
 * mutable salvo un cache del bosque del último artefacto visto.
 */
public class Scorer {

    private final ModelHandle handle;
    private final SampleStore store;

    private volatile Compiled compiled;

    private record Compiled(ModelArtifact artifact, IsolationForest forest) {}

    public Scorer(ModelHandle handle, SampleStore store) {
        this.handle = handle;
        this.store = store;
    }

    public AnomalyScore score(MetricSample sample) throws ModelNotReadyException, SchemaMismatchException {
        return score(sample.timestamp(), sample.features());
    }

    /**
     * Puntúa un vector de features con nombre. Las claves (y su orden) tienen que coincidir
     * exactamente con el {@code feature_schema} del modelo.
     */
    public AnomalyScore score(Instant timestamp, Map<String, Double> features)
            throws ModelNotReadyException, SchemaMismatchException {
        return score(active(), timestamp, features);
    }

    /** Consulta el store y puntúa cada muestra contra un mismo artefacto. */
    public List<AnomalyScore> scoreRange(Instant start, Instant end)
            throws ModelNotReadyException, SchemaMismatchException {
        Compiled model = active();
        List<MetricSample> samples = store.query(start, end);
        List<AnomalyScore> out = new ArrayList<>(samples.size());
        for (MetricSample s : samples) out.add(score(model, s.timestamp(), s.features()));
        return out;
    }

    public AnomalySummary summarize(Instant start, Instant end)
            throws ModelNotReadyException, SchemaMismatchException {
        Compiled model = active();
        List<MetricSample> samples = store.query(start, end);
        int anomalies = 0;
        for (MetricSample s : samples)
            if (score(model, s.timestamp(), s.features()).anomaly()) anomalies++;
        return new AnomalySummary(start, end, samples.size(), anomalies, model.artifact().version());
    }

    // ===== Helpers =====

    private static AnomalyScore score(Compiled model, Instant ts, Map<String, Double> features)
            throws SchemaMismatchException {
        ModelArtifact a = model.artifact();
        List<String> schema = a.featureSchema();
        List<String> names = List.copyOf(features.keySet());
        if (!schema.equals(names)) throw new SchemaMismatchException(schema, names);

        double[] x = new double[schema.size()];
        for (int j = 0; j < x.length; j++) {
            Double v = features.get(schema.get(j));
            if (v == null) throw new SchemaMismatchException(schema, names);
            x[j] = v;
        }
        double s = model.forest().score(StandardScaler.transform(a.scaler(), x));
        return new AnomalyScore(ts, s, a.scoreThreshold(), s > a.scoreThreshold(), a.version());
    }

    private Compiled active() throws ModelNotReadyException {
        ModelArtifact a = handle.current().orElseThrow(ModelNotReadyException::new);
        Compiled c = compiled;
        if (c == null || c.artifact() != a) {
            c = new Compiled(a, new IsolationForest(a.trees(), a.ensemble().subsampleSize()));
            compiled = c;
        }
        return c;
    }
}
