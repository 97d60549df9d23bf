package com.qubi.sentinel.scoring;

import com.qubi.sentinel.TestSamples;
import com.qubi.sentinel.artifact.FileArtifactRepository;
import com.qubi.sentinel.core.errors.ModelNotReadyException;
import com.qubi.sentinel.core.errors.SchemaMismatchException;
import com.qubi.sentinel.core.model.AnomalyScore;
import com.qubi.sentinel.core.model.AnomalySummary;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.model.ModelArtifact;
import com.qubi.sentinel.core.runtime.ModelHandle;
import com.qubi.sentinel.store.SqliteSampleStore;
import com.qubi.sentinel.training.Trainer;
import com.qubi.sentinel.config.AppConfig;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.qubi.sentinel.TestSamples.T0;
import static org.junit.jupiter.api.Assertions.*;

class ScorerTest {

    @TempDir
    Path dir;

    private SqliteSampleStore store;
    private ModelHandle handle;
    private Scorer scorer;

    @BeforeEach
    void setUp() {
        store = SqliteSampleStore.open(dir.resolve("stats.db"), "system_stats");
        handle = new ModelHandle();
        scorer = new Scorer(handle, store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private ModelArtifact train(double contamination) throws Exception {
        AppConfig.TrainingConfig cfg = TestSamples.training(dir.resolve("models"));
        cfg.contamination = contamination;
        try (Trainer t = new Trainer(store, new FileArtifactRepository(dir.resolve("models")), handle, cfg,
                TestSamples.clockAt(store.lastTimestamp().orElseThrow()))) {
            return t.train();
        }
    }

    @Test
    void noModel_isNotReady() {
        MetricSample s = TestSamples.at(0, 20, 40, 60);
        assertThrows(ModelNotReadyException.class, () -> scorer.score(s));
        assertThrows(ModelNotReadyException.class, () -> scorer.scoreRange(T0, T0.plusSeconds(60)));
        assertThrows(ModelNotReadyException.class, () -> scorer.summarize(T0, T0.plusSeconds(60)));
    }

    @Test
    void spikeInsideTrainingWindow_isAnomalousAndNormalSampleIsNot() throws Exception {
        List<MetricSample> series = new ArrayList<>(TestSamples.narrowSeries(500, 21));
        MetricSample spike = TestSamples.at(500, 99.0, 40.0, 60.0);
        series.add(spike);
        TestSamples.fill(store, series);
        ModelArtifact model = train(0.01);

        AnomalyScore s = scorer.score(spike);
        assertTrue(s.anomaly(), "spike score " + s.score() + " threshold " + s.threshold());
        assertEquals(spike.timestamp(), s.sampleTimestamp());
        assertEquals(model.version(), s.modelVersion());

        AnomalyScore normal = scorer.score(TestSamples.at(501, 20.0, 40.0, 60.0));
        assertFalse(normal.anomaly(), "normal score " + normal.score() + " threshold " + normal.threshold());
        assertTrue(normal.score() < s.score());
    }

    @Test
    void score_isIdempotent() throws Exception {
        TestSamples.fill(store, TestSamples.narrowSeries(200, 22));
        train(0.05);
        MetricSample candidate = TestSamples.at(999, 35.0, 41.0, 60.0);

        AnomalyScore first = scorer.score(candidate);
        for (int i = 0; i < 5; i++) assertEquals(first, scorer.score(candidate));
    }

    @Test
    void activeModel_cannotBeRewrittenThroughAccessors() throws Exception {
        TestSamples.fill(store, TestSamples.narrowSeries(200, 28));
        train(0.05);
        MetricSample candidate = TestSamples.at(999, 21.0, 40.5, 60.1);
        AnomalyScore before = scorer.score(candidate);

        ModelArtifact active = handle.current().orElseThrow();
        active.scaler().mean()[0] = 95.0;
        active.scaler().std()[1] = 1e-6;
        active.trees().get(0).split()[0] = -1e9;

        assertEquals(before, scorer.score(candidate));
    }

    @Test
    void featureMap_mustMatchSchemaExactly() throws Exception {
        TestSamples.fill(store, TestSamples.narrowSeries(200, 23));
        train(0.05);

        Map<String, Double> ok = new LinkedHashMap<>();
        ok.put(MetricSample.CPU, 20.0);
        ok.put(MetricSample.MEM, 40.0);
        ok.put(MetricSample.DISK, 60.0);
        assertEquals(scorer.score(TestSamples.at(0, 20.0, 40.0, 60.0)).score(), scorer.score(T0, ok).score());

        Map<String, Double> missing = new LinkedHashMap<>();
        missing.put(MetricSample.CPU, 20.0);
        missing.put(MetricSample.MEM, 40.0);
        SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () -> scorer.score(T0, missing));
        assertEquals(MetricSample.FEATURES, e.expected());
        assertEquals(List.of(MetricSample.CPU, MetricSample.MEM), e.actual());

        Map<String, Double> reordered = new LinkedHashMap<>();
        reordered.put(MetricSample.MEM, 40.0);
        reordered.put(MetricSample.CPU, 20.0);
        reordered.put(MetricSample.DISK, 60.0);
        assertThrows(SchemaMismatchException.class, () -> scorer.score(T0, reordered));

        Map<String, Double> extra = new LinkedHashMap<>(ok);
        extra.put("net_percent", 3.0);
        assertThrows(SchemaMismatchException.class, () -> scorer.score(T0, extra));
    }

    @Test
    void modelWithOtherSchema_rejectsSamples() throws Exception {
        TestSamples.fill(store, TestSamples.narrowSeries(200, 24));
        ModelArtifact a = train(0.05);
        ModelArtifact foreign = new ModelArtifact(a.formatVersion(), a.version() + 1, a.trainedAt(),
                a.trainingSamples(), List.of("cpu_percent", "mem_percent", "gpu_percent"), a.scaler(),
                a.ensemble(), a.contamination(), a.scoreThreshold(), a.trees());
        assertTrue(handle.publish(foreign));

        assertThrows(SchemaMismatchException.class, () -> scorer.score(TestSamples.at(0, 20, 40, 60)));
        assertThrows(SchemaMismatchException.class, () -> scorer.scoreRange(T0, T0.plusSeconds(100)));
    }

    @Test
    void scoreRange_followsStoreOrderWithOneModel() throws Exception {
        List<MetricSample> series = TestSamples.narrowSeries(300, 25);
        TestSamples.fill(store, series);
        ModelArtifact model = train(0.05);

        Instant from = series.get(100).timestamp();
        Instant to = series.get(149).timestamp();
        List<AnomalyScore> scores = scorer.scoreRange(from, to);

        assertEquals(50, scores.size());
        for (int i = 0; i < scores.size(); i++) {
            assertEquals(series.get(100 + i).timestamp(), scores.get(i).sampleTimestamp());
            assertEquals(model.version(), scores.get(i).modelVersion());
        }
        assertTrue(scorer.scoreRange(to, from).isEmpty());
    }

    @Test
    void summarize_countsAnomaliesInRange() throws Exception {
        List<MetricSample> series = TestSamples.narrowSeries(300, 26);
        TestSamples.fill(store, series);
        ModelArtifact model = train(0.05);

        Instant from = series.get(0).timestamp();
        Instant to = series.get(299).timestamp();
        AnomalySummary summary = scorer.summarize(from, to);

        long expected = scorer.scoreRange(from, to).stream().filter(AnomalyScore::anomaly).count();
        assertEquals(300, summary.samples());
        assertEquals(expected, summary.anomalies());
        assertEquals(model.version(), summary.modelVersion());
        assertEquals((double) expected / 300, summary.anomalyFraction(), 1e-12);

        AnomalySummary empty = scorer.summarize(to.plusSeconds(60), to.plusSeconds(120));
        assertEquals(0, empty.samples());
        assertEquals(0.0, empty.anomalyFraction());
    }

    @Test
    void newerModel_isPickedUpByNextScore() throws Exception {
        TestSamples.fill(store, TestSamples.narrowSeries(200, 27));
        ModelArtifact v1 = train(0.05);
        MetricSample candidate = TestSamples.at(999, 20.0, 40.0, 60.0);
        assertEquals(v1.version(), scorer.score(candidate).modelVersion());

        ModelArtifact v2 = train(0.05);
        assertEquals(v2.version(), scorer.score(candidate).modelVersion());
    }
}
