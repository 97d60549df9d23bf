package com.qubi.sentinel;

import com.qubi.sentinel.config.AppConfig;
import com.qubi.sentinel.core.errors.SentinelException;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.spi.SampleStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class TestSamples {
    private TestSamples(){}

    public static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    /** n muestras cada 10s: cpu 20±2, mem 40±1, disk 60±0.5. */
    public static List<MetricSample> narrowSeries(int n, long seed) {
        Random r = new Random(seed);
        List<MetricSample> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new MetricSample(T0.plusSeconds(10L * i),
                    18 + 4 * r.nextDouble(),
                    39 + 2 * r.nextDouble(),
                    59.5 + r.nextDouble()));
        }
        return out;
    }

    public static MetricSample at(int index, double cpu, double mem, double disk) {
        return new MetricSample(T0.plusSeconds(10L * index), cpu, mem, disk);
    }

    public static void fill(SampleStore store, List<MetricSample> samples) {
        for (MetricSample s : samples) {
            try {
                store.append(s);
            } catch (SentinelException e) {
                throw new AssertionError("fixture sample rejected: " + s, e);
            }
        }
    }

    public static AppConfig.TrainingConfig training(Path modelDir) {
        AppConfig.TrainingConfig t = new AppConfig.TrainingConfig();
        t.modelDir = modelDir.toString();
        t.minSamples = 100;
        t.windowSize = 10_000;
        t.contamination = 0.05;
        t.estimators = 100;
        t.subsampleSize = 256;
        t.seed = 42;
        t.budgetMs = 30_000;
        return t;
    }

    /** Reloj fijo en el timestamp de la última muestra. */
    public static Clock clockAt(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    /** Reloj que avanza {@code stepMs} en cada lectura. */
    public static final class SteppingClock extends Clock {
        private Instant next;
        private final long stepMs;

        public SteppingClock(Instant start, long stepMs) { this.next = start; this.stepMs = stepMs; }

        @Override public synchronized Instant instant() {
            Instant now = next;
            next = next.plusMillis(stepMs);
            return now;
        }
        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
    }
}
