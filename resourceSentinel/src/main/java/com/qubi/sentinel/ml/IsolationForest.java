package com.qubi.sentinel.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * Ensemble de árboles de aislamiento. El score es {@code 2^(-E[h(x)] / c(psi))} con psi el
 * tamaño de submuestra: cercano a 1 = anómalo, bastante por debajo de 0.5 = normal.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int subsampleSize;
    private final double normalizer;

    public IsolationForest(List<IsolationTree> trees, int subsampleSize) {
        if (trees.isEmpty()) throw new IllegalArgumentException("forest needs at least one tree");
        this.trees = List.copyOf(trees);
        this.subsampleSize = subsampleSize;
        this.normalizer = IsolationTree.averagePathLength(subsampleSize);
    }

    /**
     * Entrena sobre {@code data} (filas ya escaladas). Todo el azar sale de {@code random},
     * así que la misma semilla y los mismos datos dan el mismo bosque. Corta con
     * {@link CancellationException} si el hilo es interrumpido.
     */
    public static IsolationForest fit(double[][] data, int estimators, int subsampleSize, int maxDepth,
                                      Random random) {
        if (data.length < 2) throw new IllegalArgumentException("need at least 2 points, got " + data.length);
        int psi = Math.min(subsampleSize, data.length);
        List<IsolationTree> trees = new ArrayList<>(estimators);
        for (int t = 0; t < estimators; t++) {
            if (Thread.currentThread().isInterrupted())
                throw new CancellationException("interrupted after " + t + " trees");
            trees.add(IsolationTree.grow(subsample(data, psi, random), maxDepth, random));
        }
        return new IsolationForest(trees, psi);
    }

    public static int defaultMaxDepth(int subsampleSize) {
        return Math.max(1, (int) Math.ceil(Math.log(subsampleSize) / Math.log(2)));
    }

    public double meanPathLength(double[] x) {
        double sum = 0.0;
        for (IsolationTree t : trees) sum += t.pathLength(x);
        return sum / trees.size();
    }

    public double score(double[] x) {
        if (normalizer <= 0) return 0.5;
        return Math.pow(2.0, -meanPathLength(x) / normalizer);
    }

    public double[] scoreAll(double[][] rows) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) out[i] = score(rows[i]);
        return out;
    }

    public List<IsolationTree> trees() { return trees; }
    public int subsampleSize() { return subsampleSize; }

    // Fisher-Yates parcial sobre índices, sin reemplazo
    private static double[][] subsample(double[][] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i]; indices[i] = indices[j]; indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
