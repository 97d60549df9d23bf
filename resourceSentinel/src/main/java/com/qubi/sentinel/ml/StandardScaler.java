package com.qubi.sentinel.ml;

import com.qubi.sentinel.core.model.ScalerParams;

/**
 * Z-score por feature: (x - media) / desvío. Un feature de varianza cero queda fijo en 0.
 */
public final class StandardScaler {
    private StandardScaler(){}

    // desvíos por debajo de esto (relativo a la media) son ruido de redondeo, no varianza
    private static final double ZERO_VARIANCE_EPS = 1e-12;

    public static ScalerParams fit(double[][] rows) {
        if (rows.length == 0) throw new IllegalArgumentException("cannot fit scaler on an empty dataset");
        int d = rows[0].length;
        double[] mean = new double[d];
        double[] std = new double[d];
        for (double[] r : rows)
            for (int j = 0; j < d; j++) mean[j] += r[j];
        for (int j = 0; j < d; j++) mean[j] /= rows.length;

        for (double[] r : rows)
            for (int j = 0; j < d; j++) {
                double dev = r[j] - mean[j];
                std[j] += dev * dev;
            }
        for (int j = 0; j < d; j++) {
            std[j] = Math.sqrt(std[j] / rows.length);
            if (std[j] <= ZERO_VARIANCE_EPS * Math.max(1.0, Math.abs(mean[j]))) std[j] = 0.0;
        }
        return new ScalerParams(mean, std);
    }

    public static double[] transform(ScalerParams p, double[] x) {
        if (x.length != p.dimensions())
            throw new IllegalArgumentException("expected " + p.dimensions() + " features, got " + x.length);
        double[] mean = p.mean();
        double[] std = p.std();
        double[] out = new double[x.length];
        for (int j = 0; j < x.length; j++)
            out[j] = std[j] == 0.0 ? 0.0 : (x[j] - mean[j]) / std[j];
        return out;
    }

    public static double[][] transform(ScalerParams p, double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) out[i] = transform(p, rows[i]);
        return out;
    }
}
