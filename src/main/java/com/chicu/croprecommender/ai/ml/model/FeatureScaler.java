package com.chicu.croprecommender.ai.ml.model;

/**
 * Стандартизация (x - mean) / scale, параметры считаются только на train-части.
 * Нулевая дисперсия -> scale = 1.
 */
public record FeatureScaler(double[] mean, double[] scale) {

    public FeatureScaler {
        if (mean == null || scale == null || mean.length != scale.length) {
            throw new IllegalArgumentException("mean/scale mismatch");
        }
        mean = mean.clone();
        scale = scale.clone();
    }

    public static FeatureScaler fit(double[][] x) {
        if (x == null || x.length == 0) {
            throw new IllegalArgumentException("cannot fit scaler on empty data");
        }
        int f = x[0].length;
        double[] mean = new double[f];
        double[] scale = new double[f];

        for (double[] row : x) {
            for (int j = 0; j < f; j++) mean[j] += row[j];
        }
        for (int j = 0; j < f; j++) mean[j] /= x.length;

        for (double[] row : x) {
            for (int j = 0; j < f; j++) {
                double d = row[j] - mean[j];
                scale[j] += d * d;
            }
        }
        for (int j = 0; j < f; j++) {
            double std = Math.sqrt(scale[j] / x.length);
            scale[j] = std > 0.0 ? std : 1.0;
        }
        return new FeatureScaler(mean, scale);
    }

    public int size() {
        return mean.length;
    }

    public double[] transform(double[] row) {
        if (row.length != mean.length) {
            throw new IllegalArgumentException("expected " + mean.length + " features, got " + row.length);
        }
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - mean[j]) / scale[j];
        }
        return out;
    }

    public double[][] transform(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) out[i] = transform(rows[i]);
        return out;
    }

    @Override
    public double[] mean() {
        return mean.clone();
    }

    @Override
    public double[] scale() {
        return scale.clone();
    }
}
