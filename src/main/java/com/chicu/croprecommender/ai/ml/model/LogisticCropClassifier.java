package com.chicu.croprecommender.ai.ml.model;

import smile.classification.LogisticRegression;

import java.util.Optional;

/**
 * Мультиномиальная логистическая регрессия (Smile). Важности фич не отдаёт.
 */
public class LogisticCropClassifier implements CropClassifier {

    private static final long serialVersionUID = 1L;

    private final LogisticRegression model;
    private final int classCount;

    private LogisticCropClassifier(LogisticRegression model, int classCount) {
        this.model = model;
        this.classCount = classCount;
    }

    public static LogisticCropClassifier fit(double[][] x, int[] y, int classCount,
                                             double lambda, double tolerance, int maxIter) {
        LogisticRegression model = LogisticRegression.fit(x, y, lambda, tolerance, maxIter);
        return new LogisticCropClassifier(model, classCount);
    }

    @Override
    public ModelKind kind() {
        return ModelKind.LOGISTIC_REGRESSION;
    }

    @Override
    public int classCount() {
        return classCount;
    }

    @Override
    public double[] posteriori(double[] scaledFeatures) {
        double[] prob = new double[classCount];
        model.predict(scaledFeatures, prob);
        return prob;
    }

    @Override
    public Optional<double[]> importance() {
        return Optional.empty();
    }
}
