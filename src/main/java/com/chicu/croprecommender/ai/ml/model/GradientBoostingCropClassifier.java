package com.chicu.croprecommender.ai.ml.model;

import smile.classification.GradientTreeBoost;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.data.vector.IntVector;

import java.util.Optional;

/**
 * Градиентный бустинг деревьев (Smile GradientTreeBoost).
 */
public class GradientBoostingCropClassifier implements CropClassifier {

    private static final long serialVersionUID = 1L;

    static final String LABEL_COLUMN = "label";

    private final GradientTreeBoost model;
    private final String[] featureNames;
    private final int classCount;

    private GradientBoostingCropClassifier(GradientTreeBoost model, String[] featureNames, int classCount) {
        this.model = model;
        this.featureNames = featureNames.clone();
        this.classCount = classCount;
    }

    public static GradientBoostingCropClassifier fit(double[][] x, int[] y, String[] featureNames, int classCount,
                                                     int trees, int maxDepth, int maxNodes, int nodeSize,
                                                     double shrinkage, double subsample) {
        DataFrame frame = frame(x, y, featureNames);
        GradientTreeBoost model = GradientTreeBoost.fit(
                Formula.lhs(LABEL_COLUMN), frame,
                trees, maxDepth, maxNodes, nodeSize, shrinkage, subsample
        );
        return new GradientBoostingCropClassifier(model, featureNames, classCount);
    }

    @Override
    public ModelKind kind() {
        return ModelKind.GRADIENT_BOOSTING;
    }

    @Override
    public int classCount() {
        return classCount;
    }

    @Override
    public double[] posteriori(double[] scaledFeatures) {
        // Кадр той же структуры, что и при обучении; метка-заглушка не участвует в предсказании.
        DataFrame row = frame(new double[][]{scaledFeatures}, new int[]{0}, featureNames);
        double[] prob = new double[classCount];
        model.predict(row.get(0), prob);
        return prob;
    }

    @Override
    public Optional<double[]> importance() {
        return Optional.of(model.importance().clone());
    }

    private static DataFrame frame(double[][] x, int[] y, String[] featureNames) {
        return DataFrame.of(x, featureNames).merge(IntVector.of(LABEL_COLUMN, y));
    }
}
