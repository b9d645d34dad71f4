package com.chicu.croprecommender.ai.ml.model;

import com.chicu.croprecommender.ai.ml.features.EngineeredFeatureVector;
import com.chicu.croprecommender.ai.ml.features.FeatureSchema;
import com.chicu.croprecommender.ai.ml.features.FeatureThresholds;

import java.util.Arrays;
import java.util.List;

/**
 * Состояние трансформации фич: схема, зафиксированные пороги и обученный скейлер.
 */
public record FeatureTransform(
        String schemaHash,
        List<String> featureNames,
        double[] rainfallBins,
        double phAcidicBelow,
        double phNeutralMax,
        FeatureScaler scaler
) {

    public FeatureTransform {
        featureNames = List.copyOf(featureNames);
        rainfallBins = rainfallBins.clone();
    }

    public static FeatureTransform of(FeatureSchema schema, FeatureScaler scaler) {
        return new FeatureTransform(
                schema.schemaHash(),
                schema.featureNameList(),
                FeatureThresholds.rainfallBins(),
                FeatureThresholds.PH_ACIDIC_BELOW,
                FeatureThresholds.PH_NEUTRAL_MAX,
                scaler
        );
    }

    public double[] apply(EngineeredFeatureVector vector) {
        return scaler.transform(vector.toArray());
    }

    /** Пороги артефакта совпадают с константами текущей сборки. */
    public boolean matchesCompiledThresholds() {
        return Arrays.equals(rainfallBins, FeatureThresholds.rainfallBins())
                && Double.compare(phAcidicBelow, FeatureThresholds.PH_ACIDIC_BELOW) == 0
                && Double.compare(phNeutralMax, FeatureThresholds.PH_NEUTRAL_MAX) == 0;
    }

    @Override
    public double[] rainfallBins() {
        return rainfallBins.clone();
    }
}
