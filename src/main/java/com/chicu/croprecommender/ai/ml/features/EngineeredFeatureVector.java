package com.chicu.croprecommender.ai.ml.features;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 13 фич в порядке {@link FeatureSchema#CROP}.
 */
public record EngineeredFeatureVector(
        double n,
        double p,
        double k,
        double temperature,
        double humidity,
        double ph,
        double rainfall,
        double npkAvg,
        double thi,
        double rainfallLevel,
        double phCategory,
        double tempRainfallInteraction,
        double phRainfallInteraction
) {

    public double[] toArray() {
        return new double[]{
                n, p, k, temperature, humidity, ph, rainfall,
                npkAvg, thi, rainfallLevel, phCategory,
                tempRainfallInteraction, phRainfallInteraction
        };
    }

    public Map<String, Double> toMap() {
        String[] names = FeatureSchema.CROP.featureNames();
        double[] values = toArray();
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < names.length; i++) {
            out.put(names[i], values[i]);
        }
        return out;
    }
}
