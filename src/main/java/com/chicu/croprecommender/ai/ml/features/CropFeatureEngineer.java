package com.chicu.croprecommender.ai.ml.features;

import org.springframework.stereotype.Component;

/**
 * RawSample -> EngineeredFeatureVector.
 * Чистая функция без состояния: общая для обучения и инференса.
 */
@Component
public class CropFeatureEngineer {

    public EngineeredFeatureVector engineer(RawSample raw) {
        RawSampleValidator.validate(raw);

        double n = raw.n();
        double p = raw.p();
        double k = raw.k();
        double temperature = raw.temperature();
        double humidity = raw.humidity();
        double ph = raw.ph();
        double rainfall = raw.rainfall();

        return new EngineeredFeatureVector(
                n, p, k, temperature, humidity, ph, rainfall,
                (n + p + k) / 3.0,
                FeatureThresholds.temperatureHumidityIndex(temperature, humidity),
                FeatureThresholds.rainfallLevel(rainfall),
                FeatureThresholds.phCategory(ph),
                temperature * rainfall,
                ph * rainfall
        );
    }
}
