package com.chicu.croprecommender.ai.ml.features;

import java.util.function.Function;

/**
 * Семь сырых полей с допустимыми диапазонами (включительно).
 */
public enum AgronomicField {
    N("N", 0, 200, RawSample::n),
    P("P", 0, 200, RawSample::p),
    K("K", 0, 250, RawSample::k),
    TEMPERATURE("temperature", 0, 50, RawSample::temperature),
    HUMIDITY("humidity", 0, 100, RawSample::humidity),
    PH("ph", 0, 14, RawSample::ph),
    RAINFALL("rainfall", 0, 400, RawSample::rainfall);

    private final String key;
    private final double min;
    private final double max;
    private final Function<RawSample, Double> accessor;

    AgronomicField(String key, double min, double max, Function<RawSample, Double> accessor) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public Double read(RawSample sample) {
        return accessor.apply(sample);
    }
}
