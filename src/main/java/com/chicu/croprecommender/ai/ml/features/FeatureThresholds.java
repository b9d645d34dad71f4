package com.chicu.croprecommender.ai.ml.features;

/**
 * Фиксированные пороги категориальных фич.
 * Одни и те же константы используются при обучении и при инференсе;
 * артефакт трансформации хранит их копию и сверяется при загрузке.
 */
public final class FeatureThresholds {

    /** Правые границы корзин осадков (мм): Low ≤ 50 < Medium ≤ 100 < High ≤ 200 < VeryHigh. */
    private static final double[] RAINFALL_BINS = {50.0, 100.0, 200.0};

    /** pH < 5.5: кислая почва. */
    public static final double PH_ACIDIC_BELOW = 5.5;

    /** pH ≤ 7.5: нейтральная, выше щелочная. */
    public static final double PH_NEUTRAL_MAX = 7.5;

    public static final int RAINFALL_LOW = 0;
    public static final int RAINFALL_MEDIUM = 1;
    public static final int RAINFALL_HIGH = 2;
    public static final int RAINFALL_VERY_HIGH = 3;

    public static final int PH_ACIDIC = 0;
    public static final int PH_NEUTRAL = 1;
    public static final int PH_ALKALINE = 2;

    private FeatureThresholds() {
    }

    public static double[] rainfallBins() {
        return RAINFALL_BINS.clone();
    }

    public static int rainfallLevel(double rainfall) {
        for (int i = 0; i < RAINFALL_BINS.length; i++) {
            if (rainfall <= RAINFALL_BINS[i]) return i;
        }
        return RAINFALL_VERY_HIGH;
    }

    public static int phCategory(double ph) {
        if (ph < PH_ACIDIC_BELOW) return PH_ACIDIC;
        if (ph <= PH_NEUTRAL_MAX) return PH_NEUTRAL;
        return PH_ALKALINE;
    }

    /** THI = temperature * humidity / 100. */
    public static double temperatureHumidityIndex(double temperature, double humidity) {
        return temperature * humidity / 100.0;
    }
}
