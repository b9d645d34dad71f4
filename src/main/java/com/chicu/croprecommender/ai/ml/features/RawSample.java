package com.chicu.croprecommender.ai.ml.features;

import lombok.Builder;

/**
 * Сырые агрономические измерения. Поля nullable: отсутствие значения ловит валидатор.
 */
@Builder
public record RawSample(
        Double n,
        Double p,
        Double k,
        Double temperature,   // °C
        Double humidity,      // %
        Double ph,
        Double rainfall       // мм
) {

    public static RawSample of(double n, double p, double k,
                               double temperature, double humidity, double ph, double rainfall) {
        return new RawSample(n, p, k, temperature, humidity, ph, rainfall);
    }
}
