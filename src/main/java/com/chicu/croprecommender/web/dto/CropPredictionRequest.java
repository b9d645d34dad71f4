package com.chicu.croprecommender.web.dto;

import com.chicu.croprecommender.ai.ml.features.RawSample;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Тело /predict. Пример:
 * {"N":90,"P":42,"K":43,"temperature":20.87,"humidity":82.0,"ph":6.5,"rainfall":202.9}
 */
public record CropPredictionRequest(
        @JsonProperty("N") Double n,
        @JsonProperty("P") Double p,
        @JsonProperty("K") Double k,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("humidity") Double humidity,
        @JsonProperty("ph") Double ph,
        @JsonProperty("rainfall") Double rainfall
) {

    public RawSample toSample() {
        return new RawSample(n, p, k, temperature, humidity, ph, rainfall);
    }
}
