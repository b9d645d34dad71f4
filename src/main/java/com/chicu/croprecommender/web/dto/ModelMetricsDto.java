package com.chicu.croprecommender.web.dto;

import com.chicu.croprecommender.ai.ml.model.ModelMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ModelMetricsDto(
        @JsonProperty("train_accuracy") double trainAccuracy,
        @JsonProperty("test_accuracy") double testAccuracy,
        @JsonProperty("train_samples") int trainSamples,
        @JsonProperty("test_samples") int testSamples,
        @JsonProperty("features") int features,
        @JsonProperty("classes") int classes,
        @JsonProperty("dataset") String dataset
) {

    public static ModelMetricsDto from(ModelMetrics m) {
        if (m == null) return null;
        return new ModelMetricsDto(
                m.trainAccuracy(),
                m.testAccuracy(),
                m.trainSamples(),
                m.testSamples(),
                m.features(),
                m.classes(),
                m.datasetId()
        );
    }
}
