package com.chicu.croprecommender.ai.ml.model;

import lombok.Builder;

@Builder
public record ModelMetrics(
        double trainAccuracy,
        double testAccuracy,
        int trainSamples,
        int testSamples,
        int features,
        int classes,
        String datasetId
) {}
