package com.chicu.croprecommender.ai.ml;

import lombok.Builder;

import java.util.Map;

/**
 * Результат одного запроса; не сохраняется.
 * allProbabilities: по всем 22 меткам, в порядке меток, сумма = 1.
 */
@Builder
public record PredictionResult(
        String predictedCrop,
        double confidence,
        Map<String, Double> allProbabilities,
        String modelVersion
) {}
