package com.chicu.croprecommender.web.dto;

import com.chicu.croprecommender.ai.ml.PredictionResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record CropPredictionResponse(
        @JsonProperty("predicted_crop") String predictedCrop,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("all_probabilities") Map<String, Double> allProbabilities,
        @JsonProperty("model_version") String modelVersion
) {

    public static CropPredictionResponse from(PredictionResult r) {
        return new CropPredictionResponse(r.predictedCrop(), r.confidence(), r.allProbabilities(), r.modelVersion());
    }
}
