package com.chicu.croprecommender.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record FeatureImportanceResponse(
        @JsonProperty("feature_importance") Map<String, Double> featureImportance,
        @JsonProperty("model_version") String modelVersion
) {}
