package com.chicu.croprecommender.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchPredictionRequest(
        @JsonProperty("predictions") List<CropPredictionRequest> predictions
) {}
