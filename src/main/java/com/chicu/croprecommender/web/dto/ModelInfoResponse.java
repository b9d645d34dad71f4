package com.chicu.croprecommender.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
public record ModelInfoResponse(
        @JsonProperty("model_name") String modelName,
        @JsonProperty("model_kind") String modelKind,
        @JsonProperty("model_version") String modelVersion,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("features") List<String> features,
        @JsonProperty("feature_count") int featureCount,
        @JsonProperty("supported_crops") List<String> supportedCrops,
        @JsonProperty("class_count") int classCount,
        @JsonProperty("accuracy") Double accuracy,
        @JsonProperty("metrics") ModelMetricsDto metrics
) {}
