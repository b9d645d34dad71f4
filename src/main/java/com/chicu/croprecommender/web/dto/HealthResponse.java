package com.chicu.croprecommender.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("model_loaded") boolean modelLoaded,
        @JsonProperty("model_version") String modelVersion,
        @JsonProperty("retrain_running") boolean retrainRunning,
        @JsonProperty("timestamp") String timestamp
) {}
