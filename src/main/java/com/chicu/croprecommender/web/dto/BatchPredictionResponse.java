package com.chicu.croprecommender.web.dto;

import com.chicu.croprecommender.ai.ml.BatchItemOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchPredictionResponse(
        @JsonProperty("predictions") List<Item> predictions,
        @JsonProperty("total_predictions") int totalPredictions,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Item(
            @JsonProperty("index") int index,
            @JsonProperty("ok") boolean ok,
            @JsonProperty("result") CropPredictionResponse result,
            @JsonProperty("error") ApiErrorDto error
    ) {}

    public static BatchPredictionResponse from(List<BatchItemOutcome> outcomes) {
        List<Item> items = outcomes.stream()
                .map(o -> o.isOk()
                        ? new Item(o.index(), true, CropPredictionResponse.from(o.result()), null)
                        : new Item(o.index(), false, null, ApiErrorDto.from(o.error())))
                .toList();
        int ok = (int) outcomes.stream().filter(BatchItemOutcome::isOk).count();
        return new BatchPredictionResponse(items, items.size(), ok, items.size() - ok);
    }
}
