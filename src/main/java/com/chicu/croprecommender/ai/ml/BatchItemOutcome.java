package com.chicu.croprecommender.ai.ml;

import com.chicu.croprecommender.common.error.CropServiceException;

/**
 * Исход одного элемента батча: либо result, либо error.
 */
public record BatchItemOutcome(
        int index,
        PredictionResult result,
        CropServiceException error
) {

    public static BatchItemOutcome ok(int index, PredictionResult result) {
        return new BatchItemOutcome(index, result, null);
    }

    public static BatchItemOutcome failed(int index, CropServiceException error) {
        return new BatchItemOutcome(index, null, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
