package com.chicu.croprecommender.common.error;

import lombok.Getter;

@Getter
public class RetrainInProgressException extends CropServiceException {

    private final String activeJobId;

    public RetrainInProgressException(String activeJobId) {
        super("Model retraining is already in progress (job " + activeJobId + ")");
        this.activeJobId = activeJobId;
    }
}
