package com.chicu.croprecommender.common.error;

import lombok.Getter;

@Getter
public class BatchTooLargeException extends CropServiceException {

    private final int size;
    private final int maxSize;

    public BatchTooLargeException(int size, int maxSize) {
        super("Maximum " + maxSize + " predictions per batch, got " + size);
        this.size = size;
        this.maxSize = maxSize;
    }
}
