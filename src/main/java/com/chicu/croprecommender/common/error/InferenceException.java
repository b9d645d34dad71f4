package com.chicu.croprecommender.common.error;

import lombok.Getter;

/**
 * Серверная ошибка инференса.
 * modelUnavailable=true: модели нет вообще (503), иначе модель не дала пригодного ответа (500).
 */
@Getter
public class InferenceException extends CropServiceException {

    private final boolean modelUnavailable;

    public InferenceException(String message) {
        this(message, false, null);
    }

    public InferenceException(String message, Throwable cause) {
        this(message, false, cause);
    }

    private InferenceException(String message, boolean modelUnavailable, Throwable cause) {
        super(message, cause);
        this.modelUnavailable = modelUnavailable;
    }

    public static InferenceException modelNotLoaded() {
        return new InferenceException("Model not loaded", true, null);
    }
}
