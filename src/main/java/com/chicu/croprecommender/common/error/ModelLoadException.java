package com.chicu.croprecommender.common.error;

/**
 * Артефакты модели отсутствуют или несовместимы. На старте фатально.
 */
public class ModelLoadException extends CropServiceException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
