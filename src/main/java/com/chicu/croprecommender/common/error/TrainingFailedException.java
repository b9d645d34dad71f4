package com.chicu.croprecommender.common.error;

/**
 * Кандидат отклонён или обучение не удалось. Текущая модель остаётся активной.
 */
public class TrainingFailedException extends CropServiceException {

    public TrainingFailedException(String message) {
        super(message);
    }

    public TrainingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
