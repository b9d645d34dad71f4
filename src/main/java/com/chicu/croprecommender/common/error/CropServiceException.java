package com.chicu.croprecommender.common.error;

/**
 * Базовое исключение сервиса рекомендаций.
 * HTTP-статус определяет ApiErrorHandler по конкретному типу.
 */
public abstract class CropServiceException extends RuntimeException {

    protected CropServiceException(String message) {
        super(message);
    }

    protected CropServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
