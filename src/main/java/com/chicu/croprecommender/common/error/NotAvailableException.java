package com.chicu.croprecommender.common.error;

public class NotAvailableException extends CropServiceException {

    public NotAvailableException(String message) {
        super(message);
    }
}
