package com.chicu.croprecommender.web.dto;

import com.chicu.croprecommender.common.error.CropServiceException;
import com.chicu.croprecommender.common.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Ошибка отдельного элемента батча.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorDto(
        String error,
        String message,
        String field,
        String bound
) {

    public static ApiErrorDto from(CropServiceException e) {
        if (e instanceof ValidationException ve) {
            return new ApiErrorDto(e.getClass().getSimpleName(), e.getMessage(), ve.getField(), ve.getBound());
        }
        return new ApiErrorDto(e.getClass().getSimpleName(), e.getMessage(), null, null);
    }
}
