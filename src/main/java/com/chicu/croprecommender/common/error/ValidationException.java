package com.chicu.croprecommender.common.error;

import lombok.Getter;

/**
 * Ошибка входных данных, исправимая на стороне клиента.
 * field: имя поля, bound: нарушенная граница (или "required"/"finite").
 */
@Getter
public class ValidationException extends CropServiceException {

    private final String field;
    private final String bound;

    public ValidationException(String field, String bound, String message) {
        super(message);
        this.field = field;
        this.bound = bound;
    }

    public static ValidationException missing(String field) {
        return new ValidationException(field, "required", "Field '" + field + "' is required");
    }

    public static ValidationException notFinite(String field, double value) {
        return new ValidationException(field, "finite",
                "Field '" + field + "' must be a finite number, got " + value);
    }

    public static ValidationException outOfRange(String field, double value, double min, double max) {
        boolean below = value < min;
        String bound = below ? ">= " + fmt(min) : "<= " + fmt(max);
        return new ValidationException(field, bound,
                "Field '" + field + "' must be " + bound + " (allowed range [" + fmt(min) + ", " + fmt(max)
                        + "]), got " + value);
    }

    private static String fmt(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
